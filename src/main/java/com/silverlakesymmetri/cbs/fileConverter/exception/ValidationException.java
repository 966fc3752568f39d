package com.silverlakesymmetri.cbs.fileConverter.exception;

import java.util.Collections;
import java.util.List;

/**
 * Raised when a conversion request, or the resource it points at, is not acceptable.
 * Always thrown before anything is written to disk.
 */
public class ValidationException extends IllegalArgumentException {

	private final List<String> constraints;

	public ValidationException(String message) {
		this(message, Collections.<String>emptyList());
	}

	public ValidationException(String message, List<String> constraints) {
		super(message);
		this.constraints = constraints == null
				? Collections.<String>emptyList()
				: Collections.unmodifiableList(constraints);
	}

	public List<String> getConstraints() {
		return constraints;
	}
}
