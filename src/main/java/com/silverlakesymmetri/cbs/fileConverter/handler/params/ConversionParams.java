package com.silverlakesymmetri.cbs.fileConverter.handler.params;

import java.util.Collections;
import java.util.List;

/**
 * Validated conversion parameters. Exactly one of the two subclasses is produced for a request.
 */
public abstract class ConversionParams {

	private final String resourceId;
	private final List<String> targetFormats;

	protected ConversionParams(String resourceId, List<String> targetFormats) {
		this.resourceId = resourceId;
		this.targetFormats = Collections.unmodifiableList(targetFormats);
	}

	public String getResourceId() {
		return resourceId;
	}

	public List<String> getTargetFormats() {
		return targetFormats;
	}

	public abstract boolean isSpatial();
}
