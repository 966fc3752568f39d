package com.silverlakesymmetri.cbs.fileConverter.exception;

/**
 * Raised when record content does not match what a writer needs, such as a geometry
 * without coordinates or a datastore field type with no geospatial mapping.
 */
public class SchemaException extends IllegalStateException {

	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
