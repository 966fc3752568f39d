package com.silverlakesymmetri.cbs.fileConverter.exception;

public class DatastoreAccessException extends RuntimeException {

	public DatastoreAccessException(String message) {
		super(message);
	}

	public DatastoreAccessException(String message, Throwable cause) {
		super(message, cause);
	}
}
