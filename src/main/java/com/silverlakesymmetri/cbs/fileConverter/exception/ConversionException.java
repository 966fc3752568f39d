package com.silverlakesymmetri.cbs.fileConverter.exception;

/**
 * Wraps a failure of a single format handler together with the output key it was producing.
 */
public class ConversionException extends RuntimeException {

	private final String handlerKey;

	public ConversionException(String handlerKey, Throwable cause) {
		super("Conversion failed for " + handlerKey + ": " + cause.getMessage(), cause);
		this.handlerKey = handlerKey;
	}

	public String getHandlerKey() {
		return handlerKey;
	}
}
