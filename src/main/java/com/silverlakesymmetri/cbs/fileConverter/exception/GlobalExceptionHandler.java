package com.silverlakesymmetri.cbs.fileConverter.exception;

import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Collections;

@RestControllerAdvice
public class GlobalExceptionHandler {

	private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

	@ExceptionHandler(ValidationException.class)
	public ResponseEntity<ConversionResponse> handleValidationException(ValidationException ex) {
		logger.warn("Validation error: {} {}", ex.getMessage(), ex.getConstraints());
		return new ResponseEntity<>(validationResponse(ex), HttpStatus.BAD_REQUEST);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ConversionResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
		logger.warn("Unreadable request body: {}", ex.getMessage());
		ConversionResponse response = new ConversionResponse("VALIDATION_ERROR", "Request body could not be read");
		response.setConstraints(Collections.singletonList(String.valueOf(ex.getMostSpecificCause().getMessage())));
		return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
	}

	@ExceptionHandler(SchemaException.class)
	public ResponseEntity<ConversionResponse> handleSchemaException(SchemaException ex) {
		logger.error("Schema error: {}", ex.getMessage(), ex);
		return new ResponseEntity<>(new ConversionResponse("SCHEMA_ERROR", ex.getMessage()),
				HttpStatus.UNPROCESSABLE_ENTITY);
	}

	@ExceptionHandler(ConversionException.class)
	public ResponseEntity<ConversionResponse> handleConversionException(ConversionException ex) {
		Throwable cause = ex.getCause();
		if (cause instanceof ValidationException) {
			return handleValidationException((ValidationException) cause);
		}
		if (cause instanceof SchemaException) {
			logger.error("Schema error in {}: {}", ex.getHandlerKey(), cause.getMessage(), cause);
			return new ResponseEntity<>(new ConversionResponse("SCHEMA_ERROR", ex.getMessage()),
					HttpStatus.UNPROCESSABLE_ENTITY);
		}
		logger.error("Conversion failed in {}: {}", ex.getHandlerKey(), ex.getMessage(), ex);
		return new ResponseEntity<>(new ConversionResponse("ERROR", ex.getMessage()),
				HttpStatus.INTERNAL_SERVER_ERROR);
	}

	@ExceptionHandler(DatastoreAccessException.class)
	public ResponseEntity<ConversionResponse> handleDatastoreAccessException(DatastoreAccessException ex) {
		logger.error("Datastore access failed: {}", ex.getMessage(), ex);
		return new ResponseEntity<>(new ConversionResponse("DATASTORE_ERROR", ex.getMessage()),
				HttpStatus.INTERNAL_SERVER_ERROR);
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ConversionResponse> handleGlobalException(Exception ex) {
		logger.error("Unexpected error: {}", ex.getMessage(), ex);
		return new ResponseEntity<>(new ConversionResponse("ERROR", "An unexpected error occurred"),
				HttpStatus.INTERNAL_SERVER_ERROR);
	}

	private static ConversionResponse validationResponse(ValidationException ex) {
		ConversionResponse response = new ConversionResponse("VALIDATION_ERROR", ex.getMessage());
		response.setConstraints(ex.getConstraints());
		return response;
	}
}
