package com.silverlakesymmetri.cbs.fileConverter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResponse {

	private String status;
	private String message;
	private String resourceId;
	private Map<String, String> outputs;
	private Map<String, String> failures;
	private List<String> constraints;

	public ConversionResponse() {
	}

	public ConversionResponse(String status, String message) {
		this.status = status;
		this.message = message;
	}

	public String getStatus() {
		return status;
	}

	public void setStatus(String status) {
		this.status = status;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public String getResourceId() {
		return resourceId;
	}

	public void setResourceId(String resourceId) {
		this.resourceId = resourceId;
	}

	public Map<String, String> getOutputs() {
		return outputs;
	}

	public void setOutputs(Map<String, String> outputs) {
		this.outputs = outputs;
	}

	public Map<String, String> getFailures() {
		return failures;
	}

	public void setFailures(Map<String, String> failures) {
		this.failures = failures;
	}

	public List<String> getConstraints() {
		return constraints;
	}

	public void setConstraints(List<String> constraints) {
		this.constraints = constraints;
	}
}
