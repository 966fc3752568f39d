package com.silverlakesymmetri.cbs.fileConverter.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class ConversionRequest {

	@JsonProperty("resource_id")
	private String resourceId;

	@JsonProperty("target_formats")
	@JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
	private List<String> targetFormats;

	// Spatial requests only
	@JsonProperty("source_epsg")
	private Integer sourceEpsg;

	@JsonProperty("target_epsgs")
	@JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
	private List<Integer> targetEpsgs;

	public ConversionRequest() {
	}

	public ConversionRequest(String resourceId, List<String> targetFormats) {
		this.resourceId = resourceId;
		this.targetFormats = targetFormats;
	}

	public ConversionRequest(String resourceId, List<String> targetFormats, Integer sourceEpsg,
							 List<Integer> targetEpsgs) {
		this(resourceId, targetFormats);
		this.sourceEpsg = sourceEpsg;
		this.targetEpsgs = targetEpsgs;
	}

	public String getResourceId() {
		return resourceId;
	}

	public void setResourceId(String resourceId) {
		this.resourceId = resourceId;
	}

	public List<String> getTargetFormats() {
		return targetFormats;
	}

	public void setTargetFormats(List<String> targetFormats) {
		this.targetFormats = targetFormats;
	}

	public Integer getSourceEpsg() {
		return sourceEpsg;
	}

	public void setSourceEpsg(Integer sourceEpsg) {
		this.sourceEpsg = sourceEpsg;
	}

	public List<Integer> getTargetEpsgs() {
		return targetEpsgs;
	}

	public void setTargetEpsgs(List<Integer> targetEpsgs) {
		this.targetEpsgs = targetEpsgs;
	}

	@Override
	public String toString() {
		return "ConversionRequest{resourceId=" + resourceId + ", targetFormats=" + targetFormats
				+ ", sourceEpsg=" + sourceEpsg + ", targetEpsgs=" + targetEpsgs + '}';
	}
}
