package com.silverlakesymmetri.cbs.fileConverter.handler.params;

import java.util.List;

public final class NonSpatialConversionParams extends ConversionParams {

	public NonSpatialConversionParams(String resourceId, List<String> targetFormats) {
		super(resourceId, targetFormats);
	}

	@Override
	public boolean isSpatial() {
		return false;
	}

	@Override
	public String toString() {
		return "NonSpatialConversionParams{resourceId=" + getResourceId() + ", targetFormats=" + getTargetFormats() + '}';
	}
}
