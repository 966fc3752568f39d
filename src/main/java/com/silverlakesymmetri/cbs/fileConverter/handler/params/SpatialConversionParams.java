package com.silverlakesymmetri.cbs.fileConverter.handler.params;

import java.util.Collections;
import java.util.List;

public final class SpatialConversionParams extends ConversionParams {

	private final int sourceEpsg;
	private final List<Integer> targetEpsgs;

	public SpatialConversionParams(String resourceId, List<String> targetFormats, int sourceEpsg,
								   List<Integer> targetEpsgs) {
		super(resourceId, targetFormats);
		this.sourceEpsg = sourceEpsg;
		this.targetEpsgs = Collections.unmodifiableList(targetEpsgs);
	}

	public int getSourceEpsg() {
		return sourceEpsg;
	}

	public List<Integer> getTargetEpsgs() {
		return targetEpsgs;
	}

	@Override
	public boolean isSpatial() {
		return true;
	}

	@Override
	public String toString() {
		return "SpatialConversionParams{resourceId=" + getResourceId() + ", targetFormats=" + getTargetFormats()
				+ ", sourceEpsg=" + sourceEpsg + ", targetEpsgs=" + targetEpsgs + '}';
	}
}
