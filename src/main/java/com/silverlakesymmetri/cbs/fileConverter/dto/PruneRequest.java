package com.silverlakesymmetri.cbs.fileConverter.dto;

public class PruneRequest {

	private String path;

	public PruneRequest() {
	}

	public PruneRequest(String path) {
		this.path = path;
	}

	public String getPath() {
		return path;
	}

	public void setPath(String path) {
		this.path = path;
	}
}
