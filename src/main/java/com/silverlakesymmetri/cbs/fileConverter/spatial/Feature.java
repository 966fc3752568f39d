package com.silverlakesymmetri.cbs.fileConverter.spatial;

import com.silverlakesymmetri.cbs.fileConverter.geometry.GeoJsonGeometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class Feature {

	private final Map<String, Object> properties;
	private final GeoJsonGeometry geometry;

	public Feature(Map<String, Object> properties, GeoJsonGeometry geometry) {
		this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
		this.geometry = geometry;
	}

	public Map<String, Object> getProperties() {
		return properties;
	}

	public GeoJsonGeometry getGeometry() {
		return geometry;
	}
}
