package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Single to multi geometry type promotion.
 */
public final class MultiGeometryTypes {

	private static final Map<String, String> MULTI_TYPES;

	static {
		Map<String, String> types = new HashMap<>();
		types.put("Point", "MultiPoint");
		types.put("LineString", "MultiLineString");
		types.put("Polygon", "MultiPolygon");
		types.put("3D Point", "3D MultiPoint");
		types.put("3D LineString", "3D MultiLineString");
		types.put("3D Polygon", "3D MultiPolygon");
		types.put("MultiPoint", "MultiPoint");
		types.put("MultiLineString", "MultiLineString");
		types.put("MultiPolygon", "MultiPolygon");
		types.put("3D MultiPoint", "3D MultiPoint");
		types.put("3D MultiLineString", "3D MultiLineString");
		types.put("3D MultiPolygon", "3D MultiPolygon");
		types.put(GeoJsonGeometry.GEOMETRY_COLLECTION, GeoJsonGeometry.GEOMETRY_COLLECTION);
		types.put(GeoJsonGeometry.GEOMETRY_COLLECTION_3D, GeoJsonGeometry.GEOMETRY_COLLECTION_3D);
		MULTI_TYPES = Collections.unmodifiableMap(types);
	}

	private MultiGeometryTypes() {
	}

	public static boolean isKnown(String type) {
		return MULTI_TYPES.containsKey(type);
	}

	public static String toMulti(String type) {
		String multi = MULTI_TYPES.get(type);
		if (multi == null) {
			throw new SchemaException("Unsupported geometry type: " + type);
		}
		return multi;
	}

	public static boolean isCollection(String type) {
		return GeoJsonGeometry.GEOMETRY_COLLECTION.equals(type)
				|| GeoJsonGeometry.GEOMETRY_COLLECTION_3D.equals(type);
	}

	/**
	 * Strips the {@code 3D } prefix, e.g. {@code 3D MultiPoint} becomes {@code MultiPoint}.
	 */
	public static String baseType(String type) {
		return type.startsWith("3D ") ? type.substring(3) : type;
	}
}
