package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A GeoJSON-shaped geometry: {@code {type, coordinates}}, or {@code {type, geometries}} for
 * collections. Coordinates are nested {@link List}s whose leaves are numbers or nulls.
 */
public final class GeoJsonGeometry {

	public static final String GEOMETRY_COLLECTION = "GeometryCollection";
	public static final String GEOMETRY_COLLECTION_3D = "3D GeometryCollection";

	private final String type;
	private final List<Object> coordinates;
	private final List<GeoJsonGeometry> geometries;

	private GeoJsonGeometry(String type, List<Object> coordinates, List<GeoJsonGeometry> geometries) {
		this.type = Objects.requireNonNull(type, "geometry type");
		this.coordinates = coordinates;
		this.geometries = geometries;
	}

	public static GeoJsonGeometry of(String type, List<Object> coordinates) {
		return new GeoJsonGeometry(type, Collections.unmodifiableList(new ArrayList<>(coordinates)), null);
	}

	public static GeoJsonGeometry collection(String type, List<GeoJsonGeometry> geometries) {
		return new GeoJsonGeometry(type, null, Collections.unmodifiableList(new ArrayList<>(geometries)));
	}

	public String getType() {
		return type;
	}

	public List<Object> getCoordinates() {
		return coordinates;
	}

	public List<GeoJsonGeometry> getGeometries() {
		return geometries;
	}

	public boolean isCollection() {
		return geometries != null;
	}

	@JsonValue
	public Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<>();
		map.put("type", type);
		if (isCollection()) {
			List<Map<String, Object>> members = new ArrayList<>(geometries.size());
			for (GeoJsonGeometry geometry : geometries) {
				members.add(geometry.toMap());
			}
			map.put("geometries", members);
		} else {
			map.put("coordinates", coordinates);
		}
		return map;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GeoJsonGeometry)) return false;
		GeoJsonGeometry that = (GeoJsonGeometry) o;
		return type.equals(that.type)
				&& Objects.equals(coordinates, that.coordinates)
				&& Objects.equals(geometries, that.geometries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, coordinates, geometries);
	}

	@Override
	public String toString() {
		return toMap().toString();
	}
}
