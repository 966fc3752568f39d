package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads the geometry field of a record. Accepts a JSON string, a map with the GeoJSON members,
 * or an already parsed {@link GeoJsonGeometry}. A missing value, or the literal string
 * {@code null}, yields {@code null}.
 */
public class GeometryParser {

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
	};

	private final ObjectMapper objectMapper;

	public GeometryParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public GeoJsonGeometry parse(Object raw) {
		if (raw == null) {
			return null;
		}
		if (raw instanceof GeoJsonGeometry) {
			return (GeoJsonGeometry) raw;
		}
		if (raw instanceof Map) {
			return fromMap((Map<?, ?>) raw);
		}
		String text = raw.toString().trim();
		if (text.isEmpty() || "null".equals(text)) {
			return null;
		}
		try {
			return fromMap(objectMapper.readValue(text, MAP_TYPE));
		} catch (JsonProcessingException e) {
			throw new SchemaException("Geometry is not valid JSON: " + abbreviate(text), e);
		}
	}

	/**
	 * Type of the geometry without parsing its coordinates, or {@code null}.
	 */
	public String peekType(Object raw) {
		GeoJsonGeometry geometry = parse(raw);
		return geometry == null ? null : geometry.getType();
	}

	private GeoJsonGeometry fromMap(Map<?, ?> map) {
		Object type = map.get("type");
		if (type == null) {
			throw new SchemaException("Geometry has no type: " + map);
		}
		String typeName = type.toString();
		if (!MultiGeometryTypes.isKnown(typeName)) {
			throw new SchemaException("Unsupported geometry type: " + typeName);
		}

		if (MultiGeometryTypes.isCollection(typeName)) {
			Object members = map.get("geometries");
			if (!(members instanceof Collection)) {
				throw new SchemaException(typeName + " has no geometries");
			}
			List<GeoJsonGeometry> geometries = new ArrayList<>();
			for (Object member : (Collection<?>) members) {
				if (!(member instanceof Map)) {
					throw new SchemaException("Invalid member of " + typeName + ": " + member);
				}
				geometries.add(fromMap((Map<?, ?>) member));
			}
			return GeoJsonGeometry.collection(typeName, geometries);
		}

		if (!map.containsKey("coordinates") || map.get("coordinates") == null) {
			throw new SchemaException(typeName + " geometry has no coordinates");
		}
		Object coordinates = toNestedList(map.get("coordinates"));
		if (!(coordinates instanceof List)) {
			throw new SchemaException(typeName + " coordinates must be an array: " + coordinates);
		}
		@SuppressWarnings("unchecked")
		List<Object> list = (List<Object>) coordinates;
		return GeoJsonGeometry.of(typeName, list);
	}

	/**
	 * Converts arrays at any depth into lists so every coordinate nesting uses the same shape.
	 */
	static Object toNestedList(Object value) {
		if (value == null) {
			return null;
		}
		if (value instanceof Collection) {
			List<Object> out = new ArrayList<>(((Collection<?>) value).size());
			for (Object item : (Collection<?>) value) {
				out.add(toNestedList(item));
			}
			return out;
		}
		if (value.getClass().isArray()) {
			int length = Array.getLength(value);
			List<Object> out = new ArrayList<>(length);
			for (int i = 0; i < length; i++) {
				out.add(toNestedList(Array.get(value, i)));
			}
			return out;
		}
		return value;
	}

	private static String abbreviate(String text) {
		return text.length() > 80 ? text.substring(0, 80) + "..." : text;
	}
}
