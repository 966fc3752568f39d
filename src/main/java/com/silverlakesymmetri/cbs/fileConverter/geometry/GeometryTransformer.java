package com.silverlakesymmetri.cbs.fileConverter.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-record geometry normalization for spatial outputs:
 * parse, promote to the Multi type, short-circuit degenerate coordinates, reproject.
 * <p>
 * Degenerate geometries ({@code [0,0]} and {@code [null,null]}) are never handed to the
 * reprojector. When source and target EPSG match the record is still normalized, only the
 * coordinate math is skipped.
 */
public class GeometryTransformer {

	private final GeometryParser parser;
	private final GeometryReprojector reprojector;
	private final int sourceEpsg;
	private final int targetEpsg;

	public GeometryTransformer(GeometryParser parser, GeometryReprojector reprojector,
							   int sourceEpsg, int targetEpsg) {
		this.parser = parser;
		this.reprojector = reprojector;
		this.sourceEpsg = sourceEpsg;
		this.targetEpsg = targetEpsg;
	}

	public GeoJsonGeometry transform(Object rawGeometry) {
		GeoJsonGeometry geometry = parser.parse(rawGeometry);
		if (geometry == null) {
			return null;
		}

		if (geometry.isCollection()) {
			return needsReprojection() ? reprojector.reproject(geometry, sourceEpsg, targetEpsg) : geometry;
		}

		String multiType = MultiGeometryTypes.toMulti(geometry.getType());
		List<Object> coordinates = geometry.getCoordinates();

		if (isNullPosition(coordinates)) {
			return GeoJsonGeometry.of(multiType, Collections.emptyList());
		}
		boolean degenerate = isZeroPosition(coordinates);

		GeoJsonGeometry promoted = geometry;
		if (!multiType.equals(geometry.getType())) {
			List<Object> wrapped = new ArrayList<>(1);
			wrapped.add(coordinates);
			promoted = GeoJsonGeometry.of(multiType, wrapped);
		}

		if (degenerate || !needsReprojection()) {
			return promoted;
		}
		return reprojector.reproject(promoted, sourceEpsg, targetEpsg);
	}

	private boolean needsReprojection() {
		return sourceEpsg != targetEpsg;
	}

	private static boolean isNullPosition(List<Object> coordinates) {
		return coordinates.size() == 2 && coordinates.get(0) == null && coordinates.get(1) == null;
	}

	private static boolean isZeroPosition(List<Object> coordinates) {
		return coordinates.size() == 2 && isZero(coordinates.get(0)) && isZero(coordinates.get(1));
	}

	private static boolean isZero(Object value) {
		return value instanceof Number && ((Number) value).doubleValue() == 0d;
	}
}
