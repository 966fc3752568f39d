package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds JTS geometries from {@link GeoJsonGeometry} values for the binary spatial writers.
 */
public class JtsGeometryConverter {

	private final GeometryFactory factory;

	public JtsGeometryConverter(int srid) {
		this.factory = new GeometryFactory(new PrecisionModel(), srid);
	}

	public Geometry toJts(GeoJsonGeometry geometry) {
		if (geometry == null) {
			return null;
		}
		String type = MultiGeometryTypes.baseType(geometry.getType());
		if (geometry.isCollection()) {
			List<Geometry> members = new ArrayList<>();
			for (GeoJsonGeometry member : geometry.getGeometries()) {
				members.add(toJts(member));
			}
			return factory.createGeometryCollection(members.toArray(new Geometry[0]));
		}

		List<Object> coordinates = geometry.getCoordinates();
		switch (type) {
			case "Point":
				Coordinate point = toCoordinate(coordinates);
				return point == null ? factory.createPoint() : factory.createPoint(point);
			case "MultiPoint":
				List<Point> points = new ArrayList<>();
				for (Object position : coordinates) {
					Coordinate c = toCoordinate(position);
					if (c != null) points.add(factory.createPoint(c));
				}
				return factory.createMultiPoint(points.toArray(new Point[0]));
			case "LineString":
				return factory.createLineString(toCoordinates(coordinates));
			case "MultiLineString":
				List<LineString> lines = new ArrayList<>();
				for (Object line : coordinates) {
					lines.add(factory.createLineString(toCoordinates(line)));
				}
				return factory.createMultiLineString(lines.toArray(new LineString[0]));
			case "Polygon":
				return toPolygon(coordinates);
			case "MultiPolygon":
				List<Polygon> polygons = new ArrayList<>();
				for (Object polygon : coordinates) {
					polygons.add(toPolygon(polygon));
				}
				return factory.createMultiPolygon(polygons.toArray(new Polygon[0]));
			default:
				throw new SchemaException("Unsupported geometry type: " + geometry.getType());
		}
	}

	private Polygon toPolygon(Object rings) {
		List<?> ringList = asList(rings);
		if (ringList.isEmpty()) {
			return factory.createPolygon();
		}
		LinearRing shell = toRing(ringList.get(0));
		LinearRing[] holes = new LinearRing[ringList.size() - 1];
		for (int i = 1; i < ringList.size(); i++) {
			holes[i - 1] = toRing(ringList.get(i));
		}
		return factory.createPolygon(shell, holes);
	}

	private LinearRing toRing(Object ring) {
		Coordinate[] coordinates = toCoordinates(ring);
		if (coordinates.length > 0 && !coordinates[0].equals2D(coordinates[coordinates.length - 1])) {
			Coordinate[] closed = new Coordinate[coordinates.length + 1];
			System.arraycopy(coordinates, 0, closed, 0, coordinates.length);
			closed[coordinates.length] = coordinates[0].copy();
			coordinates = closed;
		}
		return factory.createLinearRing(coordinates);
	}

	private Coordinate[] toCoordinates(Object positions) {
		List<Coordinate> out = new ArrayList<>();
		for (Object position : asList(positions)) {
			Coordinate c = toCoordinate(position);
			if (c != null) out.add(c);
		}
		return out.toArray(new Coordinate[0]);
	}

	private static Coordinate toCoordinate(Object position) {
		List<?> values = asList(position);
		if (values.size() < 2 || !(values.get(0) instanceof Number) || !(values.get(1) instanceof Number)) {
			return null;
		}
		double x = ((Number) values.get(0)).doubleValue();
		double y = ((Number) values.get(1)).doubleValue();
		if (values.size() > 2 && values.get(2) instanceof Number) {
			return new Coordinate(x, y, ((Number) values.get(2)).doubleValue());
		}
		return new Coordinate(x, y);
	}

	private static List<?> asList(Object value) {
		if (value instanceof List) {
			return (List<?>) value;
		}
		throw new SchemaException("Expected a coordinate array but found: " + value);
	}
}
