package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.UnknownAuthorityCodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GeometryReprojector} backed by Proj4J and its bundled EPSG registry.
 * <p>
 * Coordinate transforms keep intermediate state, so they are cached per thread.
 */
@Component
public class Proj4jGeometryReprojector implements GeometryReprojector {

	private static final Logger logger = LoggerFactory.getLogger(Proj4jGeometryReprojector.class);

	private final CRSFactory crsFactory = new CRSFactory();
	private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
	private final Map<Integer, CoordinateReferenceSystem> crsCache = new ConcurrentHashMap<>();
	private final ThreadLocal<Map<String, CoordinateTransform>> transforms =
			ThreadLocal.withInitial(HashMap::new);

	@Override
	public GeoJsonGeometry reproject(GeoJsonGeometry geometry, int sourceEpsg, int targetEpsg) {
		if (geometry == null) {
			return null;
		}
		CoordinateTransform transform = transformFor(sourceEpsg, targetEpsg);
		return reproject(geometry, transform);
	}

	private GeoJsonGeometry reproject(GeoJsonGeometry geometry, CoordinateTransform transform) {
		if (geometry.isCollection()) {
			List<GeoJsonGeometry> members = new ArrayList<>(geometry.getGeometries().size());
			for (GeoJsonGeometry member : geometry.getGeometries()) {
				members.add(reproject(member, transform));
			}
			return GeoJsonGeometry.collection(geometry.getType(), members);
		}
		@SuppressWarnings("unchecked")
		List<Object> coordinates = (List<Object>) walk(geometry.getCoordinates(), transform);
		return GeoJsonGeometry.of(geometry.getType(), coordinates);
	}

	private Object walk(Object node, CoordinateTransform transform) {
		if (!(node instanceof List)) {
			return node;
		}
		List<?> list = (List<?>) node;
		if (isPosition(list)) {
			return transformPosition(list, transform);
		}
		List<Object> out = new ArrayList<>(list.size());
		for (Object child : list) {
			out.add(walk(child, transform));
		}
		return out;
	}

	private static boolean isPosition(List<?> list) {
		return !list.isEmpty() && !(list.get(0) instanceof List);
	}

	private List<Object> transformPosition(List<?> position, CoordinateTransform transform) {
		if (position.size() < 2 || !(position.get(0) instanceof Number) || !(position.get(1) instanceof Number)) {
			// placeholder positions are left as they are
			return new ArrayList<>(position);
		}
		double x = ((Number) position.get(0)).doubleValue();
		double y = ((Number) position.get(1)).doubleValue();
		ProjCoordinate result = transform.transform(new ProjCoordinate(x, y), new ProjCoordinate());

		List<Object> out = new ArrayList<>(position.size());
		out.add(result.x);
		out.add(result.y);
		for (int i = 2; i < position.size(); i++) {
			out.add(position.get(i));
		}
		return out;
	}

	private CoordinateTransform transformFor(int sourceEpsg, int targetEpsg) {
		String key = sourceEpsg + ">" + targetEpsg;
		Map<String, CoordinateTransform> cache = transforms.get();
		CoordinateTransform transform = cache.get(key);
		if (transform == null) {
			transform = transformFactory.createTransform(crs(sourceEpsg), crs(targetEpsg));
			cache.put(key, transform);
			logger.debug("Created coordinate transform EPSG:{} -> EPSG:{}", sourceEpsg, targetEpsg);
		}
		return transform;
	}

	private CoordinateReferenceSystem crs(int epsg) {
		return crsCache.computeIfAbsent(epsg, code -> {
			try {
				return crsFactory.createFromName("EPSG:" + code);
			} catch (UnknownAuthorityCodeException e) {
				throw new SchemaException("Unknown coordinate reference system EPSG:" + code, e);
			}
		});
	}
}
