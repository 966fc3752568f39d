package com.silverlakesymmetri.cbs.fileConverter.geometry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeometryTransformerTest {

	private final GeometryParser parser = new GeometryParser(new ObjectMapper());
	private GeometryReprojector reprojector;

	@BeforeEach
	void setUp() {
		reprojector = mock(GeometryReprojector.class);
	}

	private GeometryTransformer transformer(int source, int target) {
		return new GeometryTransformer(parser, reprojector, source, target);
	}

	@Test
	void pointIsPromotedToMultiPointWhenCrsMatches() {
		GeoJsonGeometry result = transformer(4326, 4326)
				.transform("{\"type\": \"Point\", \"coordinates\": [-79.5, 43.6]}");

		assertEquals("MultiPoint", result.getType());
		assertEquals(Collections.singletonList(Arrays.asList(-79.5, 43.6)), result.getCoordinates());
		verify(reprojector, never()).reproject(any(), anyInt(), anyInt());
	}

	@Test
	void multiTypesKeepTheirCoordinates() {
		GeoJsonGeometry result = transformer(4326, 4326)
				.transform("{\"type\": \"MultiLineString\", \"coordinates\": [[[0.5, 1.0], [2.0, 3.0]]]}");

		assertEquals("MultiLineString", result.getType());
		assertEquals(1, result.getCoordinates().size());
	}

	@Test
	void threeDimensionalTypesArePromoted() {
		GeoJsonGeometry result = transformer(4326, 4326)
				.transform("{\"type\": \"3D Polygon\", \"coordinates\": [[[0, 0, 1], [1, 0, 1], [1, 1, 1], [0, 0, 1]]]}");

		assertEquals("3D MultiPolygon", result.getType());
	}

	@Test
	void zeroPositionIsWrappedWithoutReprojection() {
		GeoJsonGeometry result = transformer(4326, 2952)
				.transform("{\"type\": \"Point\", \"coordinates\": [0, 0]}");

		assertEquals("MultiPoint", result.getType());
		assertEquals(Collections.singletonList(Arrays.asList(0, 0)), result.getCoordinates());
		verify(reprojector, never()).reproject(any(), anyInt(), anyInt());
	}

	@Test
	void nullPositionBecomesEmptyMultiGeometry() {
		GeoJsonGeometry result = transformer(4326, 2952)
				.transform("{\"type\": \"Point\", \"coordinates\": [null, null]}");

		assertEquals("MultiPoint", result.getType());
		assertTrue(result.getCoordinates().isEmpty());
		verify(reprojector, never()).reproject(any(), anyInt(), anyInt());
	}

	@Test
	void nullGeometryPassesThrough() {
		assertNull(transformer(4326, 2952).transform(null));
		assertNull(transformer(4326, 2952).transform("null"));
		verify(reprojector, never()).reproject(any(), anyInt(), anyInt());
	}

	@Test
	void promotedGeometryIsHandedToReprojectorWhenCrsDiffers() {
		GeoJsonGeometry projected = GeoJsonGeometry.of("MultiPoint",
				Collections.<Object>singletonList(Arrays.<Object>asList(304800.0, 4828000.0)));
		when(reprojector.reproject(any(GeoJsonGeometry.class), anyInt(), anyInt())).thenReturn(projected);

		GeoJsonGeometry result = transformer(4326, 2952)
				.transform("{\"type\": \"Point\", \"coordinates\": [-79.5, 43.6]}");

		assertSame(projected, result);
		List<Object> expectedInput = Collections.<Object>singletonList(Arrays.asList(-79.5, 43.6));
		verify(reprojector).reproject(GeoJsonGeometry.of("MultiPoint", expectedInput), 4326, 2952);
	}

	@Test
	void structuredGeometryIsAccepted() {
		GeoJsonGeometry input = GeoJsonGeometry.of("LineString",
				Arrays.<Object>asList(Arrays.asList(1.0, 2.0), Arrays.asList(3.0, 4.0)));

		GeoJsonGeometry result = transformer(2952, 2952).transform(input);

		assertEquals("MultiLineString", result.getType());
		assertEquals(1, result.getCoordinates().size());
	}

	@Test
	void geometryWithoutCoordinatesIsRejected() {
		assertThrows(SchemaException.class,
				() -> transformer(4326, 4326).transform("{\"type\": \"Point\"}"));
	}

	@Test
	void unknownGeometryTypeIsRejected() {
		assertThrows(SchemaException.class,
				() -> transformer(4326, 4326).transform("{\"type\": \"Circle\", \"coordinates\": [0, 0]}"));
	}
}
