package com.silverlakesymmetri.cbs.fileConverter.geometry;

/**
 * Moves geometry coordinates from one coordinate reference system to another.
 */
public interface GeometryReprojector {

	/**
	 * @return a geometry of the same type whose coordinates are expressed in {@code targetEpsg};
	 * coordinates are always returned as nested lists
	 */
	GeoJsonGeometry reproject(GeoJsonGeometry geometry, int sourceEpsg, int targetEpsg);
}
