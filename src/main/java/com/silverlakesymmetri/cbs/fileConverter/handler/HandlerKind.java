package com.silverlakesymmetri.cbs.fileConverter.handler;

/**
 * Every kind of output the converter can produce.
 */
public enum HandlerKind {
	NON_SPATIAL_CSV,
	NON_SPATIAL_JSON,
	NON_SPATIAL_XML,
	SPATIAL_CSV,
	/** GeoJSON and GeoPackage, written through a spatial feature writer. */
	SPATIAL_GENERIC,
	SPATIAL_SHAPEFILE
}
