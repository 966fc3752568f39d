package com.silverlakesymmetri.cbs.fileConverter.spatial;

public enum SpatialDriver {
	GEOJSON,
	GPKG,
	ESRI_SHAPEFILE
}
