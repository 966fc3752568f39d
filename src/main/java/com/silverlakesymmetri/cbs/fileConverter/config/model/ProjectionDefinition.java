package com.silverlakesymmetri.cbs.fileConverter.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Well-known text for one EPSG code: the ESRI flavour written to shapefile {@code .prj}
 * files and the OGC flavour stored in GeoPackage spatial reference tables.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectionDefinition {

	private String srsName;
	private String esriWkt;
	private String ogcWkt;

	public String getSrsName() {
		return srsName;
	}

	public void setSrsName(String srsName) {
		this.srsName = srsName;
	}

	public String getEsriWkt() {
		return esriWkt;
	}

	public void setEsriWkt(String esriWkt) {
		this.esriWkt = esriWkt;
	}

	public String getOgcWkt() {
		return ogcWkt;
	}

	public void setOgcWkt(String ogcWkt) {
		this.ogcWkt = ogcWkt;
	}
}
