package com.silverlakesymmetri.cbs.fileConverter.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.spatial.PropertyType;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialDriver;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Format and projection tables read from {@code format-config.json}.
 * Treated as read-only once {@link com.silverlakesymmetri.cbs.fileConverter.config.FormatConfigLoader}
 * has validated it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FormatConfig {

	private Set<String> spatialFormats = new LinkedHashSet<>();
	private Set<String> nonSpatialFormats = new LinkedHashSet<>();
	private Set<Integer> supportedEpsgs = new LinkedHashSet<>();
	private Map<String, PropertyType> fieldTypes = new LinkedHashMap<>();
	private Map<String, SpatialDriver> drivers = new LinkedHashMap<>();
	private Map<Integer, ProjectionDefinition> projections = new LinkedHashMap<>();

	/* ================= Lookups ================= */

	public boolean isSpatialFormat(String format) {
		return format != null && spatialFormats.contains(format.toLowerCase(Locale.ROOT));
	}

	public boolean isNonSpatialFormat(String format) {
		return format != null && nonSpatialFormats.contains(format.toLowerCase(Locale.ROOT));
	}

	public boolean isSupportedEpsg(Integer epsg) {
		return epsg != null && supportedEpsgs.contains(epsg);
	}

	/**
	 * Maps a datastore type such as {@code float8} or {@code text} onto a feature property type.
	 */
	public PropertyType propertyTypeFor(String baseType) {
		PropertyType type = baseType == null ? null : fieldTypes.get(baseType.toLowerCase(Locale.ROOT));
		if (type == null) {
			throw new SchemaException("No geospatial property type for datastore type: " + baseType);
		}
		return type;
	}

	public SpatialDriver driverFor(String format) {
		SpatialDriver driver = format == null ? null : drivers.get(format.toLowerCase(Locale.ROOT));
		if (driver == null) {
			throw new IllegalArgumentException("No spatial driver for format: " + format);
		}
		return driver;
	}

	public ProjectionDefinition projectionFor(int epsg) {
		ProjectionDefinition definition = projections.get(epsg);
		if (definition == null) {
			throw new IllegalArgumentException("No projection definition for EPSG:" + epsg);
		}
		return definition;
	}

	/* ================= Bean properties ================= */

	public Set<String> getSpatialFormats() {
		return spatialFormats;
	}

	public void setSpatialFormats(Set<String> spatialFormats) {
		this.spatialFormats = spatialFormats;
	}

	public Set<String> getNonSpatialFormats() {
		return nonSpatialFormats;
	}

	public void setNonSpatialFormats(Set<String> nonSpatialFormats) {
		this.nonSpatialFormats = nonSpatialFormats;
	}

	public Set<Integer> getSupportedEpsgs() {
		return supportedEpsgs;
	}

	public void setSupportedEpsgs(Set<Integer> supportedEpsgs) {
		this.supportedEpsgs = supportedEpsgs;
	}

	public Map<String, PropertyType> getFieldTypes() {
		return fieldTypes;
	}

	public void setFieldTypes(Map<String, PropertyType> fieldTypes) {
		this.fieldTypes = fieldTypes;
	}

	public Map<String, SpatialDriver> getDrivers() {
		return drivers;
	}

	public void setDrivers(Map<String, SpatialDriver> drivers) {
		this.drivers = drivers;
	}

	public Map<Integer, ProjectionDefinition> getProjections() {
		return projections;
	}

	public void setProjections(Map<Integer, ProjectionDefinition> projections) {
		this.projections = projections;
	}
}
