package com.silverlakesymmetri.cbs.fileConverter.constants;

public final class FileConversionConstants {

	// Prevent instantiation
	private FileConversionConstants() {
	}

	/** Reserved record field carrying the GeoJSON-shaped geometry payload. */
	public static final String GEOMETRY_FIELD = "geometry";

	/** Key suffix used for non-spatial outputs, e.g. {@code csv-None}. */
	public static final String NON_SPATIAL_EPSG_KEY = "None";

	public static final String PART_FILE_SUFFIX = ".part";
	public static final String CACHE_FILE_NAME = "dump.jsonl";
	public static final String OUTPUT_DIR_NAME = "output";
	public static final String TEMP_DIR_PREFIX = "iotrans-";

	public static final String MDC_REQUEST_ID = "requestId";
	public static final String MDC_RESOURCE_ID = "resourceId";
	/** Handler key, or the cache step name, of the step currently running on a thread. */
	public static final String MDC_OUTPUT = "output";

	public static final int SHAPEFILE_MAX_FIELD_LENGTH = 10;
	public static final int SHAPEFILE_FIELD_PREFIX_LENGTH = 7;

	public static final int PROGRESS_LOG_INTERVAL = 10000;
}
