package com.silverlakesymmetri.cbs.fileConverter.spatial;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.SHAPEFILE_FIELD_PREFIX_LENGTH;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.SHAPEFILE_MAX_FIELD_LENGTH;

/**
 * Shapefile attribute names are limited to 10 characters. When any field id is longer, every
 * non-geometry field is renamed to its first 7 characters followed by its 1-based position among
 * all field ids, geometry included.
 */
public final class ColumnNameMapper {

	private ColumnNameMapper() {
	}

	/**
	 * @return original id to truncated id, empty when every id already fits
	 */
	public static Map<String, String> mapColumns(List<String> fieldIds) {
		boolean anyTooLong = false;
		for (String id : fieldIds) {
			if (id.length() > SHAPEFILE_MAX_FIELD_LENGTH) {
				anyTooLong = true;
				break;
			}
		}
		if (!anyTooLong) {
			return Collections.emptyMap();
		}

		Map<String, String> map = new LinkedHashMap<>();
		int sequence = 0;
		for (String id : fieldIds) {
			sequence++;
			if (GEOMETRY_FIELD.equals(id)) {
				continue;
			}
			String prefix = id.length() > SHAPEFILE_FIELD_PREFIX_LENGTH
					? id.substring(0, SHAPEFILE_FIELD_PREFIX_LENGTH)
					: id;
			map.put(id, prefix + sequence);
		}
		return Collections.unmodifiableMap(map);
	}

	public static String mapped(Map<String, String> columnMap, String fieldId) {
		String mapped = columnMap.get(fieldId);
		return mapped != null ? mapped : fieldId;
	}
}
