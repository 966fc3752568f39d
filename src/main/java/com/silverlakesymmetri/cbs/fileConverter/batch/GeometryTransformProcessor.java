package com.silverlakesymmetri.cbs.fileConverter.batch;

import com.silverlakesymmetri.cbs.fileConverter.dto.DynamicRecord;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryTransformer;
import org.springframework.batch.item.ItemProcessor;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;

/**
 * Replaces the geometry field of each record with its normalized, reprojected form.
 */
public class GeometryTransformProcessor implements ItemProcessor<DynamicRecord, DynamicRecord> {

	private final GeometryTransformer transformer;

	public GeometryTransformProcessor(GeometryTransformer transformer) {
		this.transformer = transformer;
	}

	@Override
	public DynamicRecord process(DynamicRecord record) {
		if (record.hasColumn(GEOMETRY_FIELD)) {
			record.updateValue(GEOMETRY_FIELD, transformer.transform(record.getValue(GEOMETRY_FIELD)));
		}
		return record;
	}
}
