package com.silverlakesymmetri.cbs.fileConverter.handler.params;

import com.silverlakesymmetri.cbs.fileConverter.config.FormatConfigLoader;
import com.silverlakesymmetri.cbs.fileConverter.config.model.FormatConfig;
import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionRequest;
import com.silverlakesymmetri.cbs.fileConverter.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads a {@link ConversionRequest} as either spatial or non-spatial parameters. The spatial
 * shape is tried first; the request is rejected only when it fits neither, and the rejection
 * carries the reasons for both.
 */
@Component
public class ConversionParamsValidator {
	private static final Logger logger = LoggerFactory.getLogger(ConversionParamsValidator.class);

	private final FormatConfigLoader formatConfigLoader;

	public ConversionParamsValidator(FormatConfigLoader formatConfigLoader) {
		this.formatConfigLoader = formatConfigLoader;
	}

	public ConversionParams validate(ConversionRequest request) {
		if (request == null) {
			throw new ValidationException("Request body is required");
		}
		FormatConfig config = formatConfigLoader.getFormatConfig();
		List<String> formats = normalizeFormats(request.getTargetFormats());

		List<String> spatialProblems = spatialProblems(request, formats, config);
		if (spatialProblems.isEmpty()) {
			return new SpatialConversionParams(request.getResourceId().trim(), formats, request.getSourceEpsg(),
					new ArrayList<>(request.getTargetEpsgs()));
		}

		List<String> nonSpatialProblems = nonSpatialProblems(request, formats, config);
		if (nonSpatialProblems.isEmpty()) {
			return new NonSpatialConversionParams(request.getResourceId().trim(), formats);
		}

		logger.warn("Rejected conversion request {}: spatial={} non-spatial={}", request, spatialProblems,
				nonSpatialProblems);
		throw new ValidationException("Invalid conversion parameters", Arrays.asList(
				"Could not parse spatial-type params: " + String.join("; ", spatialProblems),
				"Could not parse non-spatial-type params: " + String.join("; ", nonSpatialProblems)));
	}

	/**
	 * Accepts entries like {@code "csv,geojson"} by splitting on commas; names are lower-cased.
	 */
	static List<String> normalizeFormats(List<String> targetFormats) {
		if (targetFormats == null) {
			return null;
		}
		List<String> formats = new ArrayList<>();
		for (String entry : targetFormats) {
			if (entry == null) {
				formats.add(null);
				continue;
			}
			for (String part : entry.split(",")) {
				String format = part.trim().toLowerCase(Locale.ROOT);
				if (!format.isEmpty()) {
					formats.add(format);
				}
			}
		}
		return formats;
	}

	private List<String> spatialProblems(ConversionRequest request, List<String> formats, FormatConfig config) {
		List<String> problems = commonProblems(request, formats);
		if (formats != null) {
			for (String format : formats) {
				if (format != null && !config.isSpatialFormat(format)) {
					problems.add("target_formats: '" + format + "' is not one of " + config.getSpatialFormats());
				}
			}
		}
		if (request.getSourceEpsg() == null) {
			problems.add("source_epsg: field required");
		} else if (!config.isSupportedEpsg(request.getSourceEpsg())) {
			problems.add("source_epsg: " + request.getSourceEpsg() + " is not one of " + config.getSupportedEpsgs());
		}
		if (request.getTargetEpsgs() == null) {
			problems.add("target_epsgs: field required");
		} else {
			for (Integer epsg : request.getTargetEpsgs()) {
				if (!config.isSupportedEpsg(epsg)) {
					problems.add("target_epsgs: " + epsg + " is not one of " + config.getSupportedEpsgs());
				}
			}
		}
		return problems;
	}

	private List<String> nonSpatialProblems(ConversionRequest request, List<String> formats, FormatConfig config) {
		List<String> problems = commonProblems(request, formats);
		if (formats != null) {
			for (String format : formats) {
				if (format != null && !config.isNonSpatialFormat(format)) {
					problems.add("target_formats: '" + format + "' is not one of " + config.getNonSpatialFormats());
				}
			}
		}
		return problems;
	}

	private static List<String> commonProblems(ConversionRequest request, List<String> formats) {
		List<String> problems = new ArrayList<>();
		if (request.getResourceId() == null || request.getResourceId().trim().isEmpty()) {
			problems.add("resource_id: field required");
		}
		if (formats == null) {
			problems.add("target_formats: field required");
		} else if (formats.contains(null)) {
			problems.add("target_formats: null is not a format");
		}
		return problems;
	}
}
