package com.silverlakesymmetri.cbs.fileConverter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.config.model.FormatConfig;
import com.silverlakesymmetri.cbs.fileConverter.config.model.ProjectionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;

/**
 * Loads the format and projection tables from {@code classpath:format-config.json} once at
 * startup. An invalid file stops the application.
 */
@Component
public class FormatConfigLoader {
	private static final Logger logger = LoggerFactory.getLogger(FormatConfigLoader.class);

	private final ObjectMapper objectMapper;
	private final Resource configResource;

	private volatile FormatConfig formatConfig;

	public FormatConfigLoader(ObjectMapper objectMapper,
							  @Value("classpath:format-config.json") Resource configResource) {
		this.objectMapper = objectMapper;
		this.configResource = configResource;
	}

	@PostConstruct
	public void init() {
		if (configResource == null || !configResource.exists()) {
			throw new IllegalStateException("format-config.json not found on classpath");
		}

		try (InputStream is = configResource.getInputStream()) {
			FormatConfig loaded = objectMapper.readValue(is, FormatConfig.class);
			validate(loaded);
			freeze(loaded);
			this.formatConfig = loaded;
			logSummary(loaded);
		} catch (IllegalStateException e) {
			throw e;
		} catch (Exception e) {
			logger.error("CRITICAL: Failed to load format-config.json", e);
			throw new IllegalStateException("Startup failed: Invalid format configuration", e);
		}
	}

	/* ================= Public API ================= */
	public FormatConfig getFormatConfig() {
		FormatConfig config = formatConfig;
		if (config == null) {
			throw new IllegalStateException("Format configuration has not been loaded");
		}
		return config;
	}

	/* ================= Validation ================= */
	private void validate(FormatConfig config) {
		if (config == null) {
			throw new IllegalStateException("format-config.json is empty");
		}
		if (config.getSpatialFormats().isEmpty() || config.getNonSpatialFormats().isEmpty()) {
			throw new IllegalStateException("Config Error: 'spatialFormats' and 'nonSpatialFormats' are required");
		}
		if (config.getSupportedEpsgs().isEmpty()) {
			throw new IllegalStateException("Config Error: 'supportedEpsgs' is required");
		}

		for (Integer epsg : config.getSupportedEpsgs()) {
			ProjectionDefinition definition = config.getProjections().get(epsg);
			if (definition == null || isBlank(definition.getEsriWkt()) || isBlank(definition.getOgcWkt())) {
				throw new IllegalStateException("Config Error [EPSG:" + epsg + "]: 'esriWkt' and 'ogcWkt' are required");
			}
		}

		for (String format : config.getSpatialFormats()) {
			if (!"csv".equals(format) && !config.getDrivers().containsKey(format)) {
				throw new IllegalStateException("Config Error [" + format + "]: no spatial driver configured");
			}
		}

		if (config.getFieldTypes().isEmpty()) {
			throw new IllegalStateException("Config Error: 'fieldTypes' is required");
		}
	}

	private void freeze(FormatConfig config) {
		config.setSpatialFormats(Collections.unmodifiableSet(config.getSpatialFormats()));
		config.setNonSpatialFormats(Collections.unmodifiableSet(config.getNonSpatialFormats()));
		config.setSupportedEpsgs(Collections.unmodifiableSet(config.getSupportedEpsgs()));
		config.setFieldTypes(Collections.unmodifiableMap(config.getFieldTypes()));
		config.setDrivers(Collections.unmodifiableMap(config.getDrivers()));
		config.setProjections(Collections.unmodifiableMap(config.getProjections()));
	}

	private static boolean isBlank(String value) {
		return value == null || value.trim().isEmpty();
	}

	/* ================= Logging ================= */
	private void logSummary(FormatConfig config) {
		logger.info("Loaded format configuration: spatial={} nonSpatial={} epsgs={}",
				config.getSpatialFormats(), config.getNonSpatialFormats(), config.getSupportedEpsgs());
		for (Map.Entry<String, ?> entry : config.getFieldTypes().entrySet()) {
			logger.debug("Field type [{}] -> {}", entry.getKey(), entry.getValue());
		}
	}
}
