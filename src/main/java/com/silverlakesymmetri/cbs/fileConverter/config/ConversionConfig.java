package com.silverlakesymmetri.cbs.fileConverter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.batch.RecordValueFormatter;
import com.silverlakesymmetri.cbs.fileConverter.geometry.GeometryParser;
import com.silverlakesymmetri.cbs.fileConverter.spatial.SpatialWriterFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ConversionConfig {

	@Bean
	public GeometryParser geometryParser(ObjectMapper objectMapper) {
		return new GeometryParser(objectMapper);
	}

	@Bean
	public RecordValueFormatter recordValueFormatter(ObjectMapper objectMapper) {
		return new RecordValueFormatter(objectMapper);
	}

	@Bean
	public SpatialWriterFactory spatialWriterFactory(FormatConfigLoader formatConfigLoader, ObjectMapper objectMapper) {
		return new SpatialWriterFactory(formatConfigLoader.getFormatConfig(), objectMapper);
	}

	@Bean(name = "ckanRestTemplate")
	public RestTemplate ckanRestTemplate(RestTemplateBuilder builder, ConversionProperties properties) {
		return builder
				.rootUri(properties.getCkan().getBaseUrl())
				.setConnectTimeout(properties.getCkan().getConnectTimeout())
				.setReadTimeout(properties.getCkan().getReadTimeout())
				.build();
	}
}
