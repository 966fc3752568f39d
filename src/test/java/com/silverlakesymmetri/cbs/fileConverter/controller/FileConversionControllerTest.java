package com.silverlakesymmetri.cbs.fileConverter.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.TestFixtures;
import com.silverlakesymmetri.cbs.fileConverter.config.FormatConfigLoader;
import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionRequest;
import com.silverlakesymmetri.cbs.fileConverter.exception.ConversionException;
import com.silverlakesymmetri.cbs.fileConverter.exception.DatastoreAccessException;
import com.silverlakesymmetri.cbs.fileConverter.exception.SchemaException;
import com.silverlakesymmetri.cbs.fileConverter.exception.ValidationException;
import com.silverlakesymmetri.cbs.fileConverter.service.ConversionResult;
import com.silverlakesymmetri.cbs.fileConverter.service.FileConversionService;
import com.silverlakesymmetri.cbs.fileConverter.service.PruneService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FileConversionController.class)
class FileConversionControllerTest {

	@Autowired
	private MockMvc mockMvc;

	@MockBean
	private FileConversionService fileConversionService;

	@MockBean
	private PruneService pruneService;

	@MockBean
	private FormatConfigLoader formatConfigLoader;

	private static ConversionResult result(Map<String, String> outputs, Map<String, String> failures) {
		ConversionResult result = mock(ConversionResult.class);
		when(result.getResourceId()).thenReturn("res-1");
		when(result.getOutputs()).thenReturn(outputs);
		when(result.getFailures()).thenReturn(failures);
		when(result.isSuccessful()).thenReturn(failures.isEmpty());
		return result;
	}

	@Test
	void toFileReturnsOutputPathsByKey() throws Exception {
		Map<String, String> outputs = new LinkedHashMap<>();
		outputs.put("csv-4326", "/storage/iotrans-1/output/Wards - 4326.csv");
		outputs.put("shp-4326", "/storage/iotrans-1/output/Wards - 4326.zip");
		ConversionResult result = result(outputs, Collections.<String, String>emptyMap());
		when(fileConversionService.convert(any(ConversionRequest.class))).thenReturn(result);

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"resource_id\": \"res-1\", \"target_formats\": [\"csv\", \"shp\"],"
								+ " \"source_epsg\": 4326, \"target_epsgs\": 4326}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("COMPLETED"))
				.andExpect(jsonPath("$.resourceId").value("res-1"))
				.andExpect(jsonPath("$.outputs['csv-4326']").value("/storage/iotrans-1/output/Wards - 4326.csv"))
				.andExpect(jsonPath("$.outputs['shp-4326']").value("/storage/iotrans-1/output/Wards - 4326.zip"))
				.andExpect(jsonPath("$.failures").doesNotExist());

		verify(fileConversionService).convert(argThat(request -> "res-1".equals(request.getResourceId())
				&& request.getTargetEpsgs().equals(Collections.singletonList(4326))
				&& request.getTargetFormats().equals(Arrays.asList("csv", "shp"))));
	}

	@Test
	void partialResultListsFailures() throws Exception {
		ConversionResult result = result(Collections.singletonMap("json-None", "/storage/x/output/Wards.json"),
				Collections.singletonMap("xml-None", "disk full"));
		when(fileConversionService.convert(any(ConversionRequest.class))).thenReturn(result);

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"resource_id\": \"res-1\", \"target_formats\": \"json,xml\"}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("PARTIAL"))
				.andExpect(jsonPath("$.failures['xml-None']").value("disk full"));
	}

	@Test
	void validationErrorsAreBadRequests() throws Exception {
		when(fileConversionService.convert(any(ConversionRequest.class))).thenThrow(new ValidationException(
				"Invalid conversion parameters", Arrays.asList("spatial problem", "non-spatial problem")));

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"target_formats\": [\"pdf\"]}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.status").value("VALIDATION_ERROR"))
				.andExpect(jsonPath("$.constraints", contains("spatial problem", "non-spatial problem")));
	}

	@Test
	void malformedBodyIsABadRequest() throws Exception {
		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{not json"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.status").value("VALIDATION_ERROR"));
	}

	@Test
	void schemaErrorsAreUnprocessable() throws Exception {
		when(fileConversionService.convert(any(ConversionRequest.class)))
				.thenThrow(new SchemaException("No geospatial property type for datastore type: jsonb"));

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"resource_id\": \"res-1\", \"target_formats\": [\"gpkg\"]}"))
				.andExpect(status().isUnprocessableEntity())
				.andExpect(jsonPath("$.status").value("SCHEMA_ERROR"));
	}

	@Test
	void handlerFailureIsAServerError() throws Exception {
		when(fileConversionService.convert(any(ConversionRequest.class)))
				.thenThrow(new ConversionException("xml-None", new IllegalStateException("disk full")));

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"resource_id\": \"res-1\", \"target_formats\": [\"xml\"]}"))
				.andExpect(status().isInternalServerError())
				.andExpect(jsonPath("$.status").value("ERROR"))
				.andExpect(jsonPath("$.message").value("Conversion failed for xml-None: disk full"));
	}

	@Test
	void datastoreFailureIsReported() throws Exception {
		when(fileConversionService.convert(any(ConversionRequest.class)))
				.thenThrow(new DatastoreAccessException("datastore_search failed with HTTP 503"));

		mockMvc.perform(post("/api/v1/iotrans/to-file")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"resource_id\": \"res-1\", \"target_formats\": [\"csv\"]}"))
				.andExpect(status().isInternalServerError())
				.andExpect(jsonPath("$.status").value("DATASTORE_ERROR"));
	}

	@Test
	void pruneDeletesPath() throws Exception {
		mockMvc.perform(post("/api/v1/iotrans/prune")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"path\": \"/storage/iotrans-1\"}"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.status").value("PRUNED"));

		verify(pruneService).prune("/storage/iotrans-1");
	}

	@Test
	void pruneWithoutPathIsRejected() throws Exception {
		doThrow(new ValidationException("Path is required",
				Collections.singletonList("Input 'path' of dir/file to delete required!")))
				.when(pruneService).prune(null);

		mockMvc.perform(post("/api/v1/iotrans/prune")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.constraints[0]").value("Input 'path' of dir/file to delete required!"));
	}

	@Test
	void formatsListsConfiguredTables() throws Exception {
		when(formatConfigLoader.getFormatConfig())
				.thenReturn(TestFixtures.formatConfigLoader(new ObjectMapper()).getFormatConfig());

		mockMvc.perform(get("/api/v1/iotrans/formats"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.spatialFormats", contains("shp", "geojson", "gpkg", "csv")))
				.andExpect(jsonPath("$.nonSpatialFormats", contains("csv", "json", "xml")))
				.andExpect(jsonPath("$.supportedEpsgs", contains(4326, 2952)));
	}
}
