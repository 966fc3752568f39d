package com.silverlakesymmetri.cbs.fileConverter.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import com.silverlakesymmetri.cbs.fileConverter.dto.FieldDefinition;
import com.silverlakesymmetri.cbs.fileConverter.exception.DatastoreAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DatastoreClient} backed by the CKAN action API ({@code resource_show} and
 * {@code datastore_search}). Every answer is a {@code {success, result, error}} envelope; an
 * unsuccessful one is reported as a {@link DatastoreAccessException}.
 */
@Component
public class CkanDatastoreClient implements DatastoreClient {
	private static final Logger logger = LoggerFactory.getLogger(CkanDatastoreClient.class);

	static final String RESOURCE_SHOW = "/api/3/action/resource_show";
	static final String DATASTORE_SEARCH = "/api/3/action/datastore_search";

	private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE =
			new TypeReference<List<Map<String, Object>>>() {
			};
	private static final TypeReference<List<FieldDefinition>> FIELDS_TYPE =
			new TypeReference<List<FieldDefinition>>() {
			};

	private final RestTemplate restTemplate;
	private final ObjectMapper objectMapper;
	private final String apiToken;

	public CkanDatastoreClient(@Qualifier("ckanRestTemplate") RestTemplate restTemplate,
							   ObjectMapper objectMapper, ConversionProperties properties) {
		this.restTemplate = restTemplate;
		this.objectMapper = objectMapper;
		this.apiToken = properties.getCkan().getApiToken();
	}

	@Override
	public ResourceMetadata showResource(String resourceId) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("id", resourceId);
		JsonNode result = call(RESOURCE_SHOW, body);

		JsonNode active = result.get("datastore_active");
		Object datastoreActive = null;
		if (active != null && !active.isNull()) {
			datastoreActive = active.isBoolean() ? (Object) active.booleanValue() : active.asText();
		}
		return new ResourceMetadata(result.path("id").asText(resourceId), result.path("name").asText(null),
				datastoreActive);
	}

	@Override
	public DatastorePage search(String resourceId, int limit, int offset) {
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("resource_id", resourceId);
		body.put("limit", limit);
		body.put("offset", offset);
		JsonNode result = call(DATASTORE_SEARCH, body);

		List<Map<String, Object>> records = result.hasNonNull("records")
				? objectMapper.convertValue(result.get("records"), RECORDS_TYPE)
				: new ArrayList<Map<String, Object>>();
		List<FieldDefinition> fields = result.hasNonNull("fields")
				? objectMapper.convertValue(result.get("fields"), FIELDS_TYPE)
				: Collections.<FieldDefinition>emptyList();
		return new DatastorePage(records, fields);
	}

	private JsonNode call(String action, Map<String, Object> body) {
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
		if (StringUtils.hasText(apiToken)) {
			headers.set(HttpHeaders.AUTHORIZATION, apiToken);
		}

		JsonNode envelope;
		try {
			envelope = restTemplate.postForObject(action, new HttpEntity<>(body, headers), JsonNode.class);
		} catch (HttpStatusCodeException e) {
			throw new DatastoreAccessException(action + " failed with HTTP " + e.getRawStatusCode() + ": "
					+ describeError(e.getResponseBodyAsString()), e);
		} catch (RestClientException e) {
			throw new DatastoreAccessException(action + " failed: " + e.getMessage(), e);
		}

		if (envelope == null) {
			throw new DatastoreAccessException(action + " returned an empty response");
		}
		if (!envelope.path("success").asBoolean(false)) {
			throw new DatastoreAccessException(action + " was not successful: " + envelope.path("error"));
		}
		JsonNode result = envelope.get("result");
		if (result == null || result.isNull()) {
			throw new DatastoreAccessException(action + " returned no result");
		}
		return result;
	}

	private String describeError(String responseBody) {
		if (!StringUtils.hasText(responseBody)) {
			return "no response body";
		}
		try {
			JsonNode error = objectMapper.readTree(responseBody).path("error");
			return error.isMissingNode() ? responseBody : error.toString();
		} catch (JsonProcessingException e) {
			logger.debug("Error body is not JSON: {}", e.getMessage());
			return responseBody;
		}
	}
}
