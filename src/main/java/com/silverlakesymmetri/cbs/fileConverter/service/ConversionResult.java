package com.silverlakesymmetri.cbs.fileConverter.service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one conversion request: handler key to absolute artifact path, plus the failures
 * recorded when handlers are allowed to fail independently.
 */
public class ConversionResult {

	private final String resourceId;
	private final Path workingDirectory;
	private final Map<String, String> outputs = new LinkedHashMap<>();
	private final Map<String, String> failures = new LinkedHashMap<>();

	public ConversionResult(String resourceId, Path workingDirectory) {
		this.resourceId = resourceId;
		this.workingDirectory = workingDirectory;
	}

	synchronized void addOutput(String key, Path path) {
		outputs.put(key, path.toAbsolutePath().toString());
	}

	synchronized void addFailure(String key, String reason) {
		failures.put(key, reason);
	}

	public String getResourceId() {
		return resourceId;
	}

	/**
	 * Request-scoped directory under the storage root holding the outputs; pass it to prune
	 * once the artifacts have been collected.
	 */
	public Path getWorkingDirectory() {
		return workingDirectory;
	}

	public synchronized Map<String, String> getOutputs() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
	}

	public synchronized Map<String, String> getFailures() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
	}

	public synchronized boolean isSuccessful() {
		return failures.isEmpty();
	}
}
