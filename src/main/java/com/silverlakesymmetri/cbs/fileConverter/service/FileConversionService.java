package com.silverlakesymmetri.cbs.fileConverter.service;

import com.silverlakesymmetri.cbs.fileConverter.cache.RecordCache;
import com.silverlakesymmetri.cbs.fileConverter.cache.RecordCacheWriter;
import com.silverlakesymmetri.cbs.fileConverter.config.ConversionProperties;
import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionRequest;
import com.silverlakesymmetri.cbs.fileConverter.dto.DatasetMetadata;
import com.silverlakesymmetri.cbs.fileConverter.dto.FieldDefinition;
import com.silverlakesymmetri.cbs.fileConverter.exception.ConversionException;
import com.silverlakesymmetri.cbs.fileConverter.exception.ValidationException;
import com.silverlakesymmetri.cbs.fileConverter.handler.FormatHandler;
import com.silverlakesymmetri.cbs.fileConverter.handler.HandlerFactory;
import com.silverlakesymmetri.cbs.fileConverter.handler.params.ConversionParams;
import com.silverlakesymmetri.cbs.fileConverter.handler.params.ConversionParamsValidator;
import com.silverlakesymmetri.cbs.fileConverter.source.DatastoreClient;
import com.silverlakesymmetri.cbs.fileConverter.source.DatastorePage;
import com.silverlakesymmetri.cbs.fileConverter.source.DatastoreRecordReader;
import com.silverlakesymmetri.cbs.fileConverter.source.ResourceMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.CACHE_FILE_NAME;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.GEOMETRY_FIELD;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_RESOURCE_ID;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.OUTPUT_DIR_NAME;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.TEMP_DIR_PREFIX;

/**
 * Runs one conversion request: validates it, caches the datastore records once in a request
 * directory under the storage root, and hands a fresh reader over that cache to every handler.
 */
@Service
public class FileConversionService {
	private static final Logger logger = LoggerFactory.getLogger(FileConversionService.class);

	private final ConversionParamsValidator paramsValidator;
	private final DatastoreClient datastoreClient;
	private final RecordCacheWriter recordCacheWriter;
	private final HandlerFactory handlerFactory;
	private final ConversionProperties properties;
	private final AsyncTaskExecutor taskExecutor;

	public FileConversionService(ConversionParamsValidator paramsValidator, DatastoreClient datastoreClient,
								 RecordCacheWriter recordCacheWriter, HandlerFactory handlerFactory,
								 ConversionProperties properties,
								 @Qualifier("conversionTaskExecutor") AsyncTaskExecutor taskExecutor) {
		this.paramsValidator = paramsValidator;
		this.datastoreClient = datastoreClient;
		this.recordCacheWriter = recordCacheWriter;
		this.handlerFactory = handlerFactory;
		this.properties = properties;
		this.taskExecutor = taskExecutor;
	}

	public ConversionResult convert(ConversionRequest request) throws Exception {
		ConversionParams params = paramsValidator.validate(request);
		String resourceId = params.getResourceId();

		MDC.put(MDC_RESOURCE_ID, resourceId);
		try {
			logger.info("Conversion requested: {}", params);

			// ==================== Source checks ====================
			ResourceMetadata resource = datastoreClient.showResource(resourceId);
			if (!resource.isDatastoreActive()) {
				throw new ValidationException("Resource is not in the datastore",
						Collections.singletonList(resourceId + " is not a datastore resource!"));
			}
			DatastorePage firstPage = datastoreClient.search(resourceId, 1, 0);
			if (firstPage.isEmpty()) {
				throw new ValidationException("Resource has no records",
						Collections.singletonList("Datastore resource " + resourceId + " is empty"));
			}
			if (params.isSpatial() && !hasGeometryField(firstPage.getFields())) {
				throw new ValidationException("Resource is not spatial",
						Collections.singletonList("Datastore resource " + resourceId + " has no '" + GEOMETRY_FIELD
								+ "' field; request non-spatial formats instead"));
			}

			// ==================== Cache ====================
			Path workingDir = createWorkingDirectory();
			Path outputDir = Files.createDirectories(workingDir.resolve(OUTPUT_DIR_NAME));
			RecordCache cache = recordCacheWriter.materialize(
					new DatastoreRecordReader(datastoreClient, resourceId, properties.getPageSize()),
					workingDir.resolve(CACHE_FILE_NAME));

			try {
				DatasetMetadata metadata = new DatasetMetadata(datasetName(resource), firstPage.getFields(),
						cache.getGeometryType());
				List<FormatHandler> handlers = handlerFactory.createHandlers(params, outputDir, metadata);

				// ==================== Fan-out ====================
				ConversionResult result = new ConversionResult(resourceId, workingDir);
				if (properties.isParallelHandlers() && handlers.size() > 1) {
					runParallel(handlers, cache, result);
				} else {
					runSequential(handlers, cache, result);
				}
				logger.info("Conversion finished: {} outputs, {} failures", result.getOutputs().size(),
						result.getFailures().size());
				return result;
			} finally {
				cache.delete();
			}
		} finally {
			MDC.remove(MDC_RESOURCE_ID);
		}
	}

	private void runSequential(List<FormatHandler> handlers, RecordCache cache, ConversionResult result) {
		for (FormatHandler handler : handlers) {
			try {
				result.addOutput(handler.name(), handler.toFile(cache.openReader()));
			} catch (Exception e) {
				onHandlerFailure(handler.name(), e, result);
			}
		}
	}

	private void runParallel(List<FormatHandler> handlers, RecordCache cache, ConversionResult result)
			throws InterruptedException {
		List<Future<Path>> futures = new ArrayList<>(handlers.size());
		for (FormatHandler handler : handlers) {
			futures.add(taskExecutor.submit(() -> handler.toFile(cache.openReader())));
		}
		try {
			for (int i = 0; i < handlers.size(); i++) {
				String key = handlers.get(i).name();
				try {
					result.addOutput(key, futures.get(i).get());
				} catch (ExecutionException e) {
					onHandlerFailure(key, e.getCause(), result);
				}
			}
		} catch (RuntimeException | InterruptedException e) {
			// the request is aborting; outstanding handlers must not keep reading the cache
			for (Future<Path> future : futures) {
				future.cancel(true);
			}
			throw e;
		}
	}

	private void onHandlerFailure(String key, Throwable cause, ConversionResult result) {
		if (!properties.isContinueOnHandlerFailure()) {
			logger.error("[{}] Handler failed, aborting request", key, cause);
			throw new ConversionException(key, cause);
		}
		logger.error("[{}] Handler failed, continuing with remaining outputs", key, cause);
		result.addFailure(key, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
	}

	private Path createWorkingDirectory() throws IOException {
		Path storageRoot = Paths.get(properties.getStoragePath());
		Files.createDirectories(storageRoot);
		Path workingDir = Files.createTempDirectory(storageRoot, TEMP_DIR_PREFIX);
		logger.debug("Working directory {}", workingDir);
		return workingDir;
	}

	private static boolean hasGeometryField(List<FieldDefinition> fields) {
		for (FieldDefinition field : fields) {
			if (GEOMETRY_FIELD.equals(field.getId())) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Resource name usable as a file name; separators are replaced so outputs stay inside the
	 * output directory.
	 */
	static String datasetName(ResourceMetadata resource) {
		String name = resource.getName();
		if (name == null || name.trim().isEmpty()) {
			name = resource.getId();
		}
		String safe = name.trim().replace('/', '_').replace('\\', '_');
		if (safe.equals(".") || safe.equals("..")) {
			safe = safe.replace('.', '_');
		}
		return safe;
	}
}
