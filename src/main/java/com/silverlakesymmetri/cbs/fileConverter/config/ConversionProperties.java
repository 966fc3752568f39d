package com.silverlakesymmetri.cbs.fileConverter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings bound from the {@code conversion.*} keys of {@code application.yml}.
 */
@Component
@ConfigurationProperties(prefix = "conversion")
public class ConversionProperties {

	/** Root under which request temp directories are created and pruning is allowed. */
	private String storagePath = System.getProperty("java.io.tmpdir");

	/** Rows fetched per datastore search call. */
	private int pageSize = 20000;

	/** Records handed to a writer per write call. */
	private int chunkSize = 1000;

	/** Rows buffered before the XML writer flushes to disk. */
	private int xmlChunkSize = 5000;

	/** When true a failed handler is reported and the remaining handlers still run. */
	private boolean continueOnHandlerFailure = false;

	/** When true handlers run concurrently on the conversion executor. */
	private boolean parallelHandlers = false;

	private final Ckan ckan = new Ckan();

	private final Executor executor = new Executor();

	public String getStoragePath() {
		return storagePath;
	}

	public void setStoragePath(String storagePath) {
		this.storagePath = storagePath;
	}

	public int getPageSize() {
		return pageSize;
	}

	public void setPageSize(int pageSize) {
		this.pageSize = pageSize;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public void setChunkSize(int chunkSize) {
		this.chunkSize = chunkSize;
	}

	public int getXmlChunkSize() {
		return xmlChunkSize;
	}

	public void setXmlChunkSize(int xmlChunkSize) {
		this.xmlChunkSize = xmlChunkSize;
	}

	public boolean isContinueOnHandlerFailure() {
		return continueOnHandlerFailure;
	}

	public void setContinueOnHandlerFailure(boolean continueOnHandlerFailure) {
		this.continueOnHandlerFailure = continueOnHandlerFailure;
	}

	public boolean isParallelHandlers() {
		return parallelHandlers;
	}

	public void setParallelHandlers(boolean parallelHandlers) {
		this.parallelHandlers = parallelHandlers;
	}

	public Ckan getCkan() {
		return ckan;
	}

	public Executor getExecutor() {
		return executor;
	}

	public static class Ckan {
		private String baseUrl = "http://localhost:5000";
		private String apiToken;
		private Duration connectTimeout = Duration.ofSeconds(10);
		private Duration readTimeout = Duration.ofMinutes(2);

		public String getBaseUrl() {
			return baseUrl;
		}

		public void setBaseUrl(String baseUrl) {
			this.baseUrl = baseUrl;
		}

		public String getApiToken() {
			return apiToken;
		}

		public void setApiToken(String apiToken) {
			this.apiToken = apiToken;
		}

		public Duration getConnectTimeout() {
			return connectTimeout;
		}

		public void setConnectTimeout(Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
		}

		public Duration getReadTimeout() {
			return readTimeout;
		}

		public void setReadTimeout(Duration readTimeout) {
			this.readTimeout = readTimeout;
		}
	}

	/**
	 * Pool that runs handlers when {@code parallel-handlers} is on. A spatial request fans out to
	 * one handler per format and EPSG, so the defaults hold two EPSGs of four formats at once.
	 */
	public static class Executor {
		private int coreSize = 4;
		private int maxSize = 8;
		private int queueCapacity = 100;
		private String threadNamePrefix = "convert-";
		private Duration keepAlive = Duration.ofSeconds(60);
		private Duration shutdownTimeout = Duration.ofSeconds(60);

		public int getCoreSize() {
			return coreSize;
		}

		public void setCoreSize(int coreSize) {
			this.coreSize = coreSize;
		}

		public int getMaxSize() {
			return maxSize;
		}

		public void setMaxSize(int maxSize) {
			this.maxSize = maxSize;
		}

		public int getQueueCapacity() {
			return queueCapacity;
		}

		public void setQueueCapacity(int queueCapacity) {
			this.queueCapacity = queueCapacity;
		}

		public String getThreadNamePrefix() {
			return threadNamePrefix;
		}

		public void setThreadNamePrefix(String threadNamePrefix) {
			this.threadNamePrefix = threadNamePrefix;
		}

		public Duration getKeepAlive() {
			return keepAlive;
		}

		public void setKeepAlive(Duration keepAlive) {
			this.keepAlive = keepAlive;
		}

		public Duration getShutdownTimeout() {
			return shutdownTimeout;
		}

		public void setShutdownTimeout(Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
		}
	}
}
