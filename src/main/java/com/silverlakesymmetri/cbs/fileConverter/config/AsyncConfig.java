package com.silverlakesymmetri.cbs.fileConverter.config;

import com.silverlakesymmetri.cbs.fileConverter.service.ConversionContextTaskDecorator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {
	private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

	/**
	 * Runs format handlers when {@code conversion.parallel-handlers} is enabled. Idle threads
	 * time out, so the pool costs nothing while handlers run sequentially.
	 */
	@Bean(name = "conversionTaskExecutor")
	public ThreadPoolTaskExecutor conversionTaskExecutor(ConversionProperties properties) {
		ConversionProperties.Executor settings = properties.getExecutor();
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(settings.getCoreSize());
		executor.setMaxPoolSize(Math.max(settings.getCoreSize(), settings.getMaxSize()));
		executor.setQueueCapacity(settings.getQueueCapacity());
		executor.setKeepAliveSeconds((int) settings.getKeepAlive().getSeconds());
		executor.setAllowCoreThreadTimeOut(true);
		executor.setThreadNamePrefix(settings.getThreadNamePrefix());
		executor.setTaskDecorator(new ConversionContextTaskDecorator());

		// a saturated pool runs the handler on the request thread instead of failing it
		executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

		executor.setWaitForTasksToCompleteOnShutdown(true);
		executor.setAwaitTerminationSeconds((int) settings.getShutdownTimeout().getSeconds());

		executor.initialize();
		logger.info("Conversion executor: parallelHandlers={}, core={}, max={}, queue={}",
				properties.isParallelHandlers(), settings.getCoreSize(), executor.getMaxPoolSize(),
				settings.getQueueCapacity());
		return executor;
	}
}
