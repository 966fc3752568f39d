package com.silverlakesymmetri.cbs.fileConverter.service;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_OUTPUT;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_REQUEST_ID;
import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_RESOURCE_ID;

/**
 * Hands the submitting request's id and resource id to the handler thread. Once the handler
 * returns the thread's own conversion keys are put back, which leaves pool threads clean and
 * keeps the caller's context when a saturated pool runs the handler on the caller.
 */
public class ConversionContextTaskDecorator implements TaskDecorator {

	private static final String[] PROPAGATED_KEYS = {MDC_REQUEST_ID, MDC_RESOURCE_ID};
	private static final String[] RESTORED_KEYS = {MDC_REQUEST_ID, MDC_RESOURCE_ID, MDC_OUTPUT};

	@Override
	public Runnable decorate(Runnable runnable) {
		Map<String, String> context = snapshot(PROPAGATED_KEYS);
		return () -> {
			Map<String, String> previous = snapshot(RESTORED_KEYS);
			for (Map.Entry<String, String> entry : context.entrySet()) {
				MDC.put(entry.getKey(), entry.getValue());
			}
			try {
				runnable.run();
			} finally {
				for (String key : RESTORED_KEYS) {
					String value = previous.get(key);
					if (value != null) {
						MDC.put(key, value);
					} else {
						MDC.remove(key);
					}
				}
			}
		};
	}

	private static Map<String, String> snapshot(String[] keys) {
		Map<String, String> values = new LinkedHashMap<>();
		for (String key : keys) {
			String value = MDC.get(key);
			if (value != null) {
				values.put(key, value);
			}
		}
		return values;
	}
}
