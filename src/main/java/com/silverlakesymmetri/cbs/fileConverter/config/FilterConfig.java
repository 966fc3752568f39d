package com.silverlakesymmetri.cbs.fileConverter.config;

import com.silverlakesymmetri.cbs.fileConverter.web.CorrelationIdFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class FilterConfig {

	/** Conversion endpoints only; actuator polling is left untagged. */
	static final String CONVERSION_API_PATTERN = "/api/*";

	@Bean
	public FilterRegistrationBean<CorrelationIdFilter> correlationFilterRegistration() {
		FilterRegistrationBean<CorrelationIdFilter> registration =
				new FilterRegistrationBean<>(new CorrelationIdFilter());
		registration.setName("conversionCorrelationIdFilter");
		registration.addUrlPatterns(CONVERSION_API_PATTERN);
		registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
		return registration;
	}
}
