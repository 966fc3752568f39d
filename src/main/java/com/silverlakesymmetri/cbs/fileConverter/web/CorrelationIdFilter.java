package com.silverlakesymmetri.cbs.fileConverter.web;

import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

import static com.silverlakesymmetri.cbs.fileConverter.constants.FileConversionConstants.MDC_REQUEST_ID;

/**
 * Tags every log line of a conversion API call, including those written by handler threads,
 * with its {@code X-Request-Id}. A missing or malformed id is replaced by a generated one,
 * and the id in use is echoed back on the response.
 */
public class CorrelationIdFilter extends OncePerRequestFilter {
	public static final String HEADER_NAME = "X-Request-Id";

	/** Client ids are printed verbatim in log lines; anything but a short token is replaced. */
	private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
									FilterChain filterChain) throws ServletException, IOException {
		String requestId = requestIdOf(request);

		MDC.put(MDC_REQUEST_ID, requestId);
		response.setHeader(HEADER_NAME, requestId);

		try {
			filterChain.doFilter(request, response);
		} finally {
			MDC.remove(MDC_REQUEST_ID);
		}
	}

	static String requestIdOf(HttpServletRequest request) {
		String requestId = request.getHeader(HEADER_NAME);
		if (requestId != null) {
			requestId = requestId.trim();
			if (ACCEPTED_ID.matcher(requestId).matches()) {
				return requestId;
			}
		}
		return UUID.randomUUID().toString();
	}
}
