package org.atomicswap.api;

import javax.servlet.http.HttpServletRequest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public enum ApiExceptionFactory {
	INSTANCE;

	private static final Logger LOGGER = LogManager.getLogger(ApiExceptionFactory.class);

	public ApiException createException(HttpServletRequest request, ApiError apiError, Throwable throwable) {
		return this.createCustomException(request, apiError, apiError.getDescription(), throwable);
	}

	public ApiException createException(HttpServletRequest request, ApiError apiError) {
		return this.createException(request, apiError, null);
	}

	public ApiException createCustomException(HttpServletRequest request, ApiError apiError, String message) {
		return this.createCustomException(request, apiError, message, null);
	}

	private ApiException createCustomException(HttpServletRequest request, ApiError apiError, String message, Throwable throwable) {
		if (request != null)
			LOGGER.debug(() -> String.format("API error %s for %s %s: %s", apiError, request.getMethod(), request.getRequestURI(), message));

		return new ApiException(apiError.getStatus(), apiError.getCode(), message, throwable);
	}

}
