package org.atomicswap.api;

import java.io.IOException;
import java.io.Writer;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.ErrorHandler;
import org.json.simple.JSONObject;

/** Renders errors raised outside the JAX-RS layer, e.g. unknown paths or denied addresses, as API error JSON. */
public class ApiErrorHandler extends ErrorHandler {

	@Override
	@SuppressWarnings("unchecked")
	protected void generateAcceptableResponse(Request baseRequest, HttpServletRequest request, HttpServletResponse response, int code, String message) throws IOException {
		ApiError apiError = code == HttpServletResponse.SC_NOT_FOUND ? ApiError.NOT_FOUND
				: code == HttpServletResponse.SC_FORBIDDEN ? ApiError.UNAUTHORIZED
				: ApiError.UNKNOWN;

		JSONObject errorJson = new JSONObject();
		errorJson.put("error", apiError.getCode());
		errorJson.put("message", message != null ? message : apiError.getDescription());

		baseRequest.setHandled(true);
		response.setContentType("application/json");

		try (Writer writer = response.getWriter()) {
			writer.write(errorJson.toJSONString());
		}
	}

}
