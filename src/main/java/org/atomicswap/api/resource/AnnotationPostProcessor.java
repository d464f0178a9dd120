package org.atomicswap.api.resource;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.api.ApiError;
import org.atomicswap.api.ApiErrors;
import org.atomicswap.api.ApiService;

import io.swagger.v3.jaxrs2.ReaderListener;
import io.swagger.v3.oas.integration.api.OpenApiReader;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;

/** Adds the errors listed by {@link ApiErrors} to each API call's OpenAPI responses. */
public class AnnotationPostProcessor implements ReaderListener {

	private static final Logger LOGGER = LogManager.getLogger(AnnotationPostProcessor.class);

	@Override
	public void beforeScan(OpenApiReader reader, OpenAPI openAPI) {
	}

	@Override
	public void afterScan(OpenApiReader reader, OpenAPI openAPI) {
		if (openAPI.getPaths() == null)
			return;

		for (Class<?> clazz : ApiService.getResourceClasses()) {
			Path classPath = clazz.getAnnotation(Path.class);
			String basePath = classPath != null ? classPath.value() : "";

			for (Method method : clazz.getDeclaredMethods()) {
				ApiErrors apiErrors = method.getAnnotation(ApiErrors.class);
				Path methodPath = method.getAnnotation(Path.class);
				if (apiErrors == null || methodPath == null)
					continue;

				String path = basePath + methodPath.value();
				PathItem pathItem = openAPI.getPaths().get(path);
				if (pathItem == null) {
					LOGGER.trace(() -> String.format("No OpenAPI path for %s", path));
					continue;
				}

				Operation operation = null;
				if (method.isAnnotationPresent(GET.class))
					operation = pathItem.getGet();
				else if (method.isAnnotationPresent(POST.class))
					operation = pathItem.getPost();

				if (operation == null)
					continue;

				addApiErrorResponses(operation, apiErrors.value());
			}
		}
	}

	private static void addApiErrorResponses(Operation operation, ApiError[] apiErrors) {
		// Several errors can share the same HTTP status
		Map<Integer, List<ApiError>> errorsByStatus = new TreeMap<>();
		for (ApiError apiError : apiErrors)
			errorsByStatus.computeIfAbsent(apiError.getStatus(), status -> new ArrayList<>()).add(apiError);

		ApiResponses responses = operation.getResponses();
		if (responses == null) {
			responses = new ApiResponses();
			operation.setResponses(responses);
		}

		for (Map.Entry<Integer, List<ApiError>> entry : errorsByStatus.entrySet()) {
			StringBuilder description = new StringBuilder(256);

			for (ApiError apiError : entry.getValue()) {
				if (description.length() > 0)
					description.append("; ");

				description.append(String.format("error %d: %s", apiError.getCode(), apiError.getDescription()));
			}

			responses.addApiResponse(String.valueOf(entry.getKey()), new ApiResponse().description(description.toString()));
		}
	}

}
