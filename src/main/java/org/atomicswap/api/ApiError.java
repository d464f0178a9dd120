package org.atomicswap.api;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Map;

public enum ApiError {
	// COMMON
	UNKNOWN(0, 500, "unknown error"),
	JSON(1, 400, "failed to parse JSON"),
	INVALID_CRITERIA(2, 400, "invalid search criteria"),
	UNAUTHORIZED(3, 403, "API call unauthorized"),
	REPOSITORY_ISSUE(5, 500, "repository error"),
	NOT_FOUND(6, 404, "not found"),

	// SWAPS
	INVALID_SWAP_REQUEST(100, 400, "invalid swap request"),
	SWAP_NOT_FOUND(101, 404, "swap not found"),
	INVALID_SWAP_STATE(102, 409, "swap not in required state"),
	TIMELOCK_NOT_EXPIRED(103, 409, "timelock has not yet expired"),

	// SETTLEMENT BACKENDS
	SETTLEMENT_BACKEND_UNAVAILABLE(200, 503, "settlement backend unavailable"),
	SETTLEMENT_BACKEND_REJECTED(201, 502, "settlement backend rejected request");

	private static final Map<Integer, ApiError> map = stream(ApiError.values()).collect(toMap(apiError -> apiError.code, apiError -> apiError));

	private final int code; // API error code
	private final int status; // HTTP status code
	private final String description;

	private ApiError(int code, int status, String description) {
		this.code = code;
		this.status = status;
		this.description = description;
	}

	public static ApiError fromCode(int code) {
		return map.get(code);
	}

	public int getCode() {
		return this.code;
	}

	public int getStatus() {
		return this.status;
	}

	public String getDescription() {
		return this.description;
	}

}
