package org.atomicswap.crosschain;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.SettlementBackendException.RejectedException;
import org.atomicswap.crosschain.SettlementBackendException.UnavailableException;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

/**
 * Base for settlement backends driving a wallet daemon over JSON-RPC with HTTP basic auth.
 * <p>
 * Transport failures and HTTP 5xx without an RPC error are {@link UnavailableException}s,
 * RPC error objects and other HTTP failures are {@link RejectedException}s.
 */
public abstract class JsonRpcBackend implements SettlementBackend {

	private static final Logger LOGGER = LogManager.getLogger(JsonRpcBackend.class);

	private static final int CONNECT_TIMEOUT = 5000; // ms
	private static final int READ_TIMEOUT = 30000; // ms

	protected final SupportedAsset asset;

	private final String rpcUrl;
	private final String authorization;
	private final String jsonRpcVersion;

	private final AtomicLong nextId = new AtomicLong(1);

	protected JsonRpcBackend(SupportedAsset asset, String rpcUrl, String rpcUser, String rpcPassword, String jsonRpcVersion) {
		this.asset = asset;
		this.rpcUrl = rpcUrl;
		this.jsonRpcVersion = jsonRpcVersion;

		if (rpcUser != null) {
			String credentials = rpcUser + ":" + (rpcPassword != null ? rpcPassword : "");
			this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
		} else {
			this.authorization = null;
		}
	}

	@Override
	public SupportedAsset getAsset() {
		return this.asset;
	}

	/** Calls RPC <tt>method</tt> with named params, returning its <tt>result</tt>. */
	@SuppressWarnings("unchecked")
	protected Object rpc(String method, JSONObject params) throws SettlementBackendException {
		JSONObject requestJson = new JSONObject();
		requestJson.put("jsonrpc", this.jsonRpcVersion);
		requestJson.put("id", this.nextId.getAndIncrement());
		requestJson.put("method", method);
		requestJson.put("params", params);

		String request = requestJson.toJSONString();
		// Params may carry a wallet password
		LOGGER.trace(() -> String.format("%s request: %s", this.asset, method));

		final int responseCode;
		final String response;

		try {
			HttpURLConnection connection = (HttpURLConnection) new URL(this.rpcUrl).openConnection();
			connection.setConnectTimeout(CONNECT_TIMEOUT);
			connection.setReadTimeout(READ_TIMEOUT);
			connection.setRequestMethod("POST");
			connection.setDoOutput(true);
			connection.setRequestProperty("Content-Type", "application/json");
			if (this.authorization != null)
				connection.setRequestProperty("Authorization", this.authorization);

			try (OutputStream out = connection.getOutputStream()) {
				out.write(request.getBytes(StandardCharsets.UTF_8));
			}

			responseCode = connection.getResponseCode();

			// Nodes report RPC errors with HTTP 500 and a JSON body
			InputStream in = responseCode < 400 ? connection.getInputStream() : connection.getErrorStream();
			if (in == null) {
				response = "";
			} else {
				try (InputStream body = in) {
					response = new String(body.readAllBytes(), StandardCharsets.UTF_8);
				}
			}
		} catch (IOException e) {
			throw new UnavailableException(String.format("Unable to reach %s wallet for %s RPC: %s", this.asset, method, e.getMessage()), e);
		}

		LOGGER.trace(() -> String.format("%s response (HTTP %d): %s", this.asset, responseCode, response));

		Object responseObj = JSONValue.parse(response);
		if (!(responseObj instanceof JSONObject)) {
			if (responseCode >= 500)
				throw new UnavailableException(String.format("%s wallet returned HTTP %d for %s RPC", this.asset, responseCode, method));

			throw new RejectedException(String.format("%s wallet returned HTTP %d for %s RPC", this.asset, responseCode, method));
		}

		JSONObject responseJson = (JSONObject) responseObj;

		Object errorObj = responseJson.get("error");
		if (errorObj instanceof JSONObject) {
			JSONObject errorJson = (JSONObject) errorObj;

			Object messageObj = errorJson.get("message");
			String message = messageObj instanceof String ? (String) messageObj : errorJson.toJSONString();

			Object codeObj = errorJson.get("code");
			if (codeObj instanceof Number)
				throw new RejectedException(((Number) codeObj).intValue(), String.format("%s RPC %s: %s", this.asset, method, message));

			throw new RejectedException(String.format("%s RPC %s: %s", this.asset, method, message));
		}

		if (responseCode >= 500)
			throw new UnavailableException(String.format("%s wallet returned HTTP %d for %s RPC", this.asset, responseCode, method));

		return responseJson.get("result");
	}

	protected static String stringResult(Object result, String method) throws RejectedException {
		if (!(result instanceof String) || ((String) result).isEmpty())
			throw new RejectedException(String.format("Unexpected output from %s RPC", method));

		return (String) result;
	}

}
