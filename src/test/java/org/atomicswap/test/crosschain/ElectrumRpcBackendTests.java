package org.atomicswap.test.crosschain;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.apache.commons.io.IOUtils;
import org.atomicswap.crosschain.ElectrumRpcBackend;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.crosschain.SettlementBackendException.RejectedException;
import org.atomicswap.crosschain.SupportedAsset;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class ElectrumRpcBackendTests {

	/** Fake Electrum daemon: replies per RPC method and records every request. */
	private static class FakeElectrumHandler extends AbstractHandler {
		final Map<String, String> results = new ConcurrentHashMap<>();
		final List<JSONObject> requests = new CopyOnWriteArrayList<>();

		@Override
		public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException {
			JSONObject requestJson = (JSONObject) JSONValue.parse(IOUtils.toString(request.getInputStream(), StandardCharsets.UTF_8));
			this.requests.add(requestJson);

			String method = (String) requestJson.get("method");
			String result = this.results.get(method);

			// Electrum reports RPC errors with HTTP 200
			String body = result != null
					? String.format("{\"jsonrpc\":\"2.0\",\"id\":%s,\"result\":%s}", requestJson.get("id"), result)
					: String.format("{\"jsonrpc\":\"2.0\",\"id\":%s,\"error\":{\"code\":-32601,\"message\":\"Unknown method %s\"}}", requestJson.get("id"), method);

			response.setStatus(HttpServletResponse.SC_OK);
			response.setContentType("application/json");
			try (Writer writer = response.getWriter()) {
				writer.write(body);
			}

			baseRequest.setHandled(true);
		}

		JSONObject params(int index) {
			return (JSONObject) this.requests.get(index).get("params");
		}
	}

	private Server server;
	private FakeElectrumHandler daemon;
	private String daemonUrl;

	@Before
	public void beforeTest() throws Exception {
		this.daemon = new FakeElectrumHandler();

		this.server = new Server(new InetSocketAddress("127.0.0.1", 0));
		this.server.setHandler(this.daemon);
		this.server.start();

		int port = ((ServerConnector) this.server.getConnectors()[0]).getLocalPort();
		this.daemonUrl = String.format("http://127.0.0.1:%d", port);
	}

	@After
	public void afterTest() throws Exception {
		this.server.stop();
	}

	@Test
	public void testLockBuildsSignsAndBroadcasts() throws SettlementBackendException {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, "user", "pass", "wallet-pw");

		String txid = "f00dfeedf00dfeedf00dfeedf00dfeedf00dfeedf00dfeedf00dfeedf00dfeed";
		this.daemon.results.put("payto", "\"0200unsigned\"");
		this.daemon.results.put("signtransaction", "\"0200signed\"");
		this.daemon.results.put("broadcast", String.format("\"%s\"", txid));

		assertEquals(txid, backend.lock(new BigDecimal("0.0015"), "cd".repeat(32), 1_700_000_000_000L, "bc1qrecipient"));

		assertEquals(3, this.daemon.requests.size());
		assertEquals("payto", this.daemon.requests.get(0).get("method"));
		assertEquals("2.0", this.daemon.requests.get(0).get("jsonrpc"));

		JSONObject paytoParams = this.daemon.params(0);
		assertEquals("bc1qrecipient", paytoParams.get("destination"));
		assertEquals("0.00150000", paytoParams.get("amount"));
		assertEquals(Boolean.TRUE, paytoParams.get("unsigned"));
		assertEquals("wallet-pw", paytoParams.get("password"));

		assertEquals("signtransaction", this.daemon.requests.get(1).get("method"));
		assertEquals("0200unsigned", this.daemon.params(1).get("tx"));
		assertEquals("wallet-pw", this.daemon.params(1).get("password"));

		assertEquals("broadcast", this.daemon.requests.get(2).get("method"));
		assertEquals("0200signed", this.daemon.params(2).get("tx"));
	}

	@Test
	public void testLockWithoutPassword() throws SettlementBackendException {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, null, null, null);

		this.daemon.results.put("payto", "\"0200unsigned\"");
		this.daemon.results.put("signtransaction", "\"0200signed\"");
		this.daemon.results.put("broadcast", "\"txid\"");

		backend.lock(BigDecimal.ONE, "00", 0L, "bc1qrecipient");

		assertFalse(this.daemon.params(0).containsKey("password"));
		assertFalse(this.daemon.params(1).containsKey("password"));
	}

	@Test
	public void testFailedSigningIsNotBroadcast() {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, "user", "pass", "wrong");

		this.daemon.results.put("payto", "\"0200unsigned\"");
		this.daemon.results.put("broadcast", "\"txid\"");

		try {
			backend.lock(BigDecimal.ONE, "00", 0L, "bc1qrecipient");
			fail("Lock should be rejected when signing fails");
		} catch (RejectedException e) {
			assertEquals(Integer.valueOf(-32601), e.getDaemonErrorCode());
		} catch (SettlementBackendException e) {
			fail("RPC error should be a rejection");
		}

		assertEquals(2, this.daemon.requests.size());
	}

	@Test
	public void testConfirmedBalance() throws SettlementBackendException {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, "user", "pass", null);

		this.daemon.results.put("getbalance", "{\"confirmed\":\"0.125\",\"unconfirmed\":\"0.5\"}");

		assertEquals(0, new BigDecimal("0.125").compareTo(backend.getBalance()));
	}

	@Test
	public void testEmptyWalletBalance() throws SettlementBackendException {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, "user", "pass", null);

		this.daemon.results.put("getbalance", "{}");

		assertEquals(0, BigDecimal.ZERO.compareTo(backend.getBalance()));
	}

	@Test
	public void testRefundConfirmsLock() throws SettlementBackendException {
		ElectrumRpcBackend backend = new ElectrumRpcBackend(SupportedAsset.BTC, this.daemonUrl, "user", "pass", null);

		this.daemon.results.put("gettransaction", "\"0200rawtx\"");

		assertEquals("lock-txid", backend.refund("lock-txid"));
		assertEquals("lock-txid", this.daemon.params(0).get("txid"));
	}

}
