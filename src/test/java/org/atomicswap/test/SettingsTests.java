package org.atomicswap.test;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.atomicswap.repository.DataException;
import org.atomicswap.settings.Settings;
import org.atomicswap.test.common.Common;
import org.junit.After;
import org.junit.Test;

public class SettingsTests extends Common {

	private File settingsFile;

	@After
	public void afterTest() throws DataException {
		if (this.settingsFile != null)
			FileUtils.deleteQuietly(this.settingsFile);

		// Restore test settings for other tests
		Common.useDefaultSettings();
	}

	private String writeSettings(String json) throws IOException {
		this.settingsFile = File.createTempFile("settings", ".json");
		FileUtils.writeStringToFile(this.settingsFile, json, StandardCharsets.UTF_8);
		return this.settingsFile.getPath();
	}

	@Test
	public void testTestSettings() throws DataException {
		Common.useDefaultSettings();

		Settings settings = Settings.getInstance();
		assertEquals(7_200_000L, settings.getInitiatorTimelockPeriod());
		assertEquals(3_600_000L, settings.getAcceptorTimelockPeriod());
		assertFalse(settings.isMonitorEnabled());
		assertEquals(Long.valueOf(0L), settings.getTestNtpOffset());

		List<Settings.BackendSettings> backends = settings.getBackends();
		assertEquals(2, backends.size());
		assertEquals("BTC", backends.get(0).getAsset());
		assertEquals("swaps", backends.get(0).getWalletName());
		assertEquals("DePix", backends.get(1).getAssetLabel());
	}

	@Test
	public void testDefaults() throws IOException {
		Settings.fileInstance(writeSettings("{}"));

		Settings settings = Settings.getInstance();
		assertEquals(8000, settings.getApiPort());
		assertEquals(24 * 60 * 60 * 1000L, settings.getInitiatorTimelockPeriod());
		assertEquals(12 * 60 * 60 * 1000L, settings.getAcceptorTimelockPeriod());
		assertTrue(settings.isMonitorEnabled());
		assertTrue(settings.getBackends().isEmpty());
		assertNull(settings.getTestNtpOffset());
		assertEquals(10 * 60 * 1000L, settings.getPendingActionTimeout());
	}

	@Test
	public void testAcceptorTimelockMustBeShorter() throws IOException {
		assertInvalid(writeSettings("{ \"initiatorTimelockPeriod\": 3600000, \"acceptorTimelockPeriod\": 3600000 }"));
	}

	@Test
	public void testUnknownBackendAsset() throws IOException {
		assertInvalid(writeSettings("{ \"backends\": [ { \"asset\": \"DOGE\", \"rpcUrl\": \"http://127.0.0.1:22555\" } ] }"));
	}

	@Test
	public void testDuplicateBackend() throws IOException {
		assertInvalid(writeSettings("{ \"backends\": [ "
				+ "{ \"asset\": \"BTC\", \"rpcUrl\": \"http://127.0.0.1:8332\" }, "
				+ "{ \"asset\": \"btc\", \"rpcUrl\": \"http://127.0.0.1:18332\" } ] }"));
	}

	@Test
	public void testBackendNeedsUrl() throws IOException {
		assertInvalid(writeSettings("{ \"backends\": [ { \"asset\": \"DEPIX\" } ] }"));
	}

	@Test
	public void testElectrumBackend() throws IOException {
		Settings.fileInstance(writeSettings("{ \"backends\": [ { \"asset\": \"BTC\", \"type\": \"electrum\", "
				+ "\"rpcUrl\": \"http://127.0.0.1:7777\", \"walletPassword\": \"secret\" } ] }"));

		Settings.BackendSettings backendSettings = Settings.getInstance().getBackends().get(0);
		assertEquals(Settings.BackendSettings.TYPE_ELECTRUM, backendSettings.getType());
		assertEquals("secret", backendSettings.getWalletPassword());
	}

	@Test
	public void testBackendTypeDefaultsToNode() throws IOException {
		Settings.fileInstance(writeSettings("{ \"backends\": [ { \"asset\": \"DEPIX\", \"rpcUrl\": \"http://127.0.0.1:18884\" } ] }"));

		assertEquals(Settings.BackendSettings.TYPE_NODE, Settings.getInstance().getBackends().get(0).getType());
	}

	@Test
	public void testUnknownBackendType() throws IOException {
		assertInvalid(writeSettings("{ \"backends\": [ { \"asset\": \"BTC\", \"type\": \"lightning\", \"rpcUrl\": \"http://127.0.0.1:9735\" } ] }"));
	}

	@Test
	public void testElectrumCannotSettleIssuedAsset() throws IOException {
		assertInvalid(writeSettings("{ \"backends\": [ { \"asset\": \"DEPIX\", \"type\": \"electrum\", "
				+ "\"rpcUrl\": \"http://127.0.0.1:7777\", \"assetLabel\": \"DePix\" } ] }"));
	}

	@Test
	public void testPendingActionTimeoutMustOutlastBackendCalls() throws IOException {
		// 1000 ms x 3 attempts + 100 ms + 200 ms backoff = 3300 ms
		assertInvalid(writeSettings("{ \"backendTimeout\": 1000, \"backendMaxRetries\": 2, \"backendRetryBackoff\": 100, "
				+ "\"pendingActionTimeout\": 3300 }"));

		Settings.fileInstance(writeSettings("{ \"backendTimeout\": 1000, \"backendMaxRetries\": 2, \"backendRetryBackoff\": 100, "
				+ "\"pendingActionTimeout\": 3301 }"));
		assertEquals(3301L, Settings.getInstance().getPendingActionTimeout());
	}

	@Test(expected = RuntimeException.class)
	public void testMissingFile() {
		Settings.fileInstance("no-such-settings-file.json");
	}

	private static void assertInvalid(String filename) {
		try {
			Settings.fileInstance(filename);
			fail("Settings should have been refused");
		} catch (RuntimeException e) {
			// Expected
		}
	}

}
