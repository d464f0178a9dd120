package org.atomicswap.test.common;

import static org.junit.Assert.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.controller.swap.SwapCoordinator;
import org.atomicswap.crosschain.SettlementBackend;
import org.atomicswap.crosschain.SettlementCalls;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.RepositoryFactory;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.repository.hsqldb.HSQLDBRepositoryFactory;
import org.atomicswap.settings.Settings;
import org.atomicswap.utils.NTP;
import org.junit.AfterClass;
import org.junit.BeforeClass;

public class Common {

	static {
		// This must go before any calls to LogManager/Logger
		System.setProperty("java.util.logging.manager", "org.apache.logging.log4j.jul.LogManager");
	}

	private static final Logger LOGGER = LogManager.getLogger(Common.class);

	public static final String testConnectionUrlMemory = "jdbc:hsqldb:mem:testdb";
	public static final String testConnectionUrlDisk = "jdbc:hsqldb:file:%s/swaps;create=true";

	public static final String testSettingsFilename = "test-settings.json";

	static {
		URL testSettingsUrl = Common.class.getClassLoader().getResource(testSettingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());
	}

	public static void useSettings(String settingsFilename) throws DataException {
		if (RepositoryManager.getRepositoryFactory() != null)
			closeRepository();

		LOGGER.debug(String.format("Using setting file: %s", settingsFilename));
		URL testSettingsUrl = Common.class.getClassLoader().getResource(settingsFilename);
		assertNotNull("Test settings JSON file not found", testSettingsUrl);
		Settings.fileInstance(testSettingsUrl.getPath());

		setRepository(true);
	}

	/** Loads test settings into a fresh in-memory repository and pins network time to local time plus the test offset. */
	public static void useDefaultSettings() throws DataException {
		useSettings(testSettingsFilename);
		NTP.setFixedOffset(Settings.getInstance().getTestNtpOffset());
	}

	public static void setRepository(boolean inMemory) throws DataException {
		String connectionUrlDisk = String.format(testConnectionUrlDisk, Settings.getInstance().getRepositoryPath());
		String connectionUrl = inMemory ? testConnectionUrlMemory : connectionUrlDisk;
		RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(connectionUrl);
		RepositoryManager.setRepositoryFactory(repositoryFactory);
	}

	public static void deleteTestRepository() throws DataException {
		// Delete repository directory if exists
		Path repositoryPath = Paths.get(Settings.getInstance().getRepositoryPath());
		try {
			FileUtils.deleteDirectory(repositoryPath.toFile());
		} catch (IOException e) {
			throw new DataException(String.format("Unable to delete test repository: %s", e.getMessage()));
		}
	}

	@BeforeClass
	public static void setRepositoryInMemory() throws DataException {
		Common.deleteTestRepository();
		Common.setRepository(true);
	}

	@AfterClass
	public static void closeRepository() throws DataException {
		RepositoryManager.closeRepositoryFactory();
		Common.deleteTestRepository();
	}

	// Time travel

	/** Moves network time forward so that passed timelock has expired. */
	public static void passTimelock(long timelock) {
		long offset = timelock - System.currentTimeMillis() + 1000L;
		NTP.setFixedOffset(Math.max(offset, Settings.getInstance().getTestNtpOffset()));
	}

	public static void resetNetworkTime() {
		NTP.setFixedOffset(Settings.getInstance().getTestNtpOffset());
	}

	// Swap set-up

	public static SettlementCalls newSettlementCalls() {
		Settings settings = Settings.getInstance();
		return new SettlementCalls(settings.getBackendTimeout(), settings.getBackendMaxRetries(), settings.getBackendRetryBackoff());
	}

	public static SwapCoordinator newSwapCoordinator(SettlementCalls settlementCalls, SettlementBackend... backends) {
		Map<SupportedAsset, SettlementBackend> backendsByAsset = new EnumMap<>(SupportedAsset.class);
		for (SettlementBackend backend : backends)
			backendsByAsset.put(backend.getAsset(), backend);

		Settings settings = Settings.getInstance();
		return new SwapCoordinator(backendsByAsset, settlementCalls, settings.getInitiatorTimelockPeriod(), settings.getAcceptorTimelockPeriod(),
				settings.getPendingActionTimeout());
	}

	// Test assertions

	public static void assertEqualBigDecimals(String message, BigDecimal expected, BigDecimal actual) {
		assertTrue(String.format("%s: expected %s, actual %s", message, expected.toPlainString(), actual.toPlainString()),
				actual.compareTo(expected) == 0);
	}

}
