package org.atomicswap.controller;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.api.ApiService;
import org.atomicswap.controller.swap.SwapCoordinator;
import org.atomicswap.controller.swap.SwapMonitor;
import org.atomicswap.crosschain.ElectrumRpcBackend;
import org.atomicswap.crosschain.NodeRpcBackend;
import org.atomicswap.crosschain.SettlementBackend;
import org.atomicswap.crosschain.SettlementCalls;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.RepositoryFactory;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.repository.hsqldb.HSQLDBRepositoryFactory;
import org.atomicswap.settings.Settings;
import org.atomicswap.utils.NTP;

public class Controller {

	private static final Logger LOGGER = LogManager.getLogger(Controller.class);

	private static final String repositoryUrlTemplate = "jdbc:hsqldb:file:%s" + File.separator + "swaps;create=true;hsqldb.full_log_replay=true";

	private static Controller instance;

	private final String buildVersion;

	private final Object shutdownLock = new Object();
	private volatile boolean isStopping = false;

	private SettlementCalls settlementCalls;
	private SwapCoordinator swapCoordinator;
	private SwapMonitor swapMonitor;
	private ApiService apiService;

	private Controller() {
		Properties properties = new Properties();
		try (InputStream in = this.getClass().getResourceAsStream("/build.properties")) {
			if (in == null)
				throw new RuntimeException("Can't find build.properties resource");

			properties.load(in);
		} catch (IOException e) {
			throw new RuntimeException("Can't read build.properties resource", e);
		}

		String buildVersionProperty = properties.getProperty("build.version");
		if (buildVersionProperty == null)
			throw new RuntimeException("Can't read build.version from build.properties resource");

		if (buildVersionProperty.startsWith("$"))
			// Maven vars haven't been replaced - this was most likely built using an IDE, not via mvn package
			buildVersionProperty = "debug";

		this.buildVersion = buildVersionProperty;
		LOGGER.info(String.format("Build version: %s", this.buildVersion));
	}

	public static synchronized Controller getInstance() {
		if (instance == null)
			instance = new Controller();

		return instance;
	}

	public static String getRepositoryUrl() {
		return String.format(repositoryUrlTemplate, Settings.getInstance().getRepositoryPath());
	}

	public String getVersionString() {
		return this.buildVersion;
	}

	public boolean isStopping() {
		return this.isStopping;
	}

	public SwapCoordinator getSwapCoordinator() {
		return this.swapCoordinator;
	}

	// Entry point

	public static void main(String[] args) {
		LOGGER.info("Starting up...");

		// Load/check settings
		try {
			if (args.length > 0)
				Settings.fileInstance(args[0]);
			else
				Settings.getInstance();
		} catch (Throwable t) {
			LOGGER.error(String.format("Settings file issue: %s", t.getMessage()));
			System.exit(1);
			return;
		}

		LOGGER.info("Starting NTP");
		Long ntpOffset = Settings.getInstance().getTestNtpOffset();
		if (ntpOffset != null)
			NTP.setFixedOffset(ntpOffset);
		else
			NTP.start(Settings.getInstance().getNtpServers());

		LOGGER.info("Starting repository");
		try {
			RepositoryFactory repositoryFactory = new HSQLDBRepositoryFactory(getRepositoryUrl());
			RepositoryManager.setRepositoryFactory(repositoryFactory);
		} catch (DataException e) {
			// If exception has no cause then repository is in use by some other process.
			if (e.getCause() == null)
				LOGGER.error("Repository in use by another process?");
			else
				LOGGER.error("Unable to start repository", e);

			NTP.shutdownNow();
			System.exit(1);
			return;
		}

		Controller controller = Controller.getInstance();

		Runtime.getRuntime().addShutdownHook(new Thread() {
			@Override
			public void run() {
				Thread.currentThread().setName("Shutdown hook");

				Controller.getInstance().shutdown();
			}
		});

		try {
			controller.start();
		} catch (RuntimeException e) {
			LOGGER.error("Unable to start", e);
			controller.shutdown();
			System.exit(1);
		}
	}

	/** Builds settlement backends and swap coordination from settings, then starts monitor and API as configured. */
	public void start() {
		Settings settings = Settings.getInstance();

		Map<SupportedAsset, SettlementBackend> backends = new EnumMap<>(SupportedAsset.class);
		for (Settings.BackendSettings backendSettings : settings.getBackends()) {
			SupportedAsset asset = SupportedAsset.fromString(backendSettings.getAsset());

			LOGGER.info(() -> String.format("Using %s %s settlement backend at %s", asset, backendSettings.getType(), backendSettings.getRpcUrl()));
			if (Settings.BackendSettings.TYPE_ELECTRUM.equals(backendSettings.getType()))
				backends.put(asset, new ElectrumRpcBackend(asset, backendSettings.getRpcUrl(), backendSettings.getRpcUser(),
						backendSettings.getRpcPassword(), backendSettings.getWalletPassword()));
			else
				backends.put(asset, new NodeRpcBackend(asset, backendSettings.getRpcUrl(), backendSettings.getRpcUser(),
						backendSettings.getRpcPassword(), backendSettings.getWalletName(), backendSettings.getAssetLabel()));
		}

		if (backends.size() < SupportedAsset.values().length)
			LOGGER.warn("Not every supported asset has a settlement backend - swaps involving those assets will be refused");

		this.settlementCalls = new SettlementCalls(settings.getBackendTimeout(), settings.getBackendMaxRetries(), settings.getBackendRetryBackoff());
		this.swapCoordinator = new SwapCoordinator(backends, this.settlementCalls,
				settings.getInitiatorTimelockPeriod(), settings.getAcceptorTimelockPeriod(), settings.getPendingActionTimeout());

		if (settings.isMonitorEnabled()) {
			LOGGER.info("Starting swap monitor");
			this.swapMonitor = new SwapMonitor(this.swapCoordinator, settings.getMonitorInterval());
			this.swapMonitor.start();
		}

		if (settings.isApiEnabled()) {
			LOGGER.info(String.format("Starting API on port %d", settings.getApiPort()));
			this.apiService = new ApiService(this.swapCoordinator);
			this.apiService.start();
		}
	}

	public void shutdown() {
		synchronized (this.shutdownLock) {
			if (this.isStopping)
				return;

			this.isStopping = true;

			if (this.apiService != null) {
				LOGGER.info("Shutting down API");
				this.apiService.stop();
			}

			if (this.swapMonitor != null) {
				LOGGER.info("Shutting down swap monitor");
				this.swapMonitor.shutdown();
				try {
					this.swapMonitor.join();
				} catch (InterruptedException e) {
					// We were interrupted while waiting for thread to join
				}
			}

			if (this.settlementCalls != null) {
				LOGGER.info("Shutting down settlement calls");
				this.settlementCalls.close();
			}

			try {
				LOGGER.info("Shutting down repository");
				RepositoryManager.closeRepositoryFactory();
			} catch (DataException e) {
				LOGGER.error("Error occurred while shutting down repository", e);
			}

			LOGGER.info("Shutting down NTP");
			NTP.shutdownNow();

			LOGGER.info("Shutdown complete!");
		}
	}

}
