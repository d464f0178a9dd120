package org.atomicswap.settings;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.SupportedAsset;
import org.eclipse.persistence.exceptions.XMLMarshalException;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class Settings {

	private static final int DEFAULT_API_PORT = 8000;

	private static final Logger LOGGER = LogManager.getLogger(Settings.class);
	private static final String SETTINGS_FILENAME = "settings.json";

	// Properties
	private static Settings instance;

	/** Connection details for one asset's settlement node. */
	@XmlAccessorType(XmlAccessType.FIELD)
	public static class BackendSettings {
		public static final String TYPE_NODE = "node";
		public static final String TYPE_ELECTRUM = "electrum";

		private String asset;
		/** "node" for a Bitcoin Core/Elements node, "electrum" for an Electrum daemon. */
		private String type = TYPE_NODE;
		/** JSON-RPC endpoint, e.g. http://127.0.0.1:18884 */
		private String rpcUrl;
		private String rpcUser;
		private String rpcPassword;
		/** Optional node wallet name, for multi-wallet nodes. */
		private String walletName;
		/** Elements issued-asset label, e.g. "DePix". Null for the chain's native asset. */
		private String assetLabel;
		/** Electrum wallet password, used when signing. Optional. */
		private String walletPassword;

		protected BackendSettings() {
			/* JAXB */
		}

		public String getAsset() {
			return this.asset;
		}

		public String getType() {
			return this.type;
		}

		public String getRpcUrl() {
			return this.rpcUrl;
		}

		public String getRpcUser() {
			return this.rpcUser;
		}

		public String getRpcPassword() {
			return this.rpcPassword;
		}

		public String getWalletName() {
			return this.walletName;
		}

		public String getAssetLabel() {
			return this.assetLabel;
		}

		public String getWalletPassword() {
			return this.walletPassword;
		}
	}

	// Settings, and other config files
	private String userPath;

	// Common to all networking
	private String bindAddress = "::"; // Use IPv6 wildcard to listen on all local addresses

	// API-related
	private boolean apiEnabled = true;
	private Integer apiPort;
	private String[] apiWhitelist = new String[] {
		"::1", "127.0.0.1"
	};
	private boolean apiLoggingEnabled = false;

	// Repository related
	/** Queries that take longer than this are logged. (milliseconds) */
	private Long slowQueryThreshold = null;
	/** Repository storage path. */
	private String repositoryPath = "db";

	// Swap timelocks
	/** How long the initiator's leg stays locked before it can be refunded. (milliseconds) */
	private long initiatorTimelockPeriod = 24 * 60 * 60 * 1000L;
	/** How long the acceptor's leg stays locked before it can be refunded. Must be shorter than initiator's. (milliseconds) */
	private long acceptorTimelockPeriod = 12 * 60 * 60 * 1000L;

	// Expiry monitor
	private boolean monitorEnabled = true;
	/** Interval between scans for expired swaps. (milliseconds) */
	private long monitorInterval = 60 * 1000L;

	// Settlement backend calls
	/** Deadline for a single backend call. (milliseconds) */
	private long backendTimeout = 30 * 1000L;
	/** Extra attempts for repeat-safe backend calls that fail transiently. */
	private int backendMaxRetries = 3;
	/** Delay before first retry, doubled for each subsequent retry. (milliseconds) */
	private long backendRetryBackoff = 1000L;
	/** Age after which a swap step left pending by another coordinator is treated as abandoned. (milliseconds) */
	private long pendingActionTimeout = 10 * 60 * 1000L;

	private BackendSettings[] backends = new BackendSettings[0];

	/** Array of NTP server hostnames. */
	private String[] ntpServers = new String[] {
		"pool.ntp.org",
		"0.pool.ntp.org",
		"1.pool.ntp.org",
		"2.pool.ntp.org",
		"3.pool.ntp.org",
		"time.google.com",
		"time.cloudflare.com"
	};
	/** If set, NTP is not queried and this fixed offset is added to the system clock instead. */
	private Long testNtpOffset = null;

	// Constructors

	private Settings() {
	}

	// Other methods

	public static synchronized Settings getInstance() {
		if (instance == null)
			fileInstance(SETTINGS_FILENAME);

		return instance;
	}

	/**
	 * Parse settings from given file.
	 * <p>
	 * Throws <tt>RuntimeException</tt> with <tt>UnmarshalException</tt> as cause if settings file could not be parsed.
	 * <p>
	 * We use <tt>RuntimeException</tt> because it can be caught first caller of {@link #getInstance()} above,
	 * but it's not necessary to surround later {@link #getInstance()} calls
	 * with <tt>try-catch</tt> as they should be read-only.
	 *
	 * @param filename
	 * @throws RuntimeException with UnmarshalException as cause if settings file could not be parsed
	 * @throws RuntimeException with FileNotFoundException as cause if settings file could not be found/opened
	 * @throws RuntimeException with JAXBException as cause if some unexpected JAXB-related error occurred
	 * @throws RuntimeException with IOException as cause if some unexpected I/O-related error occurred
	 */
	public static void fileInstance(String filename) {
		JAXBContext jc;
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of Settings
			jc = JAXBContextFactory.createContext(new Class[] {
				Settings.class
			}, null);

			// Create unmarshaller
			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to process settings file";
			LOGGER.error(message, e);
			throw new RuntimeException(message, e);
		}

		Settings settings = null;
		String path = "";
		boolean followedUserPath = false;

		do {
			LOGGER.info("Using settings file: " + path + filename);

			// Create the StreamSource by creating Reader to the JSON input
			try (Reader settingsReader = new FileReader(path + filename)) {
				StreamSource json = new StreamSource(settingsReader);

				// Attempt to unmarshal JSON stream to Settings
				settings = unmarshaller.unmarshal(json, Settings.class).getValue();
			} catch (FileNotFoundException e) {
				String message = "Settings file not found: " + path + filename;
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (UnmarshalException e) {
				Throwable linkedException = e.getLinkedException();
				if (linkedException instanceof XMLMarshalException) {
					String message = ((XMLMarshalException) linkedException).getInternalException().getLocalizedMessage();
					LOGGER.error(message);
					throw new RuntimeException(message, e);
				}

				String message = "Failed to parse settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (JAXBException e) {
				String message = "Unexpected JAXB issue while processing settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			} catch (IOException e) {
				String message = "Unexpected I/O issue while processing settings file";
				LOGGER.error(message, e);
				throw new RuntimeException(message, e);
			}

			// Only follow userPath redirect once
			if (settings.userPath == null || followedUserPath)
				break;

			// Adjust filename and go round again
			path = settings.userPath;

			// Add trailing directory separator if needed
			if (!path.endsWith(File.separator))
				path += File.separator;

			followedUserPath = true;
		} while (true);

		// Validate settings
		settings.validate();

		// Minor fix-up
		settings.userPath = path;

		// Successfully read settings now in effect
		instance = settings;
	}

	public static void throwValidationError(String message) {
		throw new RuntimeException(message, new UnmarshalException(message));
	}

	private void validate() {
		if (this.initiatorTimelockPeriod <= 0 || this.acceptorTimelockPeriod <= 0)
			throwValidationError("timelock periods must be positive");

		if (this.acceptorTimelockPeriod >= this.initiatorTimelockPeriod)
			throwValidationError("acceptorTimelockPeriod must be shorter than initiatorTimelockPeriod");

		if (this.monitorInterval <= 0)
			throwValidationError("monitorInterval must be positive");

		if (this.backendTimeout <= 0)
			throwValidationError("backendTimeout must be positive");

		if (this.backendMaxRetries < 0)
			throwValidationError("backendMaxRetries must not be negative");

		if (this.backendRetryBackoff < 0)
			throwValidationError("backendRetryBackoff must not be negative");

		// Longest a repeat-safe backend call can take, including retries and their backoff
		long maxBackendCallDuration = this.backendTimeout * (this.backendMaxRetries + 1)
				+ this.backendRetryBackoff * ((1L << Math.min(this.backendMaxRetries, 20)) - 1);
		if (this.pendingActionTimeout <= maxBackendCallDuration)
			throwValidationError(String.format("pendingActionTimeout must be longer than %d ms of backend calls and retries", maxBackendCallDuration));

		Set<SupportedAsset> configuredAssets = new HashSet<>();
		for (BackendSettings backendSettings : this.backends) {
			SupportedAsset asset = SupportedAsset.fromString(backendSettings.asset);
			if (asset == null)
				throwValidationError(String.format("Unsupported backend asset: %s", backendSettings.asset));

			if (!configuredAssets.add(asset))
				throwValidationError(String.format("Duplicate backend for asset %s", asset));

			if (backendSettings.rpcUrl == null || backendSettings.rpcUrl.isEmpty())
				throwValidationError(String.format("Missing rpcUrl for %s backend", asset));

			if (!BackendSettings.TYPE_NODE.equals(backendSettings.type) && !BackendSettings.TYPE_ELECTRUM.equals(backendSettings.type))
				throwValidationError(String.format("Unsupported backend type for %s: %s", asset, backendSettings.type));

			if (BackendSettings.TYPE_ELECTRUM.equals(backendSettings.type) && backendSettings.assetLabel != null)
				throwValidationError(String.format("Electrum backend for %s cannot settle issued assets", asset));
		}
	}

	// Getters / setters

	public String getUserPath() {
		return this.userPath;
	}

	public String getBindAddress() {
		return this.bindAddress;
	}

	public boolean isApiEnabled() {
		return this.apiEnabled;
	}

	public int getApiPort() {
		if (this.apiPort != null)
			return this.apiPort;

		return DEFAULT_API_PORT;
	}

	public String[] getApiWhitelist() {
		return this.apiWhitelist;
	}

	public boolean isApiLoggingEnabled() {
		return this.apiLoggingEnabled;
	}

	public Long getSlowQueryThreshold() {
		return this.slowQueryThreshold;
	}

	public String getRepositoryPath() {
		return this.repositoryPath;
	}

	public long getInitiatorTimelockPeriod() {
		return this.initiatorTimelockPeriod;
	}

	public long getAcceptorTimelockPeriod() {
		return this.acceptorTimelockPeriod;
	}

	public boolean isMonitorEnabled() {
		return this.monitorEnabled;
	}

	public long getMonitorInterval() {
		return this.monitorInterval;
	}

	public long getBackendTimeout() {
		return this.backendTimeout;
	}

	public int getBackendMaxRetries() {
		return this.backendMaxRetries;
	}

	public long getBackendRetryBackoff() {
		return this.backendRetryBackoff;
	}

	public long getPendingActionTimeout() {
		return this.pendingActionTimeout;
	}

	public List<BackendSettings> getBackends() {
		return Collections.unmodifiableList(Arrays.asList(this.backends));
	}

	public String[] getNtpServers() {
		return this.ntpServers;
	}

	public Long getTestNtpOffset() {
		return this.testNtpOffset;
	}

}
