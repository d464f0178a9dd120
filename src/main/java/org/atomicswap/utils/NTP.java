package org.atomicswap.utils;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.apache.commons.net.ntp.NTPUDPClient;
import org.apache.commons.net.ntp.TimeInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Network-corrected wall clock.
 * <p>
 * Timelocks are compared against this clock rather than the local system clock,
 * as the two settlement backends share no clock with us or with each other.
 */
public class NTP implements Runnable {

	private static final Logger LOGGER = LogManager.getLogger(NTP.class);

	private static final int NTP_TIMEOUT = 5000; // ms
	private static final long PRE_SYNC_INTERVAL = 10 * 1000L; // ms
	private static final long POST_SYNC_INTERVAL = 5 * 60 * 1000L; // ms
	/** Minimum number of servers that must respond before we trust an offset. */
	private static final int MIN_RESPONSES = 3;

	private static boolean isStarted = false;
	private static volatile boolean isStopping = false;
	private static ExecutorService instanceExecutor;
	private static NTP instance;

	private static volatile boolean isOffsetSet = false;
	private static volatile long offset = 0;

	private final List<String> serverNames;
	private final NTPUDPClient client;

	private NTP(String[] serverNames) {
		this.serverNames = Arrays.stream(serverNames).collect(Collectors.toList());

		this.client = new NTPUDPClient();
		this.client.setDefaultTimeout(NTP_TIMEOUT);
	}

	public static synchronized void start(String[] serverNames) {
		if (isStarted)
			return;

		isStarted = true;
		instanceExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("NTP", true));
		instance = new NTP(serverNames);
		instanceExecutor.execute(instance);
	}

	public static void shutdownNow() {
		if (instanceExecutor != null)
			instanceExecutor.shutdownNow();
	}

	/** Fixes clock offset (ms) instead of querying NTP servers. Used by tests and offline setups. */
	public static synchronized void setFixedOffset(Long fixedOffset) {
		// Fixed offset disables NTP server queries
		isStarted = true;

		offset = fixedOffset;
		isOffsetSet = true;
	}

	/**
	 * Returns our estimate of internet time.
	 *
	 * @return internet time (ms), or null if unsynchronized.
	 */
	public static Long getTime() {
		if (!isOffsetSet)
			return null;

		return System.currentTimeMillis() + offset;
	}

	@Override
	public void run() {
		try {
			while (!isStopping) {
				Thread.sleep(isOffsetSet ? POST_SYNC_INTERVAL : PRE_SYNC_INTERVAL);

				List<Long> offsets = new ArrayList<>();

				for (String serverName : this.serverNames) {
					Long serverOffset = this.queryOffset(serverName);
					if (serverOffset != null)
						offsets.add(serverOffset);
				}

				if (offsets.size() < MIN_RESPONSES) {
					LOGGER.debug(() -> String.format("Not enough NTP responses (%d) to adjust offset", offsets.size()));
					continue;
				}

				// Median is less affected by a single misbehaving server than mean
				Collections.sort(offsets);
				long newOffset = offsets.get(offsets.size() / 2);

				LOGGER.debug(() -> String.format("New NTP offset: %d ms from %d servers", newOffset, offsets.size()));

				offset = newOffset;
				isOffsetSet = true;
			}
		} catch (InterruptedException e) {
			// Interrupted - time to exit
			isStopping = true;
		} finally {
			this.client.close();
		}
	}

	private Long queryOffset(String serverName) {
		try {
			InetAddress serverAddress = InetAddress.getByName(serverName);

			TimeInfo timeInfo = this.client.getTime(serverAddress);
			timeInfo.computeDetails();

			Long serverOffset = timeInfo.getOffset();
			if (serverOffset == null)
				return null;

			LOGGER.trace(() -> String.format("NTP server %s offset: %d ms", serverName, serverOffset));
			return serverOffset;
		} catch (UnknownHostException e) {
			LOGGER.trace(() -> String.format("Unknown NTP server %s", serverName));
			return null;
		} catch (IOException e) {
			LOGGER.trace(() -> String.format("No response from NTP server %s: %s", serverName, e.getMessage()));
			return null;
		}
	}

	// For tests

	public static void awaitShutdown(long timeout) throws InterruptedException {
		if (instanceExecutor != null)
			instanceExecutor.awaitTermination(timeout, TimeUnit.MILLISECONDS);
	}

}
