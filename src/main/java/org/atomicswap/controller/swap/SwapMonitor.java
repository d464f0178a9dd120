package org.atomicswap.controller.swap;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.HashTimeLock;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.Repository;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.utils.NTP;

/**
 * Periodically refunds swap legs whose timelock has expired and cancels offers nobody accepted in time.
 * <p>
 * All changes go through {@link SwapCoordinator}, so they race fairly with user requests.
 */
public class SwapMonitor extends Thread {

	private static final Logger LOGGER = LogManager.getLogger(SwapMonitor.class);

	/** Statuses that may still have an expired, outstanding lock or be an expired offer. */
	private static final EnumSet<SwapStatus> MONITORED_STATUSES = EnumSet.copyOf(Arrays.asList(SwapStatus.OFFERED,
			SwapStatus.INITIATOR_LOCKED, SwapStatus.ACCEPTOR_LOCKED, SwapStatus.INITIATOR_CLAIMED, SwapStatus.REFUNDED));

	private final SwapCoordinator swapCoordinator;
	private final long interval;

	private volatile boolean running = true;

	public SwapMonitor(SwapCoordinator swapCoordinator, long interval) {
		super("Swap monitor");
		this.setDaemon(true);

		this.swapCoordinator = swapCoordinator;
		this.interval = interval;
	}

	@Override
	public void run() {
		try {
			while (this.running) {
				Thread.sleep(this.interval);

				if (NTP.getTime() == null)
					continue;

				try {
					this.processExpiredSwaps();
				} catch (DataException e) {
					if (RepositoryManager.isDeadlockRelated(e))
						LOGGER.debug(() -> String.format("Deadlock while scanning for expired swaps: %s", e.getMessage()));
					else
						LOGGER.warn(String.format("Repository issue while scanning for expired swaps: %s", e.getMessage()));
				}
			}
		} catch (InterruptedException e) {
			// Time to exit
		}
	}

	public void shutdown() {
		this.running = false;
		this.interrupt();
	}

	/**
	 * Refunds every expired outstanding leg and cancels every expired offer.
	 *
	 * @return number of swaps changed
	 */
	public int processExpiredSwaps() throws DataException {
		List<SwapOfferData> swaps;
		try (final Repository repository = RepositoryManager.getRepository()) {
			swaps = repository.getSwapRepository().getSwapOffersByStatuses(MONITORED_STATUSES);
		}

		return this.processExpiredSwaps(swaps);
	}

	/**
	 * Acts on expired swaps from an earlier scan.
	 * <p>
	 * Swaps may have moved on since <tt>swaps</tt> was fetched, in which case the coordinator refuses and the swap is skipped.
	 * A failure on one swap does not stop the others being processed.
	 *
	 * @return number of swaps changed
	 */
	public int processExpiredSwaps(List<SwapOfferData> swaps) {
		int changedCount = 0;

		for (SwapOfferData swapOfferData : swaps) {
			if (!this.running)
				break;

			String swapId = swapOfferData.getSwapId();

			try {
				if (swapOfferData.getStatus() == SwapStatus.OFFERED) {
					if (HashTimeLock.isExpired(swapOfferData.getAcceptorTimelock())) {
						this.swapCoordinator.cancelOffer(swapId);
						++changedCount;
					}

					continue;
				}

				// Acceptor's leg expires first
				if (swapOfferData.hasOutstandingAcceptorLock() && HashTimeLock.isExpired(swapOfferData.getAcceptorTimelock())) {
					this.swapCoordinator.refundAcceptor(swapId);
					++changedCount;
				}

				if (swapOfferData.hasOutstandingInitiatorLock() && HashTimeLock.isExpired(swapOfferData.getInitiatorTimelock())) {
					this.swapCoordinator.refundInitiator(swapId);
					++changedCount;
				}
			} catch (SwapException e) {
				// Most likely a claim or refund got there first
				LOGGER.debug(() -> String.format("Skipping expired swap %s: %s", swapId, e.getMessage()));
			} catch (SettlementBackendException e) {
				LOGGER.warn(String.format("Unable to refund expired swap %s: %s", swapId, e.getMessage()));
			} catch (DataException e) {
				if (RepositoryManager.isDeadlockRelated(e))
					LOGGER.debug(() -> String.format("Deadlock while processing expired swap %s: %s", swapId, e.getMessage()));
				else
					LOGGER.warn(String.format("Repository issue while processing expired swap %s: %s", swapId, e.getMessage()));
			}
		}

		return changedCount;
	}

}
