package org.atomicswap.crosschain;

import java.math.BigDecimal;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.SettlementBackendException.RejectedException;
import org.atomicswap.crosschain.SettlementBackendException.UnavailableException;
import org.atomicswap.utils.NamedThreadFactory;

/**
 * Runs settlement backend calls with a deadline, retrying transient failures of repeat-safe calls.
 * <p>
 * {@link #lock(SettlementBackend, BigDecimal, String, long, String)} is never retried,
 * as a timed-out lock may still have been broadcast.
 */
public class SettlementCalls implements AutoCloseable {

	private static final Logger LOGGER = LogManager.getLogger(SettlementCalls.class);

	@FunctionalInterface
	public interface BackendCall<T> {
		T call() throws SettlementBackendException;
	}

	private final long timeout;
	private final int maxRetries;
	private final long retryBackoff;
	private final ExecutorService executor;

	/**
	 * @param timeout per-attempt deadline (ms)
	 * @param maxRetries extra attempts after an {@link UnavailableException}, repeat-safe calls only
	 * @param retryBackoff delay (ms) before first retry, doubled on each subsequent retry
	 */
	public SettlementCalls(long timeout, int maxRetries, long retryBackoff) {
		this.timeout = timeout;
		this.maxRetries = maxRetries;
		this.retryBackoff = retryBackoff;
		this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("Settlement", true));
	}

	public String lock(SettlementBackend backend, BigDecimal amount, String hashlock, long timelock, String recipient) throws SettlementBackendException {
		String description = String.format("%s lock", backend.getAsset());
		return this.call(description, () -> backend.lock(amount, hashlock, timelock, recipient), false);
	}

	public String redeem(SettlementBackend backend, String lockReference, byte[] secret) throws SettlementBackendException {
		String description = String.format("%s redeem of %s", backend.getAsset(), lockReference);
		return this.call(description, () -> backend.redeem(lockReference, secret), true);
	}

	public String refund(SettlementBackend backend, String lockReference) throws SettlementBackendException {
		String description = String.format("%s refund of %s", backend.getAsset(), lockReference);
		return this.call(description, () -> backend.refund(lockReference), true);
	}

	public BigDecimal getBalance(SettlementBackend backend) throws SettlementBackendException {
		String description = String.format("%s balance", backend.getAsset());
		return this.call(description, backend::getBalance, true);
	}

	public <T> T call(String description, BackendCall<T> call, boolean repeatable) throws SettlementBackendException {
		int attempt = 0;
		long backoff = this.retryBackoff;

		while (true) {
			try {
				return this.callOnce(description, call);
			} catch (UnavailableException e) {
				if (!repeatable || attempt >= this.maxRetries)
					throw e;

				++attempt;
				final int retry = attempt;
				final long delay = backoff;
				LOGGER.debug(() -> String.format("%s unavailable (%s), retry %d in %d ms", description, e.getMessage(), retry, delay));

				try {
					Thread.sleep(delay);
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					throw new UnavailableException(String.format("Interrupted while retrying %s", description), ie);
				}

				backoff *= 2;
			}
		}
	}

	private <T> T callOnce(String description, BackendCall<T> call) throws SettlementBackendException {
		Future<T> future = this.executor.submit(call::call);

		try {
			return future.get(this.timeout, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			throw new UnavailableException(String.format("%s timed out after %d ms", description, this.timeout));
		} catch (InterruptedException e) {
			future.cancel(true);
			Thread.currentThread().interrupt();
			throw new UnavailableException(String.format("Interrupted during %s", description), e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();

			if (cause instanceof SettlementBackendException)
				throw (SettlementBackendException) cause;

			// Unexpected runtime failure inside backend
			LOGGER.warn(String.format("%s failed unexpectedly", description), cause);
			throw new RejectedException(String.format("%s failed: %s", description, cause));
		}
	}

	@Override
	public void close() {
		this.executor.shutdownNow();
	}

}
