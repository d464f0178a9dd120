package org.atomicswap.test.common;

import java.math.BigDecimal;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.atomicswap.crosschain.SettlementBackend;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.crosschain.SupportedAsset;

/** In-memory settlement backend that records calls and can be told to fail or stall. */
public class TestSettlementBackend implements SettlementBackend {

	public static class LockCall {
		public final BigDecimal amount;
		public final String hashlock;
		public final long timelock;
		public final String recipient;

		LockCall(BigDecimal amount, String hashlock, long timelock, String recipient) {
			this.amount = amount;
			this.hashlock = hashlock;
			this.timelock = timelock;
			this.recipient = recipient;
		}
	}

	private final SupportedAsset asset;

	public final List<LockCall> lockCalls = new CopyOnWriteArrayList<>();
	public final List<byte[]> redeemedSecrets = new CopyOnWriteArrayList<>();
	public final List<String> redeemedReferences = new CopyOnWriteArrayList<>();
	public final List<String> refundedReferences = new CopyOnWriteArrayList<>();
	public final AtomicInteger balanceCalls = new AtomicInteger();

	private final Queue<SettlementBackendException> pendingFailures = new ConcurrentLinkedQueue<>();
	private final AtomicInteger nextReference = new AtomicInteger(1);
	private volatile long callDelay = 0;
	private volatile BigDecimal balance = new BigDecimal("10.00000000");

	public TestSettlementBackend(SupportedAsset asset) {
		this.asset = asset;
	}

	/** Next call, of any kind, throws passed exception. Queued failures are used in order. */
	public void failNextCall(SettlementBackendException e) {
		this.pendingFailures.add(e);
	}

	/** Every call sleeps this long (ms) before doing anything. */
	public void setCallDelay(long callDelay) {
		this.callDelay = callDelay;
	}

	public void setBalance(BigDecimal balance) {
		this.balance = balance;
	}

	@Override
	public SupportedAsset getAsset() {
		return this.asset;
	}

	@Override
	public String lock(BigDecimal amount, String hashlock, long timelock, String recipient) throws SettlementBackendException {
		this.beforeCall();

		this.lockCalls.add(new LockCall(amount, hashlock, timelock, recipient));
		return this.newReference("lock");
	}

	@Override
	public String redeem(String lockReference, byte[] secret) throws SettlementBackendException {
		this.beforeCall();

		this.redeemedReferences.add(lockReference);
		this.redeemedSecrets.add(secret);
		return this.newReference("redeem");
	}

	@Override
	public String refund(String lockReference) throws SettlementBackendException {
		this.beforeCall();

		this.refundedReferences.add(lockReference);
		return this.newReference("refund");
	}

	@Override
	public BigDecimal getBalance() throws SettlementBackendException {
		this.beforeCall();

		this.balanceCalls.incrementAndGet();
		return this.balance;
	}

	private void beforeCall() throws SettlementBackendException {
		if (this.callDelay > 0) {
			try {
				Thread.sleep(this.callDelay);
			} catch (InterruptedException e) {
				throw new SettlementBackendException.UnavailableException("Interrupted", e);
			}
		}

		SettlementBackendException failure = this.pendingFailures.poll();
		if (failure != null)
			throw failure;
	}

	private String newReference(String action) {
		return String.format("%s-%s-%d", this.asset.name().toLowerCase(), action, this.nextReference.getAndIncrement());
	}

}
