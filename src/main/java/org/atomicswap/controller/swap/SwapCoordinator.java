package org.atomicswap.controller.swap;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.controller.swap.SwapException.InvalidStateException;
import org.atomicswap.controller.swap.SwapException.NotFoundException;
import org.atomicswap.controller.swap.SwapException.TimelockNotExpiredException;
import org.atomicswap.controller.swap.SwapException.ValidationException;
import org.atomicswap.crosschain.HashTimeLock;
import org.atomicswap.crosschain.SettlementBackend;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.crosschain.SettlementCalls;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.Repository;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.utils.Amounts;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

/**
 * Drives swaps through their lifecycle, one backend action per step.
 * <p>
 * Each step loads the swap, checks the step is legal from its current status,
 * performs at most one settlement backend call and only then persists the new status.
 * Steps on the same swap are serialized within this process by a per-swap lock,
 * and across processes by the repository's status/version compare-and-set.
 * <p>
 * Before any backend call, the step is claimed by storing a pending action through that
 * compare-and-set, so only one coordinator sharing the repository ever submits it. A pending action
 * older than the pending action timeout is treated as abandoned, except that a lock is never
 * resubmitted as its earlier submission may have reached the ledger.
 * <p>
 * Timelock asymmetry: the initiator locks first and reveals the secret when claiming,
 * so the acceptor's leg must expire first, leaving the acceptor time to claim
 * the initiator's leg with the revealed secret before the initiator could refund it.
 */
public class SwapCoordinator {

	private static final Logger LOGGER = LogManager.getLogger(SwapCoordinator.class);

	private static final Pattern SWAP_ID_PATTERN = Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

	private static final int MAX_ADDRESS_LENGTH = 256;
	private static final int MAX_FAILURE_LENGTH = 1000;

	public static final long DEFAULT_PENDING_ACTION_TIMEOUT = 10 * 60 * 1000L; // ms

	public static final List<SwapStatus> ACTIVE_STATUSES = Collections.unmodifiableList(Arrays.stream(SwapStatus.values())
			.filter(status -> status.isActive)
			.collect(Collectors.toList()));

	private final Map<SupportedAsset, SettlementBackend> backends;
	private final SettlementCalls settlementCalls;
	private final long initiatorTimelockPeriod;
	private final long acceptorTimelockPeriod;
	private final long pendingActionTimeout;

	/** Per-swap locks, discarded once no thread holds or waits on them. */
	private final LoadingCache<String, ReentrantLock> swapLocks = CacheBuilder.newBuilder()
			.weakValues()
			.build(CacheLoader.from(() -> new ReentrantLock()));

	public SwapCoordinator(Map<SupportedAsset, SettlementBackend> backends, SettlementCalls settlementCalls,
			long initiatorTimelockPeriod, long acceptorTimelockPeriod) {
		this(backends, settlementCalls, initiatorTimelockPeriod, acceptorTimelockPeriod, DEFAULT_PENDING_ACTION_TIMEOUT);
	}

	/**
	 * @param pendingActionTimeout age (ms) after which another coordinator's unfinished step is treated as abandoned
	 */
	public SwapCoordinator(Map<SupportedAsset, SettlementBackend> backends, SettlementCalls settlementCalls,
			long initiatorTimelockPeriod, long acceptorTimelockPeriod, long pendingActionTimeout) {
		if (acceptorTimelockPeriod <= 0 || acceptorTimelockPeriod >= initiatorTimelockPeriod)
			throw new IllegalArgumentException("Acceptor timelock period must be positive and shorter than initiator's");

		if (pendingActionTimeout <= 0)
			throw new IllegalArgumentException("Pending action timeout must be positive");

		Map<SupportedAsset, SettlementBackend> backendsByAsset = new EnumMap<>(SupportedAsset.class);
		backendsByAsset.putAll(backends);
		this.backends = Collections.unmodifiableMap(backendsByAsset);
		this.settlementCalls = settlementCalls;
		this.initiatorTimelockPeriod = initiatorTimelockPeriod;
		this.acceptorTimelockPeriod = acceptorTimelockPeriod;
		this.pendingActionTimeout = pendingActionTimeout;
	}

	// Offer lifecycle

	public SwapOfferData createOffer(SupportedAsset initiatorAsset, BigDecimal initiatorAmount,
			SupportedAsset acceptorAsset, BigDecimal acceptorAmount, String initiatorAddress) throws SwapException, DataException {
		if (initiatorAsset == null || acceptorAsset == null)
			throw new ValidationException("Both assets are required");

		if (initiatorAsset == acceptorAsset)
			throw new ValidationException("Initiator and acceptor assets must differ");

		for (SupportedAsset asset : new SupportedAsset[] { initiatorAsset, acceptorAsset })
			if (!this.backends.containsKey(asset))
				throw new ValidationException(String.format("No settlement backend configured for %s", asset));

		if (!Amounts.isValid(initiatorAmount))
			throw new ValidationException("Initiator amount must be positive with at most 8 decimal places");

		if (!Amounts.isValid(acceptorAmount))
			throw new ValidationException("Acceptor amount must be positive with at most 8 decimal places");

		String address = validateAddress(initiatorAddress, "Initiator");

		byte[] secret = HashTimeLock.generateSecret();
		String hashlock = HashTimeLock.hashlock(secret);

		// Both timelocks derive from the same instant, so acceptor's is always strictly earlier
		long now = HashTimeLock.now();
		long initiatorTimelock = now + this.initiatorTimelockPeriod;
		long acceptorTimelock = now + this.acceptorTimelockPeriod;

		SwapOfferData swapOfferData = new SwapOfferData(UUID.randomUUID().toString(),
				initiatorAsset, Amounts.normalize(initiatorAmount),
				acceptorAsset, Amounts.normalize(acceptorAmount),
				address, hashlock, secret, initiatorTimelock, acceptorTimelock, now);

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSwapRepository().create(swapOfferData);
			repository.saveChanges();
		}

		LOGGER.info(() -> String.format("Created swap %s: %s %s for %s %s", swapOfferData.getSwapId(),
				Amounts.prettyAmount(swapOfferData.getInitiatorAmount()), initiatorAsset,
				Amounts.prettyAmount(swapOfferData.getAcceptorAmount()), acceptorAsset));

		return swapOfferData;
	}

	public SwapOfferData acceptOffer(String swapId, String acceptorAddress) throws SwapException, DataException {
		String address = validateAddress(acceptorAddress, "Acceptor");

		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.ACCEPT);
			checkNotExpired(swapOfferData);

			swapOfferData.setAcceptorAddress(address);
			swapOfferData.setAcceptedAt(HashTimeLock.now());

			updateSwapStatus(repository, swapOfferData, SwapTransition.ACCEPT,
					() -> String.format("Swap %s accepted by %s", swapId, address));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	public SwapOfferData cancelOffer(String swapId) throws SwapException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.CANCEL);

			updateSwapStatus(repository, swapOfferData, SwapTransition.CANCEL,
					() -> String.format("Swap %s cancelled", swapId));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	// Locking

	public SwapOfferData lockInitiator(String swapId) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.LOCK_INITIATOR);
			// No point locking if acceptor can no longer lock in time
			checkNotExpired(swapOfferData);

			SettlementBackend backend = this.getBackend(swapOfferData.getInitiatorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.LOCK_INITIATOR);

			String txid;
			try {
				txid = this.settlementCalls.lock(backend, swapOfferData.getInitiatorAmount(), swapOfferData.getHashlock(),
						swapOfferData.getInitiatorTimelock(), swapOfferData.getAcceptorAddress());
			} catch (SettlementBackendException e) {
				releaseStep(repository, swapOfferData, null, e);
				throw e;
			}

			swapOfferData.setInitiatorTxid(txid);

			updateLockedSwapStatus(repository, swapOfferData, SwapTransition.LOCK_INITIATOR, txid);

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	public SwapOfferData lockAcceptor(String swapId) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.LOCK_ACCEPTOR);
			checkNotExpired(swapOfferData);

			SettlementBackend backend = this.getBackend(swapOfferData.getAcceptorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.LOCK_ACCEPTOR);

			String txid;
			try {
				txid = this.settlementCalls.lock(backend, swapOfferData.getAcceptorAmount(), swapOfferData.getHashlock(),
						swapOfferData.getAcceptorTimelock(), swapOfferData.getInitiatorAddress());
			} catch (SettlementBackendException e) {
				// Initiator's funds are locked but acceptor's aren't - leave a trail for recovery
				releaseStep(repository, swapOfferData, String.format("Acceptor lock failed: %s", e.getMessage()), e);
				throw e;
			}

			swapOfferData.setAcceptorTxid(txid);

			updateLockedSwapStatus(repository, swapOfferData, SwapTransition.LOCK_ACCEPTOR, txid);

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	// Claiming

	/**
	 * Initiator claims acceptor's locked funds, revealing the secret.
	 * <p>
	 * Returned swap's {@link SwapOfferData#getSecret()} is the only place the secret should be exposed to callers.
	 */
	public SwapOfferData claimInitiator(String swapId) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.CLAIM_INITIATOR);

			SettlementBackend backend = this.getBackend(swapOfferData.getAcceptorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.CLAIM_INITIATOR);

			try {
				this.settlementCalls.redeem(backend, swapOfferData.getAcceptorTxid(), swapOfferData.getSecret());
			} catch (SettlementBackendException e) {
				releaseStep(repository, swapOfferData, null, e);
				throw e;
			}

			swapOfferData.setInitiatorClaimedAt(HashTimeLock.now());

			updateSwapStatus(repository, swapOfferData, SwapTransition.CLAIM_INITIATOR,
					() -> String.format("Swap %s: initiator claimed %s %s", swapId,
							Amounts.prettyAmount(swapOfferData.getAcceptorAmount()), swapOfferData.getAcceptorAsset()));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	/**
	 * Acceptor claims initiator's locked funds, completing the swap.
	 *
	 * @param secret secret the acceptor learned from the initiator's claim, or null to use the stored secret
	 */
	public SwapOfferData claimAcceptor(String swapId, byte[] secret) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.CLAIM_ACCEPTOR);

			if (secret != null && !HashTimeLock.verify(secret, swapOfferData.getHashlock()))
				throw new ValidationException("Secret does not match swap's hashlock");

			byte[] redeemSecret = secret != null ? secret : swapOfferData.getSecret();

			SettlementBackend backend = this.getBackend(swapOfferData.getInitiatorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.CLAIM_ACCEPTOR);

			try {
				this.settlementCalls.redeem(backend, swapOfferData.getInitiatorTxid(), redeemSecret);
			} catch (SettlementBackendException e) {
				releaseStep(repository, swapOfferData, null, e);
				throw e;
			}

			swapOfferData.setCompletedAt(HashTimeLock.now());

			updateSwapStatus(repository, swapOfferData, SwapTransition.CLAIM_ACCEPTOR,
					() -> String.format("Swap %s completed: acceptor claimed %s %s", swapId,
							Amounts.prettyAmount(swapOfferData.getInitiatorAmount()), swapOfferData.getInitiatorAsset()));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	// Refunds

	public SwapOfferData refundInitiator(String swapId) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.REFUND_INITIATOR);

			if (!swapOfferData.hasOutstandingInitiatorLock())
				throw new InvalidStateException(String.format("Swap %s has no outstanding initiator lock to refund", swapId));

			checkTimelockExpired(swapOfferData.getInitiatorTimelock(), "Initiator");

			SettlementBackend backend = this.getBackend(swapOfferData.getInitiatorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.REFUND_INITIATOR);

			try {
				this.settlementCalls.refund(backend, swapOfferData.getInitiatorTxid());
			} catch (SettlementBackendException e) {
				releaseStep(repository, swapOfferData, null, e);
				throw e;
			}

			swapOfferData.setInitiatorRefundedAt(HashTimeLock.now());

			updateSwapStatus(repository, swapOfferData, SwapTransition.REFUND_INITIATOR,
					() -> String.format("Swap %s: refunded initiator's %s %s", swapId,
							Amounts.prettyAmount(swapOfferData.getInitiatorAmount()), swapOfferData.getInitiatorAsset()));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	public SwapOfferData refundAcceptor(String swapId) throws SwapException, SettlementBackendException, DataException {
		ReentrantLock swapLock = this.acquireSwapLock(swapId);
		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData swapOfferData = fetchSwap(repository, swapId);
			checkTransition(swapOfferData, SwapTransition.REFUND_ACCEPTOR);

			if (!swapOfferData.hasOutstandingAcceptorLock())
				throw new InvalidStateException(String.format("Swap %s has no outstanding acceptor lock to refund", swapId));

			checkTimelockExpired(swapOfferData.getAcceptorTimelock(), "Acceptor");

			SettlementBackend backend = this.getBackend(swapOfferData.getAcceptorAsset());
			this.claimStep(repository, swapOfferData, SwapTransition.REFUND_ACCEPTOR);

			try {
				this.settlementCalls.refund(backend, swapOfferData.getAcceptorTxid());
			} catch (SettlementBackendException e) {
				releaseStep(repository, swapOfferData, null, e);
				throw e;
			}

			swapOfferData.setAcceptorRefundedAt(HashTimeLock.now());

			updateSwapStatus(repository, swapOfferData, SwapTransition.REFUND_ACCEPTOR,
					() -> String.format("Swap %s: refunded acceptor's %s %s", swapId,
							Amounts.prettyAmount(swapOfferData.getAcceptorAmount()), swapOfferData.getAcceptorAsset()));

			return swapOfferData;
		} finally {
			swapLock.unlock();
		}
	}

	// Queries

	public SwapOfferData getOffer(String swapId) throws SwapException, DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return fetchSwap(repository, swapId);
		}
	}

	/** Returns swaps, newest first, optionally only those with passed status. */
	public List<SwapOfferData> listOffers(SwapStatus status) throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getSwapRepository().getSwapOffers(status);
		}
	}

	/** Returns offers still waiting for an acceptor. */
	public List<SwapOfferData> listOpenOffers() throws DataException {
		return this.listOffers(SwapStatus.OFFERED);
	}

	/** Returns swaps that were accepted but are not yet settled either way. */
	public List<SwapOfferData> listActiveOffers() throws DataException {
		try (final Repository repository = RepositoryManager.getRepository()) {
			return repository.getSwapRepository().getSwapOffersByStatuses(ACTIVE_STATUSES);
		}
	}

	/** Returns wallet balance of each configured settlement backend. */
	public Map<SupportedAsset, BigDecimal> getBalances() throws SettlementBackendException {
		Map<SupportedAsset, BigDecimal> balances = new EnumMap<>(SupportedAsset.class);

		for (Map.Entry<SupportedAsset, SettlementBackend> entry : this.backends.entrySet())
			balances.put(entry.getKey(), this.settlementCalls.getBalance(entry.getValue()));

		return balances;
	}

	public long getInitiatorTimelockPeriod() {
		return this.initiatorTimelockPeriod;
	}

	public long getAcceptorTimelockPeriod() {
		return this.acceptorTimelockPeriod;
	}

	public long getPendingActionTimeout() {
		return this.pendingActionTimeout;
	}

	// Utility methods

	private ReentrantLock acquireSwapLock(String swapId) throws NotFoundException {
		ReentrantLock swapLock = this.swapLocks.getUnchecked(normalizeSwapId(swapId));
		swapLock.lock();
		return swapLock;
	}

	private SettlementBackend getBackend(SupportedAsset asset) throws InvalidStateException {
		SettlementBackend backend = this.backends.get(asset);
		if (backend == null)
			throw new InvalidStateException(String.format("No settlement backend configured for %s", asset));

		return backend;
	}

	private static String normalizeSwapId(String swapId) throws NotFoundException {
		if (swapId == null || !SWAP_ID_PATTERN.matcher(swapId).matches())
			throw new NotFoundException(String.format("Swap %s not found", swapId));

		return swapId.toLowerCase();
	}

	private static SwapOfferData fetchSwap(Repository repository, String swapId) throws NotFoundException, DataException {
		SwapOfferData swapOfferData = repository.getSwapRepository().fromSwapId(normalizeSwapId(swapId));
		if (swapOfferData == null)
			throw new NotFoundException(String.format("Swap %s not found", swapId));

		return swapOfferData;
	}

	private static String validateAddress(String address, String party) throws ValidationException {
		if (address == null || address.trim().isEmpty())
			throw new ValidationException(String.format("%s address is required", party));

		String trimmedAddress = address.trim();
		if (trimmedAddress.length() > MAX_ADDRESS_LENGTH)
			throw new ValidationException(String.format("%s address is too long", party));

		return trimmedAddress;
	}

	private static void checkTransition(SwapOfferData swapOfferData, SwapTransition transition) throws InvalidStateException {
		if (!transition.isAllowedFrom(swapOfferData.getStatus()))
			throw new InvalidStateException(String.format("Swap %s is %s, cannot %s",
					swapOfferData.getSwapId(), swapOfferData.getStatus(), transition.name().toLowerCase().replace('_', ' ')));
	}

	/** Refuses to move an unlocked swap forward once acceptor's timelock has passed. */
	private static void checkNotExpired(SwapOfferData swapOfferData) throws InvalidStateException {
		if (HashTimeLock.isExpired(swapOfferData.getAcceptorTimelock()))
			throw new InvalidStateException(String.format("Swap %s has expired", swapOfferData.getSwapId()));
	}

	private static void checkTimelockExpired(long timelock, String party) throws TimelockNotExpiredException {
		if (!HashTimeLock.isExpired(timelock))
			throw new TimelockNotExpiredException(String.format("%s timelock has not yet expired", party), timelock);
	}

	/**
	 * Stores <tt>transition</tt> as swap's pending action, provided nobody else changed the swap since it was loaded.
	 * <p>
	 * Only the coordinator whose pending action was stored may go on to call the settlement backend.
	 */
	private void claimStep(Repository repository, SwapOfferData swapOfferData, SwapTransition transition) throws InvalidStateException, DataException {
		String swapId = swapOfferData.getSwapId();
		String action = transition.name().toLowerCase();
		long now = HashTimeLock.now();

		String pendingAction = swapOfferData.getPendingAction();
		if (pendingAction != null) {
			Long pendingSince = swapOfferData.getPendingSince();
			if (pendingSince == null || now - pendingSince < this.pendingActionTimeout)
				throw new InvalidStateException(String.format("Swap %s already has %s in progress", swapId, pendingAction));

			// Abandoned lock may have reached the ledger
			if (pendingAction.equals(action) && (transition == SwapTransition.LOCK_INITIATOR || transition == SwapTransition.LOCK_ACCEPTOR))
				throw new InvalidStateException(String.format("Swap %s: abandoned %s needs manual recovery", swapId, pendingAction));

			LOGGER.warn(() -> String.format("Swap %s: taking over abandoned %s from %d", swapId, pendingAction, pendingSince));
		}

		SwapStatus status = swapOfferData.getStatus();
		int version = swapOfferData.getVersion();

		swapOfferData.setPendingAction(action, now);
		swapOfferData.setUpdatedAt(now);

		if (!repository.getSwapRepository().update(swapOfferData, status, version)) {
			repository.discardChanges();
			throw new InvalidStateException(String.format("Swap %s was changed concurrently", swapId));
		}

		repository.saveChanges();
	}

	/** Persists swap's new status, clearing any pending action, provided nobody else changed it since it was loaded. */
	private static void updateSwapStatus(Repository repository, SwapOfferData swapOfferData, SwapTransition transition,
			Supplier<String> logMessageSupplier) throws InvalidStateException, DataException {
		SwapStatus previousStatus = swapOfferData.getStatus();
		int previousVersion = swapOfferData.getVersion();

		swapOfferData.setStatus(transition.target);
		swapOfferData.setPendingAction(null, null);
		swapOfferData.setUpdatedAt(HashTimeLock.now());

		if (!repository.getSwapRepository().update(swapOfferData, previousStatus, previousVersion)) {
			repository.discardChanges();
			throw new InvalidStateException(String.format("Swap %s was changed concurrently", swapOfferData.getSwapId()));
		}

		repository.saveChanges();

		LOGGER.info(logMessageSupplier);
		LOGGER.debug(() -> String.format("Swap %s: %s -> %s", swapOfferData.getSwapId(), previousStatus, transition.target));
	}

	private static void updateLockedSwapStatus(Repository repository, SwapOfferData swapOfferData, SwapTransition transition,
			String txid) throws InvalidStateException, DataException {
		try {
			updateSwapStatus(repository, swapOfferData, transition,
					() -> String.format("Swap %s: %s with transaction %s", swapOfferData.getSwapId(), transition.target, txid));
		} catch (InvalidStateException | DataException e) {
			// Funds are locked on-ledger but we failed to record it. Stored pending action blocks a second lock.
			LOGGER.error(String.format("Swap %s: lock transaction %s submitted but not recorded: %s",
					swapOfferData.getSwapId(), txid, e.getMessage()));
			throw e;
		}
	}

	/** Clears swap's pending action after a failed backend call, optionally recording the failure. Status is unchanged. */
	private static void releaseStep(Repository repository, SwapOfferData swapOfferData, String failure, Exception cause) {
		long now = HashTimeLock.now();

		if (failure != null) {
			String trimmedFailure = failure.length() > MAX_FAILURE_LENGTH ? failure.substring(0, MAX_FAILURE_LENGTH) : failure;
			LOGGER.warn(() -> String.format("Swap %s: %s", swapOfferData.getSwapId(), trimmedFailure));
			swapOfferData.setLastFailure(trimmedFailure, now);
		}

		SwapStatus status = swapOfferData.getStatus();
		int version = swapOfferData.getVersion();

		swapOfferData.setPendingAction(null, null);
		swapOfferData.setUpdatedAt(now);

		try {
			if (repository.getSwapRepository().update(swapOfferData, status, version))
				repository.saveChanges();
			else
				repository.discardChanges();
		} catch (DataException e) {
			LOGGER.error(String.format("Swap %s: unable to clear pending action: %s", swapOfferData.getSwapId(), e.getMessage()));
			cause.addSuppressed(e);
		}
	}

}
