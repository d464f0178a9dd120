package org.atomicswap.test.repository;

import static org.junit.Assert.*;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.atomicswap.crosschain.HashTimeLock;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.Repository;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.repository.SwapRepository;
import org.atomicswap.test.common.Common;
import org.atomicswap.utils.Amounts;
import org.junit.Before;
import org.junit.Test;

public class SwapRepositoryTests extends Common {

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
	}

	private static SwapOfferData newSwapOffer(long createdAt) {
		byte[] secret = HashTimeLock.generateSecret();

		return new SwapOfferData(UUID.randomUUID().toString(),
				SupportedAsset.BTC, Amounts.normalize(new BigDecimal("0.12345678")),
				SupportedAsset.DEPIX, Amounts.normalize(new BigDecimal("1234.5")),
				"bcrt1qinitiator", HashTimeLock.hashlock(secret), secret,
				createdAt + 7_200_000L, createdAt + 3_600_000L, createdAt);
	}

	@Test
	public void testCreateAndFetch() throws DataException {
		SwapOfferData swap = newSwapOffer(HashTimeLock.now());

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSwapRepository().create(swap);
			repository.saveChanges();
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapOfferData fetched = repository.getSwapRepository().fromSwapId(swap.getSwapId());
			assertNotNull(fetched);

			assertEquals(SwapStatus.OFFERED, fetched.getStatus());
			assertEquals(SupportedAsset.BTC, fetched.getInitiatorAsset());
			assertEquals(SupportedAsset.DEPIX, fetched.getAcceptorAsset());
			assertEqualBigDecimals("initiator amount", new BigDecimal("0.12345678"), fetched.getInitiatorAmount());
			assertEqualBigDecimals("acceptor amount", new BigDecimal("1234.5"), fetched.getAcceptorAmount());
			assertEquals(swap.getHashlock(), fetched.getHashlock());
			assertArrayEquals(swap.getSecret(), fetched.getSecret());
			assertEquals(swap.getInitiatorTimelock(), fetched.getInitiatorTimelock());
			assertEquals(swap.getAcceptorTimelock(), fetched.getAcceptorTimelock());
			assertEquals(swap.getCreatedAt(), fetched.getCreatedAt());
			assertNull(fetched.getAcceptorAddress());
			assertNull(fetched.getAcceptedAt());
			assertNull(fetched.getInitiatorTxid());
			assertNull(fetched.getLastFailure());
			assertEquals(0, fetched.getVersion());

			assertNull(repository.getSwapRepository().fromSwapId(UUID.randomUUID().toString()));
		}
	}

	@Test
	public void testDiscardedCreate() throws DataException {
		SwapOfferData swap = newSwapOffer(HashTimeLock.now());

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSwapRepository().create(swap);
			repository.discardChanges();
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			assertNull(repository.getSwapRepository().fromSwapId(swap.getSwapId()));
		}
	}

	@Test
	public void testDuplicateCreate() throws DataException {
		SwapOfferData swap = newSwapOffer(HashTimeLock.now());

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSwapRepository().create(swap);
			repository.saveChanges();

			try {
				repository.getSwapRepository().create(swap);
				fail("Duplicate swap ID should be refused");
			} catch (DataException e) {
				repository.discardChanges();
			}
		}
	}

	@Test
	public void testUpdateCompareAndSet() throws DataException {
		SwapOfferData swap = newSwapOffer(HashTimeLock.now());

		try (final Repository repository = RepositoryManager.getRepository()) {
			repository.getSwapRepository().create(swap);
			repository.saveChanges();
		}

		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapRepository swapRepository = repository.getSwapRepository();

			// Two readers of the same swap
			SwapOfferData first = swapRepository.fromSwapId(swap.getSwapId());
			SwapOfferData second = swapRepository.fromSwapId(swap.getSwapId());

			first.setStatus(SwapStatus.ACCEPTED);
			first.setAcceptorAddress("ert1qfirst");
			first.setAcceptedAt(HashTimeLock.now());
			assertTrue(swapRepository.update(first, SwapStatus.OFFERED, 0));
			assertEquals(1, first.getVersion());
			repository.saveChanges();

			// Second reader's view is stale
			second.setStatus(SwapStatus.ACCEPTED);
			second.setAcceptorAddress("ert1qsecond");
			assertFalse(swapRepository.update(second, SwapStatus.OFFERED, 0));
			assertEquals(0, second.getVersion());
			repository.discardChanges();

			SwapOfferData stored = swapRepository.fromSwapId(swap.getSwapId());
			assertEquals(SwapStatus.ACCEPTED, stored.getStatus());
			assertEquals("ert1qfirst", stored.getAcceptorAddress());
			assertEquals(1, stored.getVersion());

			// Same status but newer version is still a conflict, e.g. a recorded failure
			stored.setLastFailure("Acceptor lock failed", HashTimeLock.now());
			assertTrue(swapRepository.update(stored, SwapStatus.ACCEPTED, 1));
			repository.saveChanges();

			first.setStatus(SwapStatus.INITIATOR_LOCKED);
			assertFalse(swapRepository.update(first, SwapStatus.ACCEPTED, 1));
			repository.discardChanges();

			assertEquals("Acceptor lock failed", swapRepository.fromSwapId(swap.getSwapId()).getLastFailure());
		}
	}

	@Test
	public void testUpdateMissingSwap() throws DataException {
		SwapOfferData swap = newSwapOffer(HashTimeLock.now());

		try (final Repository repository = RepositoryManager.getRepository()) {
			assertFalse(repository.getSwapRepository().update(swap, SwapStatus.OFFERED, 0));
		}
	}

	@Test
	public void testStatusFiltersAndOrdering() throws DataException {
		long now = HashTimeLock.now();

		SwapOfferData oldest = newSwapOffer(now - 3000L);
		SwapOfferData middle = newSwapOffer(now - 2000L);
		SwapOfferData newest = newSwapOffer(now - 1000L);

		try (final Repository repository = RepositoryManager.getRepository()) {
			SwapRepository swapRepository = repository.getSwapRepository();

			for (SwapOfferData swap : Arrays.asList(middle, oldest, newest))
				swapRepository.create(swap);

			middle.setStatus(SwapStatus.CANCELLED);
			assertTrue(swapRepository.update(middle, SwapStatus.OFFERED, 0));

			repository.saveChanges();

			List<SwapOfferData> all = swapRepository.getSwapOffers(null);
			assertEquals(3, all.size());
			assertEquals(newest.getSwapId(), all.get(0).getSwapId());
			assertEquals(middle.getSwapId(), all.get(1).getSwapId());
			assertEquals(oldest.getSwapId(), all.get(2).getSwapId());

			List<SwapOfferData> offered = swapRepository.getSwapOffers(SwapStatus.OFFERED);
			assertEquals(2, offered.size());
			assertEquals(newest.getSwapId(), offered.get(0).getSwapId());
			assertEquals(oldest.getSwapId(), offered.get(1).getSwapId());

			assertTrue(swapRepository.getSwapOffers(SwapStatus.COMPLETED).isEmpty());

			List<SwapOfferData> offeredOrCancelled = swapRepository.getSwapOffersByStatuses(Arrays.asList(SwapStatus.OFFERED, SwapStatus.CANCELLED));
			assertEquals(3, offeredOrCancelled.size());

			assertTrue(swapRepository.getSwapOffersByStatuses(Collections.emptyList()).isEmpty());
		}
	}

}
