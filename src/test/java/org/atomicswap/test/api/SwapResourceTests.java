package org.atomicswap.test.api;

import static org.junit.Assert.*;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBElement;
import javax.xml.bind.JAXBException;
import javax.xml.bind.Marshaller;
import javax.xml.namespace.QName;

import org.atomicswap.api.ApiError;
import org.atomicswap.api.ApiException;
import org.atomicswap.api.model.AcceptSwapOfferRequest;
import org.atomicswap.api.model.AcceptorClaimRequest;
import org.atomicswap.api.model.AssetBalance;
import org.atomicswap.api.model.CreateSwapOfferRequest;
import org.atomicswap.api.model.InitiatorClaimResponse;
import org.atomicswap.api.resource.SwapResource;
import org.atomicswap.crosschain.HashTimeLock;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.crosschain.SettlementCalls;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;
import org.atomicswap.test.common.Common;
import org.atomicswap.test.common.TestSettlementBackend;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.MarshallerProperties;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.hash.HashCode;

public class SwapResourceTests extends Common {

	private TestSettlementBackend btc;
	private TestSettlementBackend depix;
	private SettlementCalls settlementCalls;
	private SwapResource swapResource;

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();

		this.btc = new TestSettlementBackend(SupportedAsset.BTC);
		this.depix = new TestSettlementBackend(SupportedAsset.DEPIX);
		this.settlementCalls = Common.newSettlementCalls();
		this.swapResource = new SwapResource(Common.newSwapCoordinator(this.settlementCalls, this.btc, this.depix));
	}

	@After
	public void afterTest() {
		this.settlementCalls.close();
	}

	private static CreateSwapOfferRequest createRequest(String initiatorAsset, String initiatorAmount, String acceptorAsset, String acceptorAmount) {
		CreateSwapOfferRequest request = new CreateSwapOfferRequest();
		request.initiatorAsset = initiatorAsset;
		request.initiatorAmount = initiatorAmount != null ? new BigDecimal(initiatorAmount) : null;
		request.acceptorAsset = acceptorAsset;
		request.acceptorAmount = acceptorAmount != null ? new BigDecimal(acceptorAmount) : null;
		request.initiatorAddress = "bcrt1qinitiator";
		return request;
	}

	private static AcceptSwapOfferRequest acceptRequest(String acceptorAddress) {
		AcceptSwapOfferRequest request = new AcceptSwapOfferRequest();
		request.acceptorAddress = acceptorAddress;
		return request;
	}

	@Test
	public void testSwapLifecycle() {
		SwapOfferData swap = this.swapResource.createOffer(createRequest("btc", "1.0", "DePix", "100"));
		String swapId = swap.getSwapId();
		assertEquals(SwapStatus.OFFERED, swap.getStatus());

		this.swapResource.acceptOffer(swapId, acceptRequest("ert1qacceptor"));
		this.swapResource.lockInitiator(swapId);
		this.swapResource.lockAcceptor(swapId);

		InitiatorClaimResponse claimResponse = this.swapResource.claimInitiator(swapId);
		assertEquals(SwapStatus.INITIATOR_CLAIMED, claimResponse.swap.getStatus());
		assertEquals(64, claimResponse.secret.length());
		assertEquals(swap.getHashlock(), HashTimeLock.hashlock(HashCode.fromString(claimResponse.secret).asBytes()));

		AcceptorClaimRequest acceptorClaim = new AcceptorClaimRequest();
		acceptorClaim.secret = claimResponse.secret.toUpperCase();
		swap = this.swapResource.claimAcceptor(swapId, acceptorClaim);
		assertEquals(SwapStatus.COMPLETED, swap.getStatus());

		assertEquals(SwapStatus.COMPLETED, this.swapResource.getOffer(swapId).getStatus());
	}

	@Test
	public void testInvalidCreateRequests() {
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(null));
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(createRequest("DOGE", "1", "BTC", "1")));
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(createRequest("BTC", "1", null, "1")));
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(createRequest("BTC", "1", "BTC", "1")));
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(createRequest("BTC", "0", "DEPIX", "1")));
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.createOffer(createRequest("BTC", "1", "DEPIX", null)));
	}

	@Test
	public void testErrorMapping() {
		String swapId = this.swapResource.createOffer(createRequest("BTC", "1", "DEPIX", "100")).getSwapId();

		assertApiError(ApiError.SWAP_NOT_FOUND, () -> this.swapResource.getOffer("00000000-0000-4000-8000-000000000000"));
		assertApiError(ApiError.SWAP_NOT_FOUND, () -> this.swapResource.getOffer("nonsense"));

		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.acceptOffer(swapId, null));
		assertApiError(ApiError.INVALID_SWAP_STATE, () -> this.swapResource.lockInitiator(swapId));

		this.swapResource.acceptOffer(swapId, acceptRequest("ert1qacceptor"));
		assertApiError(ApiError.INVALID_SWAP_STATE, () -> this.swapResource.acceptOffer(swapId, acceptRequest("ert1qlate")));

		this.btc.failNextCall(new SettlementBackendException.UnavailableException("Connection refused"));
		assertApiError(ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, () -> this.swapResource.lockInitiator(swapId));

		this.btc.failNextCall(new SettlementBackendException.RejectedException(-6, "Insufficient funds"));
		assertApiError(ApiError.SETTLEMENT_BACKEND_REJECTED, () -> this.swapResource.lockInitiator(swapId));

		this.swapResource.lockInitiator(swapId);
		this.swapResource.lockAcceptor(swapId);
		assertApiError(ApiError.TIMELOCK_NOT_EXPIRED, () -> this.swapResource.refundAcceptor(swapId));

		this.swapResource.claimInitiator(swapId);

		AcceptorClaimRequest badHex = new AcceptorClaimRequest();
		badHex.secret = "not hex";
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.claimAcceptor(swapId, badHex));

		AcceptorClaimRequest wrongSecret = new AcceptorClaimRequest();
		wrongSecret.secret = HashCode.fromBytes(HashTimeLock.generateSecret()).toString();
		assertApiError(ApiError.INVALID_SWAP_REQUEST, () -> this.swapResource.claimAcceptor(swapId, wrongSecret));
	}

	@Test
	public void testApiErrorStatuses() {
		assertEquals(400, ApiError.INVALID_SWAP_REQUEST.getStatus());
		assertEquals(404, ApiError.SWAP_NOT_FOUND.getStatus());
		assertEquals(409, ApiError.INVALID_SWAP_STATE.getStatus());
		assertEquals(409, ApiError.TIMELOCK_NOT_EXPIRED.getStatus());
		assertEquals(503, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE.getStatus());
		assertEquals(502, ApiError.SETTLEMENT_BACKEND_REJECTED.getStatus());
		assertEquals(500, ApiError.REPOSITORY_ISSUE.getStatus());
	}

	@Test
	public void testListings() {
		String openId = this.swapResource.createOffer(createRequest("BTC", "1", "DEPIX", "100")).getSwapId();
		String activeId = this.swapResource.createOffer(createRequest("DEPIX", "100", "BTC", "1")).getSwapId();
		this.swapResource.acceptOffer(activeId, acceptRequest("bcrt1qacceptor"));

		List<SwapOfferData> open = this.swapResource.listOpenOffers();
		assertEquals(1, open.size());
		assertEquals(openId, open.get(0).getSwapId());

		List<SwapOfferData> active = this.swapResource.listActiveOffers();
		assertEquals(1, active.size());
		assertEquals(activeId, active.get(0).getSwapId());

		assertEquals(2, this.swapResource.listOffers(null).size());
		assertEquals(2, this.swapResource.listOffers("").size());
		assertEquals(1, this.swapResource.listOffers("accepted").size());

		assertApiError(ApiError.INVALID_CRITERIA, () -> this.swapResource.listOffers("pending"));
	}

	@Test
	public void testBalances() {
		this.depix.setBalance(new BigDecimal("42"));

		List<AssetBalance> balances = this.swapResource.getBalances();
		assertEquals(2, balances.size());
		assertEquals(SupportedAsset.BTC, balances.get(0).asset);
		assertEquals(SupportedAsset.DEPIX, balances.get(1).asset);
		assertEqualBigDecimals("DePix balance", new BigDecimal("42"), balances.get(1).balance);

		this.btc.failNextCall(new SettlementBackendException.RejectedException("Wallet locked"));
		assertApiError(ApiError.SETTLEMENT_BACKEND_REJECTED, () -> this.swapResource.getBalances());
	}

	@Test
	public void testSecretNeverSerialized() throws JAXBException {
		SwapOfferData swap = this.swapResource.createOffer(createRequest("BTC", "1", "DEPIX", "100"));
		String secretHex = HashCode.fromBytes(swap.getSecret()).toString();

		String swapJson = toJson(SwapOfferData.class, swap);
		assertTrue(swapJson.contains(swap.getHashlock()));
		assertTrue(swapJson.contains("\"offered\""));
		assertFalse(swapJson.contains("secret"));
		assertFalse(swapJson.contains("version"));

		String claimJson = toJson(InitiatorClaimResponse.class, new InitiatorClaimResponse(swap));
		assertTrue("Initiator claim should reveal secret", claimJson.contains(secretHex));
	}

	private static <T> String toJson(Class<T> clazz, T object) throws JAXBException {
		JAXBContext jc = JAXBContextFactory.createContext(new Class[] { clazz }, null);

		Marshaller marshaller = jc.createMarshaller();
		marshaller.setProperty(MarshallerProperties.MEDIA_TYPE, "application/json");
		marshaller.setProperty(MarshallerProperties.JSON_INCLUDE_ROOT, false);

		StringWriter writer = new StringWriter();
		marshaller.marshal(new JAXBElement<>(new QName(clazz.getSimpleName()), clazz, object), writer);
		return writer.toString();
	}

	private static void assertApiError(ApiError expectedError, Runnable call) {
		try {
			call.run();
			fail(String.format("Expected API error %s", expectedError));
		} catch (ApiException e) {
			assertEquals(String.format("Unexpected API error: %s", e.message), expectedError.getCode(), e.error);
			assertEquals(expectedError.getStatus(), e.status);
		}
	}

}
