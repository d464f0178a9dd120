package org.atomicswap.api.resource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.servlet.http.HttpServletRequest;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.MediaType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.api.ApiError;
import org.atomicswap.api.ApiErrors;
import org.atomicswap.api.ApiException;
import org.atomicswap.api.ApiExceptionFactory;
import org.atomicswap.api.model.AcceptSwapOfferRequest;
import org.atomicswap.api.model.AcceptorClaimRequest;
import org.atomicswap.api.model.AssetBalance;
import org.atomicswap.api.model.CreateSwapOfferRequest;
import org.atomicswap.api.model.InitiatorClaimResponse;
import org.atomicswap.controller.swap.SwapCoordinator;
import org.atomicswap.controller.swap.SwapException;
import org.atomicswap.crosschain.SettlementBackendException;
import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;

import com.google.common.hash.HashCode;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

@Path("/swaps")
@Tag(name = "Atomic swaps")
public class SwapResource {

	private static final Logger LOGGER = LogManager.getLogger(SwapResource.class);

	@Context
	HttpServletRequest request;

	private final SwapCoordinator swapCoordinator;

	public SwapResource(SwapCoordinator swapCoordinator) {
		this.swapCoordinator = swapCoordinator;
	}

	@POST
	@Path("/offers")
	@Operation(
		summary = "Create swap offer",
		description = "Generates swap secret and hashlock, and fixes both timelocks. Initiator's timelock is always later than acceptor's.",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(implementation = CreateSwapOfferRequest.class)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.INVALID_SWAP_REQUEST, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData createOffer(CreateSwapOfferRequest createRequest) {
		if (createRequest == null)
			throw ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_SWAP_REQUEST, "Missing request body");

		SupportedAsset initiatorAsset = this.parseAsset(createRequest.initiatorAsset);
		SupportedAsset acceptorAsset = this.parseAsset(createRequest.acceptorAsset);

		try {
			return this.swapCoordinator.createOffer(initiatorAsset, createRequest.initiatorAmount,
					acceptorAsset, createRequest.acceptorAmount, createRequest.initiatorAddress);
		} catch (SwapException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@GET
	@Path("/offers")
	@Operation(
		summary = "List swap offers, newest first",
		responses = {
			@ApiResponse(
				content = @Content(array = @ArraySchema(schema = @Schema(implementation = SwapOfferData.class)))
			)
		}
	)
	@ApiErrors({ApiError.INVALID_CRITERIA, ApiError.REPOSITORY_ISSUE})
	public List<SwapOfferData> listOffers(@Parameter(description = "only return swaps with this status, e.g. initiator_locked") @QueryParam("status") String statusName) {
		SwapStatus status = null;

		if (statusName != null && !statusName.isEmpty()) {
			status = SwapStatus.fromString(statusName);
			if (status == null)
				throw ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_CRITERIA, String.format("Unknown swap status: %s", statusName));
		}

		try {
			return this.swapCoordinator.listOffers(status);
		} catch (DataException e) {
			throw this.toApiException(e);
		}
	}

	@GET
	@Path("/offers/open")
	@Operation(
		summary = "List offers waiting for an acceptor",
		responses = {
			@ApiResponse(
				content = @Content(array = @ArraySchema(schema = @Schema(implementation = SwapOfferData.class)))
			)
		}
	)
	@ApiErrors({ApiError.REPOSITORY_ISSUE})
	public List<SwapOfferData> listOpenOffers() {
		try {
			return this.swapCoordinator.listOpenOffers();
		} catch (DataException e) {
			throw this.toApiException(e);
		}
	}

	@GET
	@Path("/offers/active")
	@Operation(
		summary = "List accepted swaps that are not yet settled",
		responses = {
			@ApiResponse(
				content = @Content(array = @ArraySchema(schema = @Schema(implementation = SwapOfferData.class)))
			)
		}
	)
	@ApiErrors({ApiError.REPOSITORY_ISSUE})
	public List<SwapOfferData> listActiveOffers() {
		try {
			return this.swapCoordinator.listActiveOffers();
		} catch (DataException e) {
			throw this.toApiException(e);
		}
	}

	@GET
	@Path("/offers/{swapId}")
	@Operation(
		summary = "Fetch swap",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData getOffer(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.getOffer(swapId);
		} catch (SwapException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/accept")
	@Operation(
		summary = "Accept swap offer",
		requestBody = @RequestBody(
			required = true,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(implementation = AcceptSwapOfferRequest.class)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.INVALID_SWAP_REQUEST, ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData acceptOffer(@PathParam("swapId") String swapId, AcceptSwapOfferRequest acceptRequest) {
		String acceptorAddress = acceptRequest != null ? acceptRequest.acceptorAddress : null;

		try {
			return this.swapCoordinator.acceptOffer(swapId, acceptorAddress);
		} catch (SwapException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/lock-initiator")
	@Operation(
		summary = "Lock initiator's funds",
		description = "Initiator's funds are locked against the swap hashlock until initiator's timelock.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData lockInitiator(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.lockInitiator(swapId);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/lock-acceptor")
	@Operation(
		summary = "Lock acceptor's funds",
		description = "Only allowed once initiator's funds are locked. Acceptor's funds are locked until the earlier acceptor timelock.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData lockAcceptor(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.lockAcceptor(swapId);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/claim-initiator")
	@Operation(
		summary = "Initiator claims acceptor's funds",
		description = "Reveals the swap secret, which is returned in the response.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = InitiatorClaimResponse.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public InitiatorClaimResponse claimInitiator(@PathParam("swapId") String swapId) {
		try {
			SwapOfferData swapOfferData = this.swapCoordinator.claimInitiator(swapId);
			return new InitiatorClaimResponse(swapOfferData);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/claim-acceptor")
	@Operation(
		summary = "Acceptor claims initiator's funds, completing swap",
		requestBody = @RequestBody(
			required = false,
			content = @Content(
				mediaType = MediaType.APPLICATION_JSON,
				schema = @Schema(implementation = AcceptorClaimRequest.class)
			)
		),
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.INVALID_SWAP_REQUEST, ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData claimAcceptor(@PathParam("swapId") String swapId, AcceptorClaimRequest claimRequest) {
		byte[] secret = null;

		if (claimRequest != null && claimRequest.secret != null && !claimRequest.secret.isEmpty()) {
			try {
				secret = HashCode.fromString(claimRequest.secret.trim().toLowerCase()).asBytes();
			} catch (IllegalArgumentException e) {
				throw ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_SWAP_REQUEST, "Secret must be hex encoded");
			}
		}

		try {
			return this.swapCoordinator.claimAcceptor(swapId, secret);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/refund-initiator")
	@Operation(
		summary = "Refund initiator's locked funds",
		description = "Only allowed after initiator's timelock has expired, and only if acceptor has not claimed them.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.TIMELOCK_NOT_EXPIRED, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData refundInitiator(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.refundInitiator(swapId);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/refund-acceptor")
	@Operation(
		summary = "Refund acceptor's locked funds",
		description = "Only allowed after acceptor's timelock has expired, and only if initiator has not claimed them.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.TIMELOCK_NOT_EXPIRED, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData refundAcceptor(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.refundAcceptor(swapId);
		} catch (SwapException | SettlementBackendException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@POST
	@Path("/offers/{swapId}/cancel")
	@Operation(
		summary = "Cancel swap offer that has not been accepted",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = SwapOfferData.class))
			)
		}
	)
	@ApiErrors({ApiError.SWAP_NOT_FOUND, ApiError.INVALID_SWAP_STATE, ApiError.REPOSITORY_ISSUE})
	public SwapOfferData cancelOffer(@PathParam("swapId") String swapId) {
		try {
			return this.swapCoordinator.cancelOffer(swapId);
		} catch (SwapException | DataException e) {
			throw this.toApiException(e);
		}
	}

	@GET
	@Path("/balances")
	@Operation(
		summary = "Wallet balance of each configured settlement backend",
		responses = {
			@ApiResponse(
				content = @Content(array = @ArraySchema(schema = @Schema(implementation = AssetBalance.class)))
			)
		}
	)
	@ApiErrors({ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, ApiError.SETTLEMENT_BACKEND_REJECTED})
	public List<AssetBalance> getBalances() {
		try {
			List<AssetBalance> balances = new ArrayList<>();

			for (Map.Entry<SupportedAsset, BigDecimal> entry : this.swapCoordinator.getBalances().entrySet())
				balances.add(new AssetBalance(entry.getKey(), entry.getValue()));

			return balances;
		} catch (SettlementBackendException e) {
			throw this.toApiException(e);
		}
	}

	private SupportedAsset parseAsset(String assetName) {
		SupportedAsset asset = SupportedAsset.fromString(assetName);
		if (asset == null)
			throw ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_SWAP_REQUEST, String.format("Unsupported asset: %s", assetName));

		return asset;
	}

	private ApiException toApiException(Exception e) {
		if (e instanceof SwapException.ValidationException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_SWAP_REQUEST, e.getMessage());

		if (e instanceof SwapException.NotFoundException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.SWAP_NOT_FOUND, e.getMessage());

		if (e instanceof SwapException.TimelockNotExpiredException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.TIMELOCK_NOT_EXPIRED, e.getMessage());

		if (e instanceof SwapException.InvalidStateException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.INVALID_SWAP_STATE, e.getMessage());

		if (e instanceof SettlementBackendException.UnavailableException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.SETTLEMENT_BACKEND_UNAVAILABLE, e.getMessage());

		if (e instanceof SettlementBackendException)
			return ApiExceptionFactory.INSTANCE.createCustomException(request, ApiError.SETTLEMENT_BACKEND_REJECTED, e.getMessage());

		if (e instanceof DataException) {
			LOGGER.error("Repository issue while handling swap request", e);
			return ApiExceptionFactory.INSTANCE.createException(request, ApiError.REPOSITORY_ISSUE, e);
		}

		LOGGER.error("Unexpected error while handling swap request", e);
		return ApiExceptionFactory.INSTANCE.createException(request, ApiError.UNKNOWN, e);
	}

}
