package org.atomicswap.api.model;

import java.math.BigDecimal;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class CreateSwapOfferRequest {

	@Schema(description = "asset the initiator offers", example = "depix")
	public String initiatorAsset;

	@Schema(description = "amount the initiator offers, at most 8 decimal places", type = "number", example = "100")
	public BigDecimal initiatorAmount;

	@Schema(description = "asset the initiator wants in return", example = "btc")
	public String acceptorAsset;

	@Schema(description = "amount the initiator wants in return, at most 8 decimal places", type = "number", example = "0.001")
	public BigDecimal acceptorAmount;

	@Schema(description = "initiator's receiving address on the acceptor asset's ledger")
	public String initiatorAddress;

	public CreateSwapOfferRequest() {
	}

}
