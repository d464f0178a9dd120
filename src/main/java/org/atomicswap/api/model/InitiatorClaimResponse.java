package org.atomicswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.atomicswap.data.swap.SwapOfferData;

import com.google.common.hash.HashCode;

import io.swagger.v3.oas.annotations.media.Schema;

/** Initiator claim result. The only response that carries the swap secret. */
@XmlAccessorType(XmlAccessType.FIELD)
public class InitiatorClaimResponse {

	public SwapOfferData swap;

	@Schema(description = "swap secret, hex encoded, now public on the acceptor asset's ledger")
	public String secret;

	public String message;

	protected InitiatorClaimResponse() {
		/* JAXB */
	}

	public InitiatorClaimResponse(SwapOfferData swap) {
		this.swap = swap;
		this.secret = HashCode.fromBytes(swap.getSecret()).toString();
		this.message = "Initiator claimed funds. Secret is now public.";
	}

}
