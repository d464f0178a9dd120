package org.atomicswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class AcceptSwapOfferRequest {

	@Schema(description = "acceptor's receiving address on the initiator asset's ledger")
	public String acceptorAddress;

	public AcceptSwapOfferRequest() {
	}

}
