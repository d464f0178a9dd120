package org.atomicswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class AcceptorClaimRequest {

	@Schema(description = "optional 32-byte secret, hex encoded, as revealed by the initiator's claim. Checked against the swap's hashlock.")
	public String secret;

	public AcceptorClaimRequest() {
	}

}
