package org.atomicswap.api;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class ApiErrorMessage {

	@Schema(description = "API error code")
	public int error;

	@Schema(description = "human-readable error message")
	public String message;

	protected ApiErrorMessage() {
		/* JAXB */
	}

	public ApiErrorMessage(int error, String message) {
		this.error = error;
		this.message = message;
	}

}
