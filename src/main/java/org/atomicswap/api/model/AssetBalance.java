package org.atomicswap.api.model;

import java.math.BigDecimal;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import org.atomicswap.crosschain.SupportedAsset;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class AssetBalance {

	public SupportedAsset asset;

	@Schema(type = "number")
	public BigDecimal balance;

	protected AssetBalance() {
		/* JAXB */
	}

	public AssetBalance(SupportedAsset asset, BigDecimal balance) {
		this.asset = asset;
		this.balance = balance;
	}

}
