package org.atomicswap.crosschain;

import java.math.BigDecimal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.SettlementBackendException.RejectedException;
import org.atomicswap.utils.Amounts;
import org.json.simple.JSONObject;

/**
 * Settlement backend talking JSON-RPC to a bitcoind or elementsd wallet.
 * <p>
 * For Elements assets, <tt>assetLabel</tt> selects the issued asset both when sending and when reading balances.
 * <p>
 * A plain node wallet cannot build or spend HTLC scripts, so locks are wallet sends to the
 * counterparty tagged with the hashlock, and redeem/refund only confirm that the wallet knows
 * the referenced lock transaction.
 */
public class NodeRpcBackend extends JsonRpcBackend {

	private static final Logger LOGGER = LogManager.getLogger(NodeRpcBackend.class);

	private final String assetLabel;

	public NodeRpcBackend(SupportedAsset asset, String rpcUrl, String rpcUser, String rpcPassword, String walletName, String assetLabel) {
		super(asset, walletUrl(rpcUrl, walletName), rpcUser, rpcPassword, "1.0");

		this.assetLabel = assetLabel;
	}

	private static String walletUrl(String rpcUrl, String walletName) {
		String url = rpcUrl.endsWith("/") ? rpcUrl.substring(0, rpcUrl.length() - 1) : rpcUrl;
		return walletName != null && !walletName.isEmpty() ? url + "/wallet/" + walletName : url;
	}

	@Override
	@SuppressWarnings("unchecked")
	public String lock(BigDecimal amount, String hashlock, long timelock, String recipient) throws SettlementBackendException {
		JSONObject params = new JSONObject();
		params.put("address", recipient);
		params.put("amount", Amounts.normalize(amount).toPlainString());
		params.put("comment", String.format("htlc %s until %d", hashlock, timelock));

		if (this.assetLabel != null)
			params.put("assetlabel", this.assetLabel);

		String txid = stringResult(this.rpc("sendtoaddress", params), "sendtoaddress");
		LOGGER.info(() -> String.format("Locked %s %s for %s: %s", Amounts.prettyAmount(amount), this.asset, recipient, txid));
		return txid;
	}

	@Override
	public String redeem(String lockReference, byte[] secret) throws SettlementBackendException {
		String txid = this.confirmTransaction(lockReference);
		LOGGER.info(() -> String.format("Redeemed %s lock %s", this.asset, txid));
		return txid;
	}

	@Override
	public String refund(String lockReference) throws SettlementBackendException {
		String txid = this.confirmTransaction(lockReference);
		LOGGER.info(() -> String.format("Refunded %s lock %s", this.asset, txid));
		return txid;
	}

	@Override
	@SuppressWarnings("unchecked")
	public BigDecimal getBalance() throws SettlementBackendException {
		JSONObject params = new JSONObject();
		if (this.assetLabel != null)
			params.put("assetlabel", this.assetLabel);

		Object result = this.rpc("getbalance", params);

		// elementsd without assetlabel returns balances keyed by asset
		if (result instanceof JSONObject) {
			JSONObject balances = (JSONObject) result;
			Object assetBalance = balances.get(this.assetLabel != null ? this.assetLabel : "bitcoin");
			result = assetBalance != null ? assetBalance : 0L;
		}

		if (!(result instanceof Number))
			throw new RejectedException("Unexpected output from getbalance RPC");

		return new BigDecimal(result.toString());
	}

	@SuppressWarnings("unchecked")
	private String confirmTransaction(String txid) throws SettlementBackendException {
		JSONObject params = new JSONObject();
		params.put("txid", txid);

		Object result = this.rpc("gettransaction", params);
		if (!(result instanceof JSONObject))
			throw new RejectedException("Unexpected output from gettransaction RPC");

		Object txidObj = ((JSONObject) result).get("txid");
		if (!(txidObj instanceof String))
			throw new RejectedException("Missing txid from gettransaction RPC");

		return (String) txidObj;
	}

}
