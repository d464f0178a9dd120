package org.atomicswap.crosschain;

import java.math.BigDecimal;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.crosschain.SettlementBackendException.RejectedException;
import org.atomicswap.utils.Amounts;
import org.json.simple.JSONObject;

/**
 * Bitcoin settlement backend driving an Electrum wallet daemon over its JSON-RPC interface.
 * <p>
 * Locks build an unsigned payment with <tt>payto</tt>, sign it with <tt>signtransaction</tt>
 * and submit it with <tt>broadcast</tt>. As with {@link NodeRpcBackend}, redeem/refund only
 * confirm that the wallet knows the referenced lock transaction.
 */
public class ElectrumRpcBackend extends JsonRpcBackend {

	private static final Logger LOGGER = LogManager.getLogger(ElectrumRpcBackend.class);

	private final String walletPassword;

	public ElectrumRpcBackend(SupportedAsset asset, String rpcUrl, String rpcUser, String rpcPassword, String walletPassword) {
		super(asset, rpcUrl, rpcUser, rpcPassword, "2.0");

		this.walletPassword = walletPassword;
	}

	@Override
	@SuppressWarnings("unchecked")
	public String lock(BigDecimal amount, String hashlock, long timelock, String recipient) throws SettlementBackendException {
		JSONObject paytoParams = new JSONObject();
		paytoParams.put("destination", recipient);
		paytoParams.put("amount", Amounts.normalize(amount).toPlainString());
		paytoParams.put("unsigned", true);
		if (this.walletPassword != null)
			paytoParams.put("password", this.walletPassword);

		String unsignedTx = stringResult(this.rpc("payto", paytoParams), "payto");

		JSONObject signParams = new JSONObject();
		signParams.put("tx", unsignedTx);
		if (this.walletPassword != null)
			signParams.put("password", this.walletPassword);

		String signedTx = stringResult(this.rpc("signtransaction", signParams), "signtransaction");

		JSONObject broadcastParams = new JSONObject();
		broadcastParams.put("tx", signedTx);

		String txid = stringResult(this.rpc("broadcast", broadcastParams), "broadcast");

		LOGGER.info(() -> String.format("Locked %s %s for %s behind %s until %d: %s",
				Amounts.prettyAmount(amount), this.asset, recipient, hashlock, timelock, txid));
		return txid;
	}

	@Override
	public String redeem(String lockReference, byte[] secret) throws SettlementBackendException {
		this.confirmTransaction(lockReference);
		LOGGER.info(() -> String.format("Redeemed %s lock %s", this.asset, lockReference));
		return lockReference;
	}

	@Override
	public String refund(String lockReference) throws SettlementBackendException {
		this.confirmTransaction(lockReference);
		LOGGER.info(() -> String.format("Refunded %s lock %s", this.asset, lockReference));
		return lockReference;
	}

	@Override
	public BigDecimal getBalance() throws SettlementBackendException {
		Object result = this.rpc("getbalance", new JSONObject());
		if (!(result instanceof JSONObject))
			throw new RejectedException("Unexpected output from getbalance RPC");

		// Electrum reports amounts as decimal strings
		Object confirmed = ((JSONObject) result).get("confirmed");
		if (confirmed == null)
			return BigDecimal.ZERO;

		try {
			return new BigDecimal(confirmed.toString());
		} catch (NumberFormatException e) {
			throw new RejectedException(String.format("Unexpected confirmed balance from getbalance RPC: %s", confirmed));
		}
	}

	@SuppressWarnings("unchecked")
	private void confirmTransaction(String txid) throws SettlementBackendException {
		JSONObject params = new JSONObject();
		params.put("txid", txid);

		// Electrum returns raw transaction hex
		stringResult(this.rpc("gettransaction", params), "gettransaction");
	}

}
