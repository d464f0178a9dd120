package org.atomicswap.crosschain;

import java.math.BigDecimal;

/**
 * Ledger-side capability needed to settle one leg of a swap.
 * <p>
 * Returned references mean the action was submitted, not that it is final.
 */
public interface SettlementBackend {

	public SupportedAsset getAsset();

	/**
	 * Locks <tt>amount</tt> behind hashlock until timelock, claimable by recipient.
	 *
	 * @return transaction reference of the lock
	 */
	public String lock(BigDecimal amount, String hashlock, long timelock, String recipient) throws SettlementBackendException;

	/** Claims locked funds by revealing secret. */
	public String redeem(String lockReference, byte[] secret) throws SettlementBackendException;

	/** Returns locked funds to their original owner after timelock expiry. */
	public String refund(String lockReference) throws SettlementBackendException;

	public BigDecimal getBalance() throws SettlementBackendException;

}
