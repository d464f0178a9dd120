package org.atomicswap.repository;

import java.util.Collection;
import java.util.List;

import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;

public interface SwapRepository {

	/** Returns swap offer with passed ID, or null if not found. */
	public SwapOfferData fromSwapId(String swapId) throws DataException;

	/**
	 * Returns swap offers, newest first.
	 *
	 * @param status only return offers with this status, or null for all offers
	 */
	public List<SwapOfferData> getSwapOffers(SwapStatus status) throws DataException;

	/** Returns swap offers having any of passed statuses, newest first. */
	public List<SwapOfferData> getSwapOffersByStatuses(Collection<SwapStatus> statuses) throws DataException;

	/** Stores new swap offer. Throws if an offer with the same ID already exists. */
	public void create(SwapOfferData swapOfferData) throws DataException;

	/**
	 * Stores changes to swap offer, provided stored offer still has <tt>expectedStatus</tt> and <tt>expectedVersion</tt>.
	 * <p>
	 * On success, passed <tt>swapOfferData</tt>'s version is incremented.
	 *
	 * @return true if stored, false if offer is missing or was changed by someone else
	 */
	public boolean update(SwapOfferData swapOfferData, SwapStatus expectedStatus, int expectedVersion) throws DataException;

}
