package org.atomicswap.controller.swap;

import static org.atomicswap.data.swap.SwapStatus.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import org.atomicswap.data.swap.SwapStatus;

/** Legal swap state changes. Anything not listed here is refused. */
public enum SwapTransition {
	ACCEPT(ACCEPTED, OFFERED),
	LOCK_INITIATOR(INITIATOR_LOCKED, ACCEPTED),
	LOCK_ACCEPTOR(ACCEPTOR_LOCKED, INITIATOR_LOCKED),
	CLAIM_INITIATOR(INITIATOR_CLAIMED, ACCEPTOR_LOCKED),
	CLAIM_ACCEPTOR(COMPLETED, INITIATOR_CLAIMED),
	// Other leg may still be refunded after one leg was
	REFUND_INITIATOR(REFUNDED, INITIATOR_LOCKED, ACCEPTOR_LOCKED, INITIATOR_CLAIMED, REFUNDED),
	REFUND_ACCEPTOR(REFUNDED, ACCEPTOR_LOCKED, REFUNDED),
	CANCEL(CANCELLED, OFFERED);

	public final SwapStatus target;
	private final Set<SwapStatus> sources;

	SwapTransition(SwapStatus target, SwapStatus... sources) {
		this.target = target;
		this.sources = Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(sources)));
	}

	public Set<SwapStatus> getSources() {
		return this.sources;
	}

	public boolean isAllowedFrom(SwapStatus status) {
		return this.sources.contains(status);
	}

	/** Returns true if any transition moves a swap from <tt>from</tt> to <tt>to</tt>. */
	public static boolean isLegal(SwapStatus from, SwapStatus to) {
		return Arrays.stream(SwapTransition.values()).anyMatch(transition -> transition.target == to && transition.isAllowedFrom(from));
	}

}
