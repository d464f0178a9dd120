package org.atomicswap.data.swap;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

import java.util.Locale;
import java.util.Map;

import javax.xml.bind.annotation.XmlEnum;
import javax.xml.bind.annotation.XmlEnumValue;

@XmlEnum
public enum SwapStatus {
	@XmlEnumValue("offered")
	OFFERED(false, false),
	@XmlEnumValue("accepted")
	ACCEPTED(true, false),
	@XmlEnumValue("initiator_locked")
	INITIATOR_LOCKED(true, false),
	@XmlEnumValue("acceptor_locked")
	ACCEPTOR_LOCKED(true, false),
	@XmlEnumValue("initiator_claimed")
	INITIATOR_CLAIMED(true, false),
	@XmlEnumValue("completed")
	COMPLETED(false, true),
	@XmlEnumValue("refunded")
	REFUNDED(false, true),
	@XmlEnumValue("cancelled")
	CANCELLED(false, true);

	private static final Map<String, SwapStatus> map = stream(SwapStatus.values()).collect(toMap(status -> status.name(), status -> status));

	/** Accepted but not yet settled either way. */
	public final boolean isActive;
	/** No forward transition exists, though a refunded swap may still refund its other leg. */
	public final boolean isFinal;

	SwapStatus(boolean isActive, boolean isFinal) {
		this.isActive = isActive;
		this.isFinal = isFinal;
	}

	/** Returns status matching name, e.g. "initiator_locked", ignoring case, or null if unknown. */
	public static SwapStatus fromString(String name) {
		if (name == null)
			return null;

		return map.get(name.trim().toUpperCase(Locale.ROOT));
	}

}
