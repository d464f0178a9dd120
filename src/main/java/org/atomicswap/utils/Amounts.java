package org.atomicswap.utils;

import java.math.BigDecimal;

public abstract class Amounts {

	/** Number of fractional digits stored for every amount, matching the smallest unit of both backends. */
	public static final int SCALE = 8;

	/** Largest whole-unit amount that fits the repository's DECIMAL(27,8) columns. */
	public static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999999999999.99999999");

	/** Returns true if amount is positive, fits repository columns and needs no more than {@link #SCALE} fractional digits. */
	public static boolean isValid(BigDecimal amount) {
		if (amount == null || amount.signum() <= 0)
			return false;

		if (amount.compareTo(MAX_AMOUNT) > 0)
			return false;

		return amount.stripTrailingZeros().scale() <= SCALE;
	}

	/** Returns amount rescaled to {@link #SCALE} fractional digits, without rounding. */
	public static BigDecimal normalize(BigDecimal amount) {
		// Throws ArithmeticException if rounding would be required - callers validate first
		return amount.setScale(SCALE);
	}

	public static String prettyAmount(BigDecimal amount) {
		if (amount == null)
			return "?";

		if (amount.scale() > SCALE)
			return amount.toPlainString();

		return amount.setScale(SCALE).toPlainString();
	}

}
