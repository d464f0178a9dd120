package org.atomicswap.crosschain;

import java.security.SecureRandom;

import org.atomicswap.crypto.Crypto;
import org.atomicswap.utils.NTP;

import com.google.common.hash.HashCode;

/**
 * Hashed-timelock commitment primitives shared by both legs of a swap.
 * <p>
 * Both legs lock funds against the same hashlock. The leg created second (the acceptor's)
 * must expire first, so the initiator can never claim after the acceptor loses the ability to refund.
 */
public abstract class HashTimeLock {

	public static final int SECRET_LENGTH = 32;

	private static final SecureRandom RANDOM = new SecureRandom();

	/** Returns new random 32-byte secret. */
	public static byte[] generateSecret() {
		byte[] secret = new byte[SECRET_LENGTH];
		RANDOM.nextBytes(secret);
		return secret;
	}

	/** Returns lowercase hex SHA-256 digest of secret. */
	public static String hashlock(byte[] secret) {
		return HashCode.fromBytes(Crypto.digest(secret)).toString();
	}

	/** Returns true if secret is a 32-byte preimage of hashlock. */
	public static boolean verify(byte[] secret, String hashlock) {
		if (secret == null || secret.length != SECRET_LENGTH || hashlock == null)
			return false;

		return hashlock(secret).equalsIgnoreCase(hashlock);
	}

	/** Returns absolute timelock, in ms since epoch, <tt>periodMs</tt> after network time now. */
	public static long makeTimelock(long periodMs) {
		return now() + periodMs;
	}

	/** Returns true once network time has passed timelock. */
	public static boolean isExpired(long timelock) {
		return now() > timelock;
	}

	/** Returns network time now (ms since epoch). */
	public static long now() {
		Long now = NTP.getTime();
		if (now == null)
			throw new IllegalStateException("Network time not yet synchronized");

		return now;
	}

}
