package org.atomicswap.test.crosschain;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.atomicswap.crosschain.HashTimeLock;
import org.atomicswap.repository.DataException;
import org.atomicswap.test.common.Common;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class HashTimeLockTests extends Common {

	@Before
	public void beforeTest() throws DataException {
		Common.useDefaultSettings();
	}

	@After
	public void afterTest() {
		Common.resetNetworkTime();
	}

	@Test
	public void testHashlock() {
		byte[] secret = new byte[HashTimeLock.SECRET_LENGTH];

		// SHA-256 of 32 zero bytes
		assertEquals("66687aadf862bd776c8fc18b8e9f8e20089714856ee233b3902a591d0d5f2925", HashTimeLock.hashlock(secret));
	}

	@Test
	public void testGenerateSecret() {
		byte[] secret1 = HashTimeLock.generateSecret();
		byte[] secret2 = HashTimeLock.generateSecret();

		assertEquals(HashTimeLock.SECRET_LENGTH, secret1.length);
		assertEquals(HashTimeLock.SECRET_LENGTH, secret2.length);
		assertFalse(Arrays.equals(secret1, secret2));
	}

	@Test
	public void testVerify() {
		byte[] secret = HashTimeLock.generateSecret();
		String hashlock = HashTimeLock.hashlock(secret);

		assertEquals(64, hashlock.length());
		assertTrue(HashTimeLock.verify(secret, hashlock));
		assertTrue("Hashlock comparison should ignore case", HashTimeLock.verify(secret, hashlock.toUpperCase()));

		byte[] tampered = secret.clone();
		tampered[0] ^= 0x01;
		assertFalse(HashTimeLock.verify(tampered, hashlock));

		assertFalse(HashTimeLock.verify(null, hashlock));
		assertFalse(HashTimeLock.verify(Arrays.copyOf(secret, 16), hashlock));
		assertFalse(HashTimeLock.verify(secret, null));
	}

	@Test
	public void testTimelocks() {
		long now = HashTimeLock.now();

		long timelock = HashTimeLock.makeTimelock(60_000L);
		assertTrue(timelock >= now + 60_000L);
		assertFalse(HashTimeLock.isExpired(timelock));

		assertTrue(HashTimeLock.isExpired(now - 1L));

		// Network time moves past timelock
		Common.passTimelock(timelock);
		assertTrue(HashTimeLock.isExpired(timelock));
	}

}
