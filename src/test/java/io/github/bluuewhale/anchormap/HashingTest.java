package io.github.bluuewhale.anchormap;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;

import org.junit.jupiter.api.Test;

class HashingTest {

	@Test
	void bucketOfMatchesUnsignedRemainder() {
		var rnd = new Random(7L);
		for (int shift = 0; shift <= 30; shift++) {
			int buckets = 1 << shift;
			for (int i = 0; i < 1_000; i++) {
				int h = rnd.nextInt();
				assertEquals(Integer.remainderUnsigned(h, buckets), Hashing.bucketOf(h, buckets));
			}
		}
	}

	@Test
	void ceilPow2() {
		assertEquals(1, Hashing.ceilPow2(-5));
		assertEquals(1, Hashing.ceilPow2(0));
		assertEquals(1, Hashing.ceilPow2(1));
		assertEquals(2, Hashing.ceilPow2(2));
		assertEquals(4, Hashing.ceilPow2(3));
		assertEquals(1024, Hashing.ceilPow2(1000));
		assertEquals(Hashing.MAX_TABLE_SIZE, Hashing.ceilPow2(Integer.MAX_VALUE));
	}

	@Test
	void needsResizingOnlyAboveLoadFactor() {
		assertFalse(Hashing.needsResizing(4, 4, 1.0d));
		assertTrue(Hashing.needsResizing(5, 4, 1.0d));
		assertFalse(Hashing.needsResizing(Hashing.MAX_TABLE_SIZE + 1, Hashing.MAX_TABLE_SIZE, 1.0d));
	}

	@Test
	void smearSpreadsSequentialHashCodesIntoLowBits() {
		// sequential hashCodes would otherwise fill only the first buckets of a small table
		int buckets = 16;
		int[] hits = new int[buckets];
		for (int i = 0; i < 16 * 64; i += 16) hits[Hashing.bucketOf(Hashing.smear(i), buckets)]++;
		int used = 0;
		for (int h : hits) if (h > 0) used++;
		assertTrue(used > buckets / 2, "smear left " + used + " of " + buckets + " buckets in use");
	}

	@Test
	void smearedHashOfNullIsZero() {
		assertEquals(0, Hashing.smearedHash(null));
		assertEquals(Hashing.smear("k".hashCode()), KeyHasher.smeared().hash("k"));
	}
}
