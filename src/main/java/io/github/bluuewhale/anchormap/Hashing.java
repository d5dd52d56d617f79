package io.github.bluuewhale.anchormap;

/**
 * Static helpers based on the hash utilities authored by Guava contributors.
 * Original code by Kevin Bourrillion, Jesse Wilson, and Austin Appleby,
 * derived from the MurmurHash3 intermediate step (public domain).
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	/*
	 * Upper bound to keep the bucket count a power of two.
	 * Matches Guava's Ints.MAX_POWER_OF_TWO (1 << 30).
	 */
	static final int MAX_TABLE_SIZE = 1 << 30;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	static int smearedHash(Object o) {
		return smear((o == null) ? 0 : o.hashCode());
	}

	/**
	 * Bucket for {@code hash} in a table of {@code bucketCount} buckets.
	 * The count is always a power of two, so the mask equals {@code Integer.remainderUnsigned}.
	 */
	static int bucketOf(int hash, int bucketCount) {
		return hash & (bucketCount - 1);
	}

	static int ceilPow2(int x) {
		if (x <= 1) return 1;
		if (x >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Integer.highestOneBit(x - 1) << 1;
	}

	static boolean needsResizing(int size, int tableSize, double loadFactor) {
		return size > loadFactor * tableSize && tableSize < MAX_TABLE_SIZE;
	}
}
