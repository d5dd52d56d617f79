package io.github.bluuewhale.anchormap;

/**
 * Hash strategy used by {@link AnchoredHashMap} to pick a bucket for a key.
 * The rules of {@link Object#hashCode} also apply here: equal keys must hash equally.
 *
 * <p>The result is treated as an unsigned 32-bit value; only its low bits select the bucket,
 * so implementations should spread entropy into them.
 *
 * @param <K> the key type
 */
@FunctionalInterface
public interface KeyHasher<K> {

	int hash(K key);

	/**
	 * Default strategy: {@code hashCode()} passed through the MurmurHash3 smear.
	 */
	static <K> KeyHasher<K> smeared() {
		return Hashing::smearedHash;
	}

	/**
	 * Plain {@code hashCode()} with no mixing. Useful for keys with well spread hash codes
	 * and for tests that need predictable bucket placement.
	 */
	static <K> KeyHasher<K> identity() {
		return Object::hashCode;
	}
}
