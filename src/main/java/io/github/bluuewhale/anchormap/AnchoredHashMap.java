package io.github.bluuewhale.anchormap;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hash map with stable element references (null keys NOT allowed, null values allowed).
 *
 * <p>All mappings live in one singly-linked element chain, newest first, behind a sentinel head.
 * The bucket index does not hold elements: each bucket is a singly-linked list of anchors, and an
 * anchor points at the chain node <em>preceding</em> its element. Holding the predecessor lets
 * erase unlink from the singly-linked chain in O(1) once the anchor is found.
 *
 * <p>Growing the index only moves anchors between buckets, so an {@link Element} obtained from
 * {@link #find(Object)} or {@link #findOrInsert(Object)} keeps denoting the same mapping across any
 * number of inserts and rehashes. Erasing a mapping detaches only its own element.
 *
 * <p>{@link #insert(Object, Object)} keeps the first value inserted for a key;
 * {@link #put(Object, Object)} follows the {@link Map} contract and replaces it in place.
 *
 * <p>Not thread-safe. Iterators are fail-fast on a best-effort basis.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class AnchoredHashMap<K, V> extends AbstractMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(AnchoredHashMap.class);

	/* Defaults */
	private static final int DEFAULT_BUCKET_COUNT = 1;
	private static final double MAX_LOAD_FACTOR = 1.0d;

	private final KeyHasher<? super K> hasher;

	/* Element chain: head is the "before-first" position and never holds a mapping */
	private final Element<K, V> head = new Element<>(0, null, null);

	/* Bucket index, length is a power of two */
	private Anchor<K, V>[] buckets;
	private int size;
	private int modCount;

	public AnchoredHashMap() {
		this(DEFAULT_BUCKET_COUNT, KeyHasher.smeared());
	}

	public AnchoredHashMap(KeyHasher<? super K> hasher) {
		this(DEFAULT_BUCKET_COUNT, hasher);
	}

	public AnchoredHashMap(int initialBucketCount) {
		this(initialBucketCount, KeyHasher.smeared());
	}

	public AnchoredHashMap(int initialBucketCount, KeyHasher<? super K> hasher) {
		if (initialBucketCount < 0) {
			throw new IllegalArgumentException("initialBucketCount must be non-negative: " + initialBucketCount);
		}
		this.hasher = Objects.requireNonNull(hasher, "hasher");
		this.buckets = newTable(Hashing.ceilPow2(initialBucketCount));
	}

	/**
	 * Inserts every pair in iteration order; for repeated keys the first pair wins.
	 */
	public AnchoredHashMap(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
		this(entries, KeyHasher.smeared());
	}

	public AnchoredHashMap(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries, KeyHasher<? super K> hasher) {
		this(DEFAULT_BUCKET_COUNT, hasher);
		for (Map.Entry<? extends K, ? extends V> e : entries) {
			insert(e);
		}
	}

	/**
	 * Copy constructor. Shares the source's hash strategy, never its elements.
	 */
	public AnchoredHashMap(AnchoredHashMap<K, ? extends V> source) {
		this(DEFAULT_BUCKET_COUNT, source.hasher);
		assign(source);
	}

	@SafeVarargs
	public static <K, V> AnchoredHashMap<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
		return new AnchoredHashMap<>(Arrays.asList(entries));
	}

	@SafeVarargs
	public static <K, V> AnchoredHashMap<K, V> ofEntries(KeyHasher<? super K> hasher,
			Map.Entry<? extends K, ? extends V>... entries) {
		return new AnchoredHashMap<>(Arrays.asList(entries), hasher);
	}

	/* ------------ Core API ------------ */

	/**
	 * Returns the element mapped for {@code key}, or {@code null} if there is none.
	 * The returned element stays valid until its mapping is erased.
	 */
	public Element<K, V> find(Object key) {
		return findElement(hash(key), key);
	}

	/**
	 * Inserts the mapping unless {@code key} is already present, in which case the map is left
	 * untouched and the existing value is kept.
	 *
	 * @return {@code true} if a new mapping was created
	 */
	public boolean insert(K key, V value) {
		int h = hash(key);
		if (findElement(h, key) != null) return false;
		link(h, key, value);
		return true;
	}

	public boolean insert(Map.Entry<? extends K, ? extends V> entry) {
		return insert(entry.getKey(), entry.getValue());
	}

	/**
	 * Returns the value mapped for {@code key}.
	 *
	 * @throws KeyNotFoundException if the key has no mapping
	 */
	public V at(Object key) {
		Element<K, V> e = find(key);
		if (e == null) throw new KeyNotFoundException(key);
		return e.value;
	}

	/**
	 * Returns the element for {@code key}, first inserting a {@code null} value if absent.
	 */
	public Element<K, V> findOrInsert(K key) {
		int h = hash(key);
		Element<K, V> e = findElement(h, key);
		return (e != null) ? e : link(h, key, null);
	}

	/**
	 * Returns the element for {@code key}, first inserting {@code defaultValue.get()} if absent.
	 * The supplier is not called when the key is present.
	 */
	public Element<K, V> findOrInsert(K key, Supplier<? extends V> defaultValue) {
		Objects.requireNonNull(defaultValue, "defaultValue");
		int h = hash(key);
		Element<K, V> e = findElement(h, key);
		return (e != null) ? e : link(h, key, defaultValue.get());
	}

	/**
	 * Removes the mapping for {@code key} if present.
	 *
	 * @return {@code true} if a mapping was removed
	 */
	public boolean erase(Object key) {
		return unlink(key) != null;
	}

	/**
	 * Replaces the contents of this map with the mappings of {@code source}, inserted in the
	 * source's iteration order. Assigning a map to itself is a no-op.
	 */
	public AnchoredHashMap<K, V> assign(AnchoredHashMap<? extends K, ? extends V> source) {
		Objects.requireNonNull(source, "source");
		if (source == this) return this;
		clear();
		for (Map.Entry<? extends K, ? extends V> e : source.entrySet()) {
			insert(e.getKey(), e.getValue());
		}
		return this;
	}

	public KeyHasher<? super K> hashFunction() {
		return hasher;
	}

	public int bucketCount() {
		return buckets.length;
	}

	/**
	 * Number of anchors held by {@code bucket}.
	 */
	public int bucketSize(int bucket) {
		Objects.checkIndex(bucket, buckets.length);
		int n = 0;
		for (Anchor<K, V> a = buckets[bucket]; a != null; a = a.next) n++;
		return n;
	}

	public double loadFactor() {
		return (double) size / buckets.length;
	}

	public double maxLoadFactor() {
		return MAX_LOAD_FACTOR;
	}

	/**
	 * Iterates elements front to back (most recent insert first).
	 */
	public Iterator<Element<K, V>> elementIterator() {
		return new ElementIterator();
	}

	/* ------------ Map API ------------ */

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return find(key) != null;
	}

	@Override
	public V get(Object key) {
		Element<K, V> e = find(key);
		return (e == null) ? null : e.value;
	}

	@Override
	public V getOrDefault(Object key, V defaultValue) {
		Element<K, V> e = find(key);
		return (e == null) ? defaultValue : e.value;
	}

	@Override
	public V put(K key, V value) {
		int h = hash(key);
		Element<K, V> e = findElement(h, key);
		if (e != null) {
			V old = e.value;
			e.value = value;
			return old;
		}
		link(h, key, value);
		return null;
	}

	@Override
	public V remove(Object key) {
		Element<K, V> e = unlink(key);
		return (e == null) ? null : e.value;
	}

	@Override
	public void clear() {
		Arrays.fill(buckets, null);
		head.next = null;
		size = 0;
		modCount++;
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	/* ------------ Internals ------------ */

	@SuppressWarnings("unchecked")
	private int hash(Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return hasher.hash((K) key);
	}

	private Element<K, V> findElement(int h, Object key) {
		for (Anchor<K, V> a = buckets[Hashing.bucketOf(h, buckets.length)]; a != null; a = a.next) {
			Element<K, V> e = a.pred.next;
			if (e.hash == h && (e.key == key || key.equals(e.key))) return e;
		}
		return null;
	}

	/**
	 * Anchor whose successor is {@code e}. Every linked element has exactly one.
	 */
	private Anchor<K, V> anchorOf(Element<K, V> e) {
		for (Anchor<K, V> a = buckets[Hashing.bucketOf(e.hash, buckets.length)]; a != null; a = a.next) {
			if (a.pred.next == e) return a;
		}
		throw new IllegalStateException("No anchor for key " + e.key + "; map modified concurrently?");
	}

	private Element<K, V> link(int h, K key, V value) {
		// The old front's anchor targets head; find it before head.next changes.
		Element<K, V> front = head.next;
		Anchor<K, V> frontAnchor = (front == null) ? null : anchorOf(front);

		Element<K, V> e = new Element<>(h, key, value);
		e.next = front;
		head.next = e;
		if (frontAnchor != null) frontAnchor.pred = e;

		int b = Hashing.bucketOf(h, buckets.length);
		buckets[b] = new Anchor<>(head, buckets[b]);

		size++;
		modCount++;
		if (Hashing.needsResizing(size, buckets.length, MAX_LOAD_FACTOR)) {
			rehash();
		}
		return e;
	}

	private Element<K, V> unlink(Object key) {
		int h = hash(key);
		int b = Hashing.bucketOf(h, buckets.length);
		Anchor<K, V> prev = null;
		for (Anchor<K, V> a = buckets[b]; a != null; prev = a, a = a.next) {
			Element<K, V> e = a.pred.next;
			if (e.hash != h || !(e.key == key || key.equals(e.key))) continue;

			// Successor's predecessor changes from e to e's predecessor.
			Element<K, V> succ = e.next;
			if (succ != null) anchorOf(succ).pred = a.pred;
			a.pred.next = succ;
			e.next = null;

			if (prev == null) buckets[b] = a.next;
			else prev.next = a.next;

			size--;
			modCount++;
			return e;
		}
		return null;
	}

	/*
	 * Doubles the bucket count. An anchor in bucket b lands in b or b + oldCount; relative order
	 * within each half is preserved. Elements are not touched.
	 */
	private void rehash() {
		Anchor<K, V>[] old = buckets;
		int oldCount = old.length;
		int newCount = oldCount << 1;
		Anchor<K, V>[] table = newTable(newCount);

		for (int b = 0; b < oldCount; b++) {
			Anchor<K, V> loHead = null, loTail = null;
			Anchor<K, V> hiHead = null, hiTail = null;
			for (Anchor<K, V> a = old[b], next; a != null; a = next) {
				next = a.next;
				a.next = null;
				if (Hashing.bucketOf(a.pred.next.hash, newCount) == b) {
					if (loTail == null) loHead = a;
					else loTail.next = a;
					loTail = a;
				} else {
					if (hiTail == null) hiHead = a;
					else hiTail.next = a;
					hiTail = a;
				}
			}
			table[b] = loHead;
			table[b + oldCount] = hiHead;
		}
		buckets = table;

		if (log.isDebugEnabled()) {
			log.debug("Rehashed {} -> {} buckets at size {}", oldCount, newCount, size);
		}
		if (newCount == Hashing.MAX_TABLE_SIZE) {
			log.warn("Bucket count reached maximum {}; load factor is no longer bounded", newCount);
		}
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Anchor<K, V>[] newTable(int n) {
		return (Anchor<K, V>[]) new Anchor[n];
	}

	/* ------------ Element / Anchor ------------ */

	/**
	 * A mapping owned by the element chain. Its identity is stable for as long as the mapping is
	 * present; {@link #setValue(Object)} writes through to the map.
	 */
	public static final class Element<K, V> implements Map.Entry<K, V> {
		final int hash;
		final K key;
		V value;
		Element<K, V> next;

		Element(int hash, K key, V value) {
			this.hash = hash;
			this.key = key;
			this.value = value;
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			return value;
		}

		@Override
		public V setValue(V value) {
			V old = this.value;
			this.value = value;
			return old;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(key) ^ Objects.hashCode(value);
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == this) return true;
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(key, e.getKey()) && Objects.equals(value, e.getValue());
		}

		@Override
		public String toString() {
			return key + "=" + value;
		}
	}

	/* Non-owning: "the element after pred" is the indexed one */
	static final class Anchor<K, V> {
		Element<K, V> pred;
		Anchor<K, V> next;

		Anchor(Element<K, V> pred, Anchor<K, V> next) {
			this.pred = pred;
			this.next = next;
		}
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return AnchoredHashMap.this.size;
		}

		@Override
		public void clear() {
			AnchoredHashMap.this.clear();
		}

		@Override
		public boolean contains(Object o) {
			if (!(o instanceof Map.Entry<?, ?> e) || e.getKey() == null) return false;
			Element<K, V> found = find(e.getKey());
			return found != null && Objects.equals(found.value, e.getValue());
		}

		@Override
		public boolean remove(Object o) {
			if (!contains(o)) return false;
			return erase(((Map.Entry<?, ?>) o).getKey());
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	private abstract class ChainIterator {
		private Element<K, V> next = head.next;
		private Element<K, V> lastReturned;
		private int expectedModCount = modCount;

		public final boolean hasNext() {
			return next != null;
		}

		final Element<K, V> nextElement() {
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			Element<K, V> e = next;
			if (e == null) throw new NoSuchElementException();
			next = e.next;
			lastReturned = e;
			return e;
		}

		public final void remove() {
			if (lastReturned == null) throw new IllegalStateException();
			if (modCount != expectedModCount) throw new ConcurrentModificationException();
			unlink(lastReturned.key);
			lastReturned = null;
			expectedModCount = modCount;
		}
	}

	private final class EntryIterator extends ChainIterator implements Iterator<Map.Entry<K, V>> {
		@Override
		public Map.Entry<K, V> next() {
			return nextElement();
		}
	}

	private final class ElementIterator extends ChainIterator implements Iterator<Element<K, V>> {
		@Override
		public Element<K, V> next() {
			return nextElement();
		}
	}
}
