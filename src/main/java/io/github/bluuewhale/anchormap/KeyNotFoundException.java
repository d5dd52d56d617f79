package io.github.bluuewhale.anchormap;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link AnchoredHashMap#at(Object)} when the key has no mapping.
 * Use {@link AnchoredHashMap#find(Object)} for a lookup that does not throw.
 */
public class KeyNotFoundException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	private final transient Object key;

	public KeyNotFoundException(Object key) {
		super("Key not found: " + key);
		this.key = key;
	}

	public Object getKey() {
		return key;
	}
}
