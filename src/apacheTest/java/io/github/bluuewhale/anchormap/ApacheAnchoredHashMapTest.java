package io.github.bluuewhale.anchormap;

import org.apache.commons.collections4.map.AbstractMapTest;

final class ApacheAnchoredHashMapTest<K, V> extends AbstractMapTest<AnchoredHashMap<K, V>, K, V> {
	@Override public boolean isAllowNullKey() { return false; }
	@Override public AnchoredHashMap<K, V> makeObject() { return new AnchoredHashMap<>(); }
}
