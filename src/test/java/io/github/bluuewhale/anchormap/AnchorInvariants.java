package io.github.bluuewhale.anchormap;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import io.github.bluuewhale.anchormap.AnchoredHashMap.Anchor;
import io.github.bluuewhale.anchormap.AnchoredHashMap.Element;

/**
 * Walks the private chain and bucket index of an {@link AnchoredHashMap} and fails if any
 * structural invariant is broken.
 */
final class AnchorInvariants {

	private AnchorInvariants() {}

	@SuppressWarnings("unchecked")
	static <T> T field(Object target, String name) {
		try {
			Field f = target.getClass().getDeclaredField(name);
			f.setAccessible(true);
			return (T) f.get(target);
		} catch (ReflectiveOperationException e) {
			throw new AssertionError("Failed to read field: " + name, e);
		}
	}

	static Element<?, ?> head(AnchoredHashMap<?, ?> m) {
		return field(m, "head");
	}

	static Anchor<?, ?>[] buckets(AnchoredHashMap<?, ?> m) {
		return field(m, "buckets");
	}

	static void assertWellFormed(AnchoredHashMap<?, ?> m) {
		Element<?, ?> head = head(m);
		Anchor<?, ?>[] buckets = buckets(m);
		int n = buckets.length;
		assertTrue(n >= 1 && (n & (n - 1)) == 0, "bucket count must be a power of two: " + n);

		Set<Element<?, ?>> positions = Collections.newSetFromMap(new IdentityHashMap<>());
		positions.add(head);
		int chainLength = 0;
		for (Element<?, ?> e = head.next; e != null; e = e.next) {
			assertTrue(positions.add(e), "cycle in element chain");
			chainLength++;
		}
		assertEquals(m.size(), chainLength, "size must match chain length");

		Map<Element<?, ?>, Anchor<?, ?>> anchorOf = new IdentityHashMap<>();
		for (int b = 0; b < n; b++) {
			for (Anchor<?, ?> a = buckets[b]; a != null; a = a.next) {
				assertTrue(positions.contains(a.pred), "anchor targets a position outside the chain");
				Element<?, ?> e = a.pred.next;
				assertNotNull(e, "anchor targets the chain tail");
				assertEquals(b, e.hash & (n - 1), "anchor for " + e.key + " sits in the wrong bucket");
				assertNull(anchorOf.put(e, a), "element " + e.key + " has two anchors");
			}
		}
		assertEquals(chainLength, anchorOf.size(), "every element needs exactly one anchor");

		if (head.next != null) {
			assertSame(head, anchorOf.get(head.next).pred, "front element must be anchored at head");
		}
		if (n < Hashing.MAX_TABLE_SIZE) {
			assertTrue(m.size() <= n, "load factor above 1.0: size=" + m.size() + " buckets=" + n);
		}
	}
}
