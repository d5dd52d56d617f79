package io.github.bluuewhale.anchormap;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * AnchoredHashMap against HashMap and LinkedHashMap, the JDK map with the closest node layout.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "100", "1000", "10000" })
		int size;

		AnchoredHashMap<Integer, Integer> anchored;
		LinkedHashMap<Integer, Integer> linked;
		HashMap<Integer, Integer> jdk;
		int[] keys;
		int[] misses;
		Random rnd;

		@Setup(Level.Trial)
		public void setup() {
			rnd = new Random(123);
			keys = new int[size];
			misses = new int[size];
			var keySet = new HashSet<Integer>(size * 2);
			for (int i = 0; i < size; i++) {
				int k = rnd.nextInt();
				keys[i] = k;
				keySet.add(k);
			}
			for (int i = 0; i < size; i++) {
				int miss;
				do { miss = rnd.nextInt(); } while (keySet.contains(miss));
				misses[i] = miss;
			}
			anchored = new AnchoredHashMap<>();
			linked = new LinkedHashMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				anchored.insert(keys[i], i);
				linked.put(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		int nextKey() { return keys[rnd.nextInt(keys.length)]; }
		int nextMiss() { return misses[rnd.nextInt(misses.length)]; }
	}

	@State(Scope.Thread)
	public static class InsertState {
		@Param({ "100", "1000", "10000" })
		int size;

		int[] keys;

		@Setup(Level.Trial)
		public void initKeys() {
			var rnd = new Random(456);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
		}
	}

	@State(Scope.Thread)
	public static class EraseState {
		@Param({ "100", "1000", "10000" })
		int size;

		AnchoredHashMap<Integer, Integer> anchored;
		LinkedHashMap<Integer, Integer> linked;
		HashMap<Integer, Integer> jdk;
		int[] keys;
		Random rnd;

		@Setup(Level.Trial)
		public void initData() {
			rnd = new Random(789);
			keys = IntStream.range(0, size).map(i -> rnd.nextInt()).toArray();
			anchored = new AnchoredHashMap<>();
			linked = new LinkedHashMap<>();
			jdk = new HashMap<>();
			for (int i = 0; i < size; i++) {
				anchored.insert(keys[i], i);
				linked.put(keys[i], i);
				jdk.put(keys[i], i);
			}
		}

		int hitKey() { return keys[rnd.nextInt(keys.length)]; }
	}

	// ------- find hit/miss -------
	@Benchmark
	public int anchoredFindHit(ReadState s) {
		return s.anchored.find(s.nextKey()).getValue();
	}

	@Benchmark
	public int linkedGetHit(ReadState s) {
		return s.linked.get(s.nextKey());
	}

	@Benchmark
	public int jdkGetHit(ReadState s) {
		return s.jdk.get(s.nextKey());
	}

	@Benchmark
	public int anchoredFindMiss(ReadState s) {
		var e = s.anchored.find(s.nextMiss());
		return e == null ? -1 : e.getValue();
	}

	@Benchmark
	public int jdkGetMiss(ReadState s) {
		Integer v = s.jdk.get(s.nextMiss());
		return v == null ? -1 : v;
	}

	// ------- iterate -------
	@Benchmark
	public long anchoredIterate(ReadState s) {
		long sum = 0;
		for (var e : s.anchored.entrySet()) sum += e.getValue();
		return sum;
	}

	@Benchmark
	public long linkedIterate(ReadState s) {
		long sum = 0;
		for (var e : s.linked.entrySet()) sum += e.getValue();
		return sum;
	}

	@Benchmark
	public long jdkIterate(ReadState s) {
		long sum = 0;
		for (var e : s.jdk.entrySet()) sum += e.getValue();
		return sum;
	}

	// ------- populate from one bucket (includes every rehash) -------
	@Benchmark
	public int anchoredPopulate(InsertState s) {
		var m = new AnchoredHashMap<Integer, Integer>();
		for (int i = 0; i < s.keys.length; i++) m.insert(s.keys[i], i);
		return m.bucketCount();
	}

	@Benchmark
	public int linkedPopulate(InsertState s) {
		var m = new LinkedHashMap<Integer, Integer>(1);
		for (int i = 0; i < s.keys.length; i++) m.putIfAbsent(s.keys[i], i);
		return m.size();
	}

	@Benchmark
	public int jdkPopulate(InsertState s) {
		var m = new HashMap<Integer, Integer>(1);
		for (int i = 0; i < s.keys.length; i++) m.putIfAbsent(s.keys[i], i);
		return m.size();
	}

	// ------- erase + reinsert (keeps size stable across invocations) -------
	@Benchmark
	public boolean anchoredEraseReinsert(EraseState s) {
		int k = s.hitKey();
		s.anchored.erase(k);
		return s.anchored.insert(k, k);
	}

	@Benchmark
	public Integer linkedRemoveReinsert(EraseState s) {
		int k = s.hitKey();
		s.linked.remove(k);
		return s.linked.put(k, k);
	}

	@Benchmark
	public Integer jdkRemoveReinsert(EraseState s) {
		int k = s.hitKey();
		s.jdk.remove(k);
		return s.jdk.put(k, k);
	}
}
