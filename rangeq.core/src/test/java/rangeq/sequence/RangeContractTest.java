package rangeq.sequence;

import org.junit.jupiter.api.Test;
import rangeq.MonoidAction;
import rangeq.Monoids;
import rangeq.TestMonoids;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Every implementation checked against a flat array under random mixed operations.
 */
class RangeContractTest {

  private static <V, D> List<BiFunction<MonoidAction<V, D>, List<V>, RangeQuery<V, D>>> pointBackends() {
    List<BiFunction<MonoidAction<V, D>, List<V>, RangeQuery<V, D>>> r = new ArrayList<>();
    r.add(RangeQuery::segmentTree);
    r.add(RangeQuery::sqrtDecomposition);
    r.add(RangeUpdate::lazySegmentTree);
    r.add(RangeUpdate::iterativeSegmentTree);
    r.add(RangeUpdate::sparseSegmentTree);
    r.add(RangeUpdate::implicitTreap);
    return r;
  }

  private static <V, D> List<BiFunction<MonoidAction<V, D>, List<V>, RangeUpdate<V, D>>> rangeBackends() {
    List<BiFunction<MonoidAction<V, D>, List<V>, RangeUpdate<V, D>>> r = new ArrayList<>();
    r.add(RangeUpdate::lazySegmentTree);
    r.add(RangeUpdate::iterativeSegmentTree);
    r.add(RangeUpdate::sparseSegmentTree);
    r.add(RangeUpdate::implicitTreap);
    return r;
  }

  private static <V, D> V fold(MonoidAction<V, D> ops, List<V> ref, int lo, int hi) {
    V acc = ops.identity();
    for (int i = lo; i <= hi; i++) {
      acc = ops.combine(acc, ref.get(i));
    }
    return acc;
  }

  private static List<Long> randomLongs(Random random, int n) {
    ArrayList<Long> r = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      r.add((long)random.nextInt(200) - 100);
    }
    return r;
  }

  private static List<String> randomLetters(Random random, int n) {
    ArrayList<String> r = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      r.add(String.valueOf((char)('a' + random.nextInt(26))));
    }
    return r;
  }

  private static <V, D> void checkPointUpdates(MonoidAction<V, D> ops,
                                               List<V> initial,
                                               Random random,
                                               BiFunction<MonoidAction<V, D>, List<V>, RangeQuery<V, D>> backend,
                                               Supplier<D> deltas) {
    List<V> ref = new ArrayList<>(initial);
    RangeQuery<V, D> s = backend.apply(ops, initial);
    int n = ref.size();
    for (int step = 0; step < 400; step++) {
      int a = random.nextInt(n);
      int b = random.nextInt(n);
      int lo = Math.min(a, b);
      int hi = Math.max(a, b);
      if (random.nextBoolean()) {
        D d = deltas.get();
        s.update(a, d);
        ref.set(a, ops.apply(ref.get(a), d, 1));
      }
      else {
        assertEquals(fold(ops, ref, lo, hi), s.query(lo, hi), s.getClass().getSimpleName() + " [" + lo + ", " + hi + "]");
      }
    }
    assertEquals(ref, s.toList());
  }

  private static <V, D> void checkRangeUpdates(MonoidAction<V, D> ops,
                                               List<V> initial,
                                               Random random,
                                               BiFunction<MonoidAction<V, D>, List<V>, RangeUpdate<V, D>> backend,
                                               Supplier<D> deltas) {
    List<V> ref = new ArrayList<>(initial);
    RangeUpdate<V, D> s = backend.apply(ops, initial);
    int n = ref.size();
    for (int step = 0; step < 400; step++) {
      int a = random.nextInt(n);
      int b = random.nextInt(n);
      int lo = Math.min(a, b);
      int hi = Math.max(a, b);
      if (random.nextBoolean()) {
        D d = deltas.get();
        s.update(lo, hi, d);
        for (int i = lo; i <= hi; i++) {
          ref.set(i, ops.apply(ref.get(i), d, 1));
        }
      }
      else {
        assertEquals(fold(ops, ref, lo, hi), s.query(lo, hi), s.getClass().getSimpleName() + " [" + lo + ", " + hi + "]");
      }
    }
    for (int i = 0; i < n; i++) {
      assertEquals(ref.get(i), s.get(i));
    }
  }

  @Test
  void point_updates_match_reference() {
    Random random = new Random(17);
    for (int n : new int[]{1, 2, 5, 16, 37}) {
      for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeQuery<Long, Long>> backend : RangeContractTest.<Long, Long>pointBackends()) {
        checkPointUpdates(Monoids.sumWithAdd(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(21) - 10);
        checkPointUpdates(Monoids.minWithSet(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(200) - 100);
      }
      for (BiFunction<MonoidAction<String, String>, List<String>, RangeQuery<String, String>> backend : RangeContractTest.<String, String>pointBackends()) {
        checkPointUpdates(TestMonoids.concatWithSet(), randomLetters(random, n), random, backend,
                          () -> String.valueOf((char)('A' + random.nextInt(26))));
      }
    }
  }

  @Test
  void range_updates_match_reference() {
    Random random = new Random(42);
    for (int n : new int[]{1, 3, 8, 13, 50}) {
      for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeUpdate<Long, Long>> backend : RangeContractTest.<Long, Long>rangeBackends()) {
        checkRangeUpdates(Monoids.sumWithAdd(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(21) - 10);
        checkRangeUpdates(Monoids.sumWithSet(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(21) - 10);
        checkRangeUpdates(Monoids.maxWithAdd(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(21) - 10);
        checkRangeUpdates(Monoids.minWithSet(), randomLongs(random, n), random, backend, () -> (long)random.nextInt(21) - 10);
      }
      for (BiFunction<MonoidAction<String, String>, List<String>, RangeUpdate<String, String>> backend : RangeContractTest.<String, String>rangeBackends()) {
        checkRangeUpdates(TestMonoids.concatWithSet(), randomLetters(random, n), random, backend,
                          () -> String.valueOf((char)('A' + random.nextInt(26))));
      }
    }
  }

  @Test
  void query_splits_at_any_midpoint() {
    Random random = new Random(5);
    List<String> values = randomLetters(random, 23);
    for (BiFunction<MonoidAction<String, String>, List<String>, RangeQuery<String, String>> backend : RangeContractTest.<String, String>pointBackends()) {
      MonoidAction<String, String> ops = TestMonoids.concatWithSet();
      RangeQuery<String, String> s = backend.apply(ops, values);
      for (int lo = 0; lo < values.size(); lo++) {
        assertEquals(values.get(lo), s.query(lo, lo));
        for (int hi = lo + 1; hi < values.size(); hi++) {
          String whole = s.query(lo, hi);
          for (int m = lo; m < hi; m++) {
            assertEquals(whole, ops.combine(s.query(lo, m), s.query(m + 1, hi)));
          }
        }
      }
    }
  }

  @Test
  void neutral_delta_changes_nothing() {
    List<Long> values = List.of(6L, -2L, 1L, 8L, 10L);
    for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeUpdate<Long, Long>> backend : RangeContractTest.<Long, Long>rangeBackends()) {
      MonoidAction<Long, Long> ops = Monoids.sumWithAdd();
      RangeUpdate<Long, Long> s = backend.apply(ops, values);
      s.update(0, 4, ops.neutralDelta());
      s.update(2, ops.neutralDelta());
      assertEquals(values, s.toList());
    }
    for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeQuery<Long, Long>> backend : RangeContractTest.<Long, Long>pointBackends()) {
      MonoidAction<Long, Long> ops = Monoids.minWithSet();
      RangeQuery<Long, Long> s = backend.apply(ops, values);
      s.update(3, ops.neutralDelta());
      assertEquals(values, s.toList());
    }
  }

  @Test
  void empty_range_folds_to_identity_and_bad_ranges_fail() {
    List<Long> values = List.of(1L, 2L, 3L);
    for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeQuery<Long, Long>> backend : RangeContractTest.<Long, Long>pointBackends()) {
      RangeQuery<Long, Long> s = backend.apply(Monoids.sumWithAdd(), values);
      assertEquals(0L, s.query(2, 1));
      assertEquals(0L, s.query(3, 2));
      assertThrows(IndexOutOfBoundsException.class, () -> s.get(3));
      assertThrows(IndexOutOfBoundsException.class, () -> s.get(-1));
      assertThrows(IndexOutOfBoundsException.class, () -> s.query(-1, 1));
      assertThrows(IndexOutOfBoundsException.class, () -> s.query(0, 3));
      assertThrows(IndexOutOfBoundsException.class, () -> s.query(2, 0));
      assertThrows(IndexOutOfBoundsException.class, () -> s.update(3, 1L));
      assertEquals(values, s.toList());
    }
  }

  @Test
  void zero_length_sequences_are_allowed() {
    for (BiFunction<MonoidAction<Long, Long>, List<Long>, RangeQuery<Long, Long>> backend : RangeContractTest.<Long, Long>pointBackends()) {
      RangeQuery<Long, Long> s = backend.apply(Monoids.minWithSet(), List.of());
      assertEquals(0, s.size());
      assertEquals(Long.MAX_VALUE, s.query(0, -1));
      assertThrows(IndexOutOfBoundsException.class, () -> s.get(0));
    }
  }
}
