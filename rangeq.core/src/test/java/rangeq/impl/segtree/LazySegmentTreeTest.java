package rangeq.impl.segtree;

import org.junit.jupiter.api.Test;
import rangeq.Monoids;
import rangeq.sequence.RangeUpdate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LazySegmentTreeTest {

  private static void maxWithSetScenario(RangeUpdate<Long, Long> t) {
    t.update(2, 4L);
    assertEquals(List.of(6L, -2L, 4L, 8L, 10L), t.toList());
    assertEquals(8L, t.query(0, 3));
    t.update(0, 4, -5L);
    t.update(3, 3, 2L);
    t.update(3, 3, 1L);
    assertEquals(List.of(-5L, -5L, -5L, 1L, -5L), t.toList());
    assertEquals(1L, t.query(0, 3));
    assertEquals(-5L, t.query(4, 4));
  }

  @Test
  void max_with_set_recursive() {
    maxWithSetScenario(new LazySegmentTree<>(Monoids.maxWithSet(), List.of(6L, -2L, 1L, 8L, 10L)));
  }

  @Test
  void max_with_set_iterative() {
    maxWithSetScenario(new IterativeSegmentTree<>(Monoids.maxWithSet(), List.of(6L, -2L, 1L, 8L, 10L)));
  }

  @Test
  void sum_with_add_scales_by_segment_length() {
    LazySegmentTree<Long, Long> t = new LazySegmentTree<>(Monoids.sumWithAdd(), 10, 0L);
    t.update(0, 9, 1L);
    t.update(3, 6, 10L);
    assertEquals(50L, t.query(0, 9));
    assertEquals(23L, t.query(2, 4));
    assertEquals(11L, t.get(5));
  }

  @Test
  void padded_leaves_stay_out_of_sums() {
    // 5 elements are padded to 8 leaves, the padding must not absorb deltas
    IterativeSegmentTree<Long, Long> t = new IterativeSegmentTree<>(Monoids.sumWithSet(), 5, 1L);
    t.update(0, 4, 3L);
    assertEquals(15L, t.query(0, 4));
    t.update(1, 2, 0L);
    assertEquals(9L, t.query(0, 4));
    assertEquals(0L, t.query(1, 2));
  }

  @Test
  void update_on_empty_range_is_a_no_op() {
    LazySegmentTree<Long, Long> t = new LazySegmentTree<>(Monoids.sumWithAdd(), 3, 2L);
    t.update(1, 0, 100L);
    assertEquals(6L, t.query(0, 2));
    assertThrows(IndexOutOfBoundsException.class, () -> t.update(1, 3, 1L));
    assertEquals(6L, t.query(0, 2));
  }

  @Test
  void min_with_add_keeps_values_equal_to_the_identity() {
    LazySegmentTree<Long, Long> t = new LazySegmentTree<>(Monoids.minWithAdd(), List.of(Long.MAX_VALUE - 1, 0L));
    t.update(0, 0, 1L);
    assertEquals(Long.MAX_VALUE, t.get(0));
    t.update(0, 0, -1L);
    assertEquals(Long.MAX_VALUE - 1, t.get(0));

    IterativeSegmentTree<Long, Long> it = new IterativeSegmentTree<>(Monoids.minWithAdd(), List.of(Long.MAX_VALUE - 1, 5L, 7L));
    it.update(0, 0, 1L);
    it.update(0, 2, -1L);
    assertEquals(List.of(Long.MAX_VALUE - 1, 4L, 6L), it.toList());
    assertEquals(4L, it.query(0, 2));
  }
}
