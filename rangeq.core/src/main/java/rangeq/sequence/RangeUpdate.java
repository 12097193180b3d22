package rangeq.sequence;

import rangeq.MonoidAction;
import rangeq.impl.segtree.IterativeSegmentTree;
import rangeq.impl.segtree.LazySegmentTree;
import rangeq.impl.segtree.SparseSegmentTree;
import rangeq.impl.treap.ImplicitTreap;

import java.util.List;

/**
 * {@link RangeQuery} with lazily propagated range updates.
 */
public interface RangeUpdate<V, D> extends RangeQuery<V, D> {

  static <V, D> RangeUpdate<V, D> lazySegmentTree(MonoidAction<V, D> ops, List<V> values) {
    return new LazySegmentTree<>(ops, values);
  }

  static <V, D> RangeUpdate<V, D> iterativeSegmentTree(MonoidAction<V, D> ops, List<V> values) {
    return new IterativeSegmentTree<>(ops, values);
  }

  static <V, D> RangeUpdate<V, D> sparseSegmentTree(MonoidAction<V, D> ops, List<V> values) {
    return new SparseSegmentTree<>(ops, values);
  }

  static <V, D> RangeUpdate<V, D> implicitTreap(MonoidAction<V, D> ops, List<V> values) {
    return new ImplicitTreap<>(ops, values);
  }

  /**
   * {@code a[i] = apply(a[i], d, 1)} for every {@code lo <= i <= hi}; no-op for the empty range.
   */
  void update(int lo, int hi, D d);

  @Override
  default void update(int i, D d) {
    update(i, i, d);
  }
}
