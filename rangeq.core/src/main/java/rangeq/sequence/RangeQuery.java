package rangeq.sequence;

import rangeq.MonoidAction;
import rangeq.impl.segtree.SegmentTree;
import rangeq.impl.segtree.SqrtDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * A fixed-size indexed sequence {@code a[0..size-1]} supporting point updates and range folds.
 */
public interface RangeQuery<V, D> {

  static <V, D> RangeQuery<V, D> segmentTree(MonoidAction<V, D> ops, List<V> values) {
    return new SegmentTree<>(ops, values);
  }

  static <V, D> RangeQuery<V, D> sqrtDecomposition(MonoidAction<V, D> ops, List<V> values) {
    return new SqrtDecomposition<>(ops, values);
  }

  int size();

  V get(int i);

  /**
   * {@code combine(a[lo], ..., a[hi])}; identity for the empty range {@code lo == hi + 1}.
   */
  V query(int lo, int hi);

  /**
   * {@code a[i] = apply(a[i], d, 1)}.
   */
  void update(int i, D d);

  default List<V> toList() {
    ArrayList<V> list = new ArrayList<>(size());
    for (int i = 0; i < size(); i++) {
      list.add(get(i));
    }
    return list;
  }
}
