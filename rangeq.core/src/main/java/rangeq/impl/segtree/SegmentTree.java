package rangeq.impl.segtree;

import rangeq.MonoidAction;
import rangeq.sequence.RangeQuery;
import rangeq.sequence.Ranges;

import java.util.Collections;
import java.util.List;

/**
 * Point-update segment tree laid out as an implicit heap: node {@code i} has children {@code 2i+1} and {@code 2i+2}.
 * Left child covers {@code [lo, mid]}, right child {@code [mid+1, hi]}.
 */
@SuppressWarnings("unchecked")
public class SegmentTree<V, D> implements RangeQuery<V, D> {

  private final MonoidAction<V, D> ops;
  private final int len;
  private final Object[] value;

  public SegmentTree(MonoidAction<V, D> ops, int n, V v) {
    this(ops, Collections.nCopies(n, v));
  }

  public SegmentTree(MonoidAction<V, D> ops, List<V> values) {
    this.ops = ops;
    this.len = values.size();
    this.value = new Object[Math.max(1, 4 * len)];
    if (len > 0) {
      build(0, 0, len - 1, values);
    }
  }

  private void build(int i, int lo, int hi, List<V> values) {
    if (lo == hi) {
      value[i] = values.get(lo);
      return;
    }
    int mid = lo + (hi - lo) / 2;
    build(2 * i + 1, lo, mid, values);
    build(2 * i + 2, mid + 1, hi, values);
    value[i] = ops.combine((V)value[2 * i + 1], (V)value[2 * i + 2]);
  }

  private V query(int i, int lo, int hi, int tgtLo, int tgtHi) {
    if (lo == tgtLo && hi == tgtHi) {
      return (V)value[i];
    }
    int mid = lo + (hi - lo) / 2;
    if (tgtHi <= mid) {
      return query(2 * i + 1, lo, mid, tgtLo, tgtHi);
    }
    if (tgtLo > mid) {
      return query(2 * i + 2, mid + 1, hi, tgtLo, tgtHi);
    }
    return ops.combine(query(2 * i + 1, lo, mid, tgtLo, mid),
                       query(2 * i + 2, mid + 1, hi, mid + 1, tgtHi));
  }

  private void update(int i, int lo, int hi, int target, D d) {
    if (target < lo || target > hi) {
      return;
    }
    if (lo == hi) {
      value[i] = ops.apply((V)value[i], d, 1);
      return;
    }
    int mid = lo + (hi - lo) / 2;
    update(2 * i + 1, lo, mid, target, d);
    update(2 * i + 2, mid + 1, hi, target, d);
    value[i] = ops.combine((V)value[2 * i + 1], (V)value[2 * i + 2]);
  }

  @Override
  public int size() {
    return len;
  }

  @Override
  public V get(int i) {
    Ranges.checkIndex(i, len);
    return query(0, 0, len - 1, i, i);
  }

  @Override
  public V query(int lo, int hi) {
    if (!Ranges.checkRange(lo, hi, len)) {
      return ops.identity();
    }
    return query(0, 0, len - 1, lo, hi);
  }

  @Override
  public void update(int i, D d) {
    Ranges.checkIndex(i, len);
    update(0, 0, len - 1, i, d);
  }
}
