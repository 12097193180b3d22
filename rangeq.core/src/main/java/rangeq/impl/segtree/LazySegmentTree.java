package rangeq.impl.segtree;

import rangeq.MonoidAction;
import rangeq.sequence.RangeUpdate;
import rangeq.sequence.Ranges;

import java.util.Collections;
import java.util.List;

/**
 * Segment tree with lazy range updates.
 * <p>
 * A pending node's stored value already includes its pending delta; its children's values do not,
 * until {@link #pushDelta} hands the delta down one level.
 */
@SuppressWarnings("unchecked")
public class LazySegmentTree<V, D> implements RangeUpdate<V, D> {

  private final MonoidAction<V, D> ops;
  private final int len;
  private final Object[] value;
  private final Object[] delta;
  private final boolean[] pending;

  public LazySegmentTree(MonoidAction<V, D> ops, int n, V v) {
    this(ops, Collections.nCopies(n, v));
  }

  public LazySegmentTree(MonoidAction<V, D> ops, List<V> values) {
    this.ops = ops;
    this.len = values.size();
    int capacity = Math.max(1, 4 * len);
    this.value = new Object[capacity];
    this.delta = new Object[capacity];
    this.pending = new boolean[capacity];
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

  private void applyDelta(int i, int nodeLen, D d) {
    value[i] = ops.apply((V)value[i], d, nodeLen);
    if (nodeLen > 1) {
      delta[i] = pending[i] ? ops.combineDeltas((D)delta[i], d) : d;
      pending[i] = true;
    }
  }

  private void pushDelta(int i, int lo, int hi) {
    if (!pending[i]) {
      return;
    }
    int mid = lo + (hi - lo) / 2;
    applyDelta(2 * i + 1, mid - lo + 1, (D)delta[i]);
    applyDelta(2 * i + 2, hi - mid, (D)delta[i]);
    delta[i] = null;
    pending[i] = false;
  }

  private V query(int i, int lo, int hi, int tgtLo, int tgtHi) {
    if (lo == tgtLo && hi == tgtHi) {
      return (V)value[i];
    }
    pushDelta(i, lo, hi);
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

  private void update(int i, int lo, int hi, int tgtLo, int tgtHi, D d) {
    if (hi < tgtLo || lo > tgtHi) {
      return;
    }
    if (tgtLo <= lo && hi <= tgtHi) {
      applyDelta(i, hi - lo + 1, d);
      return;
    }
    pushDelta(i, lo, hi);
    int mid = lo + (hi - lo) / 2;
    update(2 * i + 1, lo, mid, tgtLo, tgtHi, d);
    update(2 * i + 2, mid + 1, hi, tgtLo, tgtHi, d);
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
  public void update(int lo, int hi, D d) {
    if (Ranges.checkRange(lo, hi, len)) {
      update(0, 0, len - 1, lo, hi, d);
    }
  }
}
