package rangeq.impl.segtree;

import rangeq.MonoidAction;
import rangeq.sequence.RangeUpdate;
import rangeq.sequence.Ranges;

import java.util.Collections;
import java.util.List;

/**
 * Bottom-up lazy segment tree without recursion.
 * <p>
 * Leaves live at {@code [m, 2m)} where {@code m} is the smallest power of two not below the size.
 * Padded leaves hold {@code identity()} and have length 0, so deltas never touch them.
 * Unlike {@link LazySegmentTree}, a stored value here excludes the node's own pending delta.
 */
@SuppressWarnings("unchecked")
public class IterativeSegmentTree<V, D> implements RangeUpdate<V, D> {

  private final MonoidAction<V, D> ops;
  private final int size;
  private final int leaves;
  private final int height;
  private final Object[] value;
  private final Object[] delta;
  private final boolean[] pending;
  private final int[] len;

  public IterativeSegmentTree(MonoidAction<V, D> ops, int n, V v) {
    this(ops, Collections.nCopies(n, v));
  }

  public IterativeSegmentTree(MonoidAction<V, D> ops, List<V> values) {
    this.ops = ops;
    this.size = values.size();
    int h = 0;
    while ((1 << h) < size) {
      h++;
    }
    this.height = h;
    this.leaves = 1 << h;
    this.value = new Object[2 * leaves];
    this.delta = new Object[2 * leaves];
    this.pending = new boolean[2 * leaves];
    this.len = new int[2 * leaves];
    for (int i = 0; i < leaves; i++) {
      boolean present = i < size;
      value[leaves + i] = present ? values.get(i) : ops.identity();
      len[leaves + i] = present ? 1 : 0;
    }
    for (int i = leaves - 1; i >= 1; i--) {
      value[i] = ops.combine((V)value[2 * i], (V)value[2 * i + 1]);
      len[i] = len[2 * i] + len[2 * i + 1];
    }
  }

  private V effective(int i) {
    return pending[i] && len[i] > 0 ? ops.apply((V)value[i], (D)delta[i], len[i]) : (V)value[i];
  }

  private void mark(int i, D d) {
    delta[i] = pending[i] ? ops.combineDeltas((D)delta[i], d) : d;
    pending[i] = true;
  }

  // pushes every ancestor of leaf x, top-down
  private void pushPath(int x) {
    for (int h = height; h >= 1; h--) {
      int n = x >> h;
      if (pending[n]) {
        value[n] = effective(n);
        mark(2 * n, (D)delta[n]);
        mark(2 * n + 1, (D)delta[n]);
        delta[n] = null;
        pending[n] = false;
      }
    }
  }

  private void pullPath(int x) {
    for (int i = x; i > 1; i >>= 1) {
      int parent = i >> 1;
      value[parent] = ops.combine(effective(2 * parent), effective(2 * parent + 1));
    }
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public V get(int i) {
    Ranges.checkIndex(i, size);
    pushPath(leaves + i);
    return effective(leaves + i);
  }

  @Override
  public V query(int lo, int hi) {
    if (!Ranges.checkRange(lo, hi, size)) {
      return ops.identity();
    }
    int u = lo + leaves;
    int v = hi + leaves;
    pushPath(u);
    pushPath(v);
    V left = ops.identity();
    V right = ops.identity();
    for (; u <= v; u = (u + 1) >> 1, v = (v - 1) >> 1) {
      if ((u & 1) != 0) {
        left = ops.combine(left, effective(u));
      }
      if ((v & 1) == 0) {
        right = ops.combine(effective(v), right);
      }
    }
    return ops.combine(left, right);
  }

  @Override
  public void update(int lo, int hi, D d) {
    if (!Ranges.checkRange(lo, hi, size)) {
      return;
    }
    int l = lo + leaves;
    int r = hi + leaves;
    pushPath(l);
    pushPath(r);
    for (int u = l, v = r; u <= v; u = (u + 1) >> 1, v = (v - 1) >> 1) {
      if ((u & 1) != 0) {
        mark(u, d);
      }
      if ((v & 1) == 0) {
        mark(v, d);
      }
    }
    pullPath(l);
    pullPath(r);
  }
}
