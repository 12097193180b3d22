package rangeq.impl.segtree;

import org.jetbrains.annotations.Nullable;
import rangeq.MonoidAction;
import rangeq.Monoids;
import rangeq.sequence.RangeUpdate;
import rangeq.sequence.Ranges;

import java.util.List;

/**
 * Lazy range-update segment tree whose nodes are created on first touch, so a sequence of up to
 * {@code Integer.MAX_VALUE} elements costs memory only for the parts that were written.
 * <p>
 * A missing node stands for a run of {@code defaultValue}; its combined value is folded by repeated squaring.
 * As in {@link LazySegmentTree}, a pending node's stored value already includes its pending delta.
 */
@SuppressWarnings("unchecked")
public class SparseSegmentTree<V, D> implements RangeUpdate<V, D> {

  static class Node {
    Object value;
    Object delta;
    boolean pending;
    @Nullable Node left;
    @Nullable Node right;

    Node(Object value) {
      this.value = value;
    }
  }

  private final MonoidAction<V, D> ops;
  private final int len;
  private final V defaultValue;
  @Nullable private Node root;

  public SparseSegmentTree(MonoidAction<V, D> ops, int n, V defaultValue) {
    if (n < 0) {
      throw new IllegalArgumentException("negative size: " + n);
    }
    this.ops = ops;
    this.len = n;
    this.defaultValue = defaultValue;
  }

  /**
   * Builds every node up front; mostly useful when the values are not one repeated default.
   */
  public SparseSegmentTree(MonoidAction<V, D> ops, List<V> values) {
    this(ops, values.size(), ops.identity());
    if (len > 0) {
      root = build(0, len - 1, values);
    }
  }

  private Node build(int lo, int hi, List<V> values) {
    if (lo == hi) {
      return new Node(values.get(lo));
    }
    int mid = lo + (hi - lo) / 2;
    Node n = new Node(null);
    n.left = build(lo, mid, values);
    n.right = build(mid + 1, hi, values);
    n.value = ops.combine((V)n.left.value, (V)n.right.value);
    return n;
  }

  private V defaults(int count) {
    return Monoids.power(ops, defaultValue, count);
  }

  private V valueOf(@Nullable Node n, int lo, int hi) {
    return n == null ? defaults(hi - lo + 1) : (V)n.value;
  }

  private Node materialize(@Nullable Node n, int lo, int hi) {
    return n == null ? new Node(defaults(hi - lo + 1)) : n;
  }

  private void applyDelta(Node n, int nodeLen, D d) {
    n.value = ops.apply((V)n.value, d, nodeLen);
    if (nodeLen > 1) {
      n.delta = n.pending ? ops.combineDeltas((D)n.delta, d) : d;
      n.pending = true;
    }
  }

  private void pushDelta(Node n, int lo, int hi) {
    if (!n.pending) {
      return;
    }
    int mid = lo + (hi - lo) / 2;
    n.left = materialize(n.left, lo, mid);
    n.right = materialize(n.right, mid + 1, hi);
    applyDelta(n.left, mid - lo + 1, (D)n.delta);
    applyDelta(n.right, hi - mid, (D)n.delta);
    n.delta = null;
    n.pending = false;
  }

  private V query(@Nullable Node n, int lo, int hi, int tgtLo, int tgtHi) {
    if (n == null) {
      return defaults(tgtHi - tgtLo + 1);
    }
    if (lo == tgtLo && hi == tgtHi) {
      return (V)n.value;
    }
    pushDelta(n, lo, hi);
    int mid = lo + (hi - lo) / 2;
    if (tgtHi <= mid) {
      return query(n.left, lo, mid, tgtLo, tgtHi);
    }
    if (tgtLo > mid) {
      return query(n.right, mid + 1, hi, tgtLo, tgtHi);
    }
    return ops.combine(query(n.left, lo, mid, tgtLo, mid),
                       query(n.right, mid + 1, hi, mid + 1, tgtHi));
  }

  private Node update(@Nullable Node n, int lo, int hi, int tgtLo, int tgtHi, D d) {
    n = materialize(n, lo, hi);
    if (tgtLo <= lo && hi <= tgtHi) {
      applyDelta(n, hi - lo + 1, d);
      return n;
    }
    pushDelta(n, lo, hi);
    int mid = lo + (hi - lo) / 2;
    if (tgtLo <= mid) {
      n.left = update(n.left, lo, mid, tgtLo, tgtHi, d);
    }
    if (tgtHi > mid) {
      n.right = update(n.right, mid + 1, hi, tgtLo, tgtHi, d);
    }
    n.value = ops.combine(valueOf(n.left, lo, mid), valueOf(n.right, mid + 1, hi));
    return n;
  }

  @Override
  public int size() {
    return len;
  }

  @Override
  public V get(int i) {
    Ranges.checkIndex(i, len);
    return query(root, 0, len - 1, i, i);
  }

  @Override
  public V query(int lo, int hi) {
    if (!Ranges.checkRange(lo, hi, len)) {
      return ops.identity();
    }
    return query(root, 0, len - 1, lo, hi);
  }

  @Override
  public void update(int lo, int hi, D d) {
    if (Ranges.checkRange(lo, hi, len)) {
      root = update(root, 0, len - 1, lo, hi, d);
    }
  }
}
