package rangeq.impl.treap;

import org.jetbrains.annotations.Nullable;
import rangeq.MonoidAction;
import rangeq.sequence.RangeUpdate;
import rangeq.sequence.Ranges;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Resizable indexed sequence kept in a treap ordered by position.
 * <p>
 * Every operation is a couple of {@link #split}s followed by {@link #merge}s. A node's stored value and aggregates
 * already include its own pending delta and reversal; {@link #push} hands both down to the children together.
 * Aggregates are kept for both directions so reversal stays correct for non-commutative monoids.
 */
public class ImplicitTreap<V, D> implements RangeUpdate<V, D> {

  static class Node<V, D> {
    V value;
    V sum;
    V reversedSum;
    D delta;
    boolean pending;
    boolean reversed;
    int size = 1;
    final int priority;
    @Nullable Node<V, D> left;
    @Nullable Node<V, D> right;

    Node(V value, int priority) {
      this.value = value;
      this.sum = value;
      this.reversedSum = value;
      this.priority = priority;
    }
  }

  private final MonoidAction<V, D> ops;
  private final Random random;
  @Nullable private Node<V, D> root;

  public ImplicitTreap(MonoidAction<V, D> ops) {
    this(ops, Collections.emptyList(), new Random());
  }

  public ImplicitTreap(MonoidAction<V, D> ops, Random random) {
    this(ops, Collections.emptyList(), random);
  }

  public ImplicitTreap(MonoidAction<V, D> ops, int n, V v) {
    this(ops, Collections.nCopies(n, v), new Random());
  }

  public ImplicitTreap(MonoidAction<V, D> ops, List<V> values) {
    this(ops, values, new Random());
  }

  public ImplicitTreap(MonoidAction<V, D> ops, List<V> values, Random random) {
    this.ops = ops;
    this.random = random;
    for (V v : values) {
      pushBack(v);
    }
  }

  private static int size(@Nullable Node<?, ?> n) {
    return n == null ? 0 : n.size;
  }

  private void applyDelta(@Nullable Node<V, D> n, D d) {
    if (n == null) {
      return;
    }
    n.value = ops.apply(n.value, d, 1);
    n.sum = ops.apply(n.sum, d, n.size);
    n.reversedSum = ops.apply(n.reversedSum, d, n.size);
    n.delta = n.pending ? ops.combineDeltas(n.delta, d) : d;
    n.pending = true;
  }

  private static <V, D> void flip(@Nullable Node<V, D> n) {
    if (n == null) {
      return;
    }
    V t = n.sum;
    n.sum = n.reversedSum;
    n.reversedSum = t;
    n.reversed = !n.reversed;
  }

  private void push(@Nullable Node<V, D> n) {
    if (n == null) {
      return;
    }
    if (n.reversed) {
      Node<V, D> t = n.left;
      n.left = n.right;
      n.right = t;
      flip(n.left);
      flip(n.right);
      n.reversed = false;
    }
    if (n.pending) {
      applyDelta(n.left, n.delta);
      applyDelta(n.right, n.delta);
      n.delta = null;
      n.pending = false;
    }
  }

  private void pull(Node<V, D> n) {
    n.size = 1 + size(n.left) + size(n.right);
    V sum = n.value;
    V reversedSum = n.value;
    if (n.left != null) {
      sum = ops.combine(n.left.sum, sum);
      reversedSum = ops.combine(reversedSum, n.left.reversedSum);
    }
    if (n.right != null) {
      sum = ops.combine(sum, n.right.sum);
      reversedSum = ops.combine(n.right.reversedSum, reversedSum);
    }
    n.sum = sum;
    n.reversedSum = reversedSum;
  }

  @Nullable
  private Node<V, D> merge(@Nullable Node<V, D> l, @Nullable Node<V, D> r) {
    if (l == null) {
      return r;
    }
    if (r == null) {
      return l;
    }
    if (l.priority > r.priority) {
      push(l);
      l.right = merge(l.right, r);
      pull(l);
      return l;
    }
    else {
      push(r);
      r.left = merge(l, r.left);
      pull(r);
      return r;
    }
  }

  /**
   * Detaches the first {@code k} elements of {@code n} into {@code out[0]}, the rest into {@code out[1]}.
   */
  private void split(@Nullable Node<V, D> n, int k, Node<V, D>[] out) {
    if (n == null) {
      out[0] = null;
      out[1] = null;
      return;
    }
    push(n);
    if (k <= size(n.left)) {
      split(n.left, k, out);
      n.left = out[1];
      pull(n);
      out[1] = n;
    }
    else {
      split(n.right, k - size(n.left) - 1, out);
      n.right = out[0];
      pull(n);
      out[0] = n;
    }
  }

  @SuppressWarnings("unchecked")
  private static <V, D> Node<V, D>[] pair() {
    return (Node<V, D>[])new Node[2];
  }

  private interface MiddleOp<V, D> {
    void run(Node<V, D> middle);
  }

  // splits out [lo, hi], runs op on it, then glues the three parts back
  private void withRange(int lo, int hi, MiddleOp<V, D> op) {
    Node<V, D>[] right = pair();
    split(root, hi + 1, right);
    Node<V, D>[] left = pair();
    split(right[0], lo, left);
    Node<V, D> middle = left[1];
    assert middle != null;
    op.run(middle);
    root = merge(merge(left[0], middle), right[1]);
  }

  @Override
  public int size() {
    return size(root);
  }

  public boolean isEmpty() {
    return root == null;
  }

  /**
   * Inserts {@code v} so that it ends up at index {@code i}, shifting later elements right.
   */
  public void insert(int i, V v) {
    if (i < 0 || i > size()) {
      throw new IndexOutOfBoundsException("insert index " + i + " out of [0, " + size() + "]");
    }
    Node<V, D>[] parts = pair();
    split(root, i, parts);
    root = merge(merge(parts[0], new Node<>(v, random.nextInt())), parts[1]);
  }

  public void pushBack(V v) {
    insert(size(), v);
  }

  public void erase(int i) {
    Ranges.checkIndex(i, size());
    Node<V, D>[] right = pair();
    split(root, i + 1, right);
    Node<V, D>[] left = pair();
    split(right[0], i, left);
    root = merge(left[0], right[1]);
  }

  public void popBack() {
    erase(size() - 1);
  }

  @Override
  public V get(int i) {
    Ranges.checkIndex(i, size());
    Node<V, D> n = root;
    while (true) {
      assert n != null;
      push(n);
      int leftSize = size(n.left);
      if (i < leftSize) {
        n = n.left;
      }
      else if (i > leftSize) {
        i -= leftSize + 1;
        n = n.right;
      }
      else {
        return n.value;
      }
    }
  }

  @Override
  public V query(int lo, int hi) {
    if (!Ranges.checkRange(lo, hi, size())) {
      return ops.identity();
    }
    Object[] result = new Object[1];
    withRange(lo, hi, middle -> result[0] = middle.sum);
    @SuppressWarnings("unchecked") V v = (V)result[0];
    return v;
  }

  @Override
  public void update(int lo, int hi, D d) {
    if (Ranges.checkRange(lo, hi, size())) {
      withRange(lo, hi, middle -> applyDelta(middle, d));
    }
  }

  /**
   * Reverses the order of elements {@code lo..hi}.
   */
  public void reverse(int lo, int hi) {
    if (Ranges.checkRange(lo, hi, size())) {
      withRange(lo, hi, ImplicitTreap::flip);
    }
  }

  public void forEach(Consumer<? super V> consumer) {
    forEach(root, consumer);
  }

  private void forEach(@Nullable Node<V, D> n, Consumer<? super V> consumer) {
    if (n == null) {
      return;
    }
    push(n);
    forEach(n.left, consumer);
    consumer.accept(n.value);
    forEach(n.right, consumer);
  }

  @Override
  public List<V> toList() {
    ArrayList<V> list = new ArrayList<>(size());
    forEach(list::add);
    return list;
  }
}
