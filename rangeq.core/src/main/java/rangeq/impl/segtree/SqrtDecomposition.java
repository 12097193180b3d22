package rangeq.impl.segtree;

import rangeq.MonoidAction;
import rangeq.sequence.RangeQuery;
import rangeq.sequence.Ranges;

import java.util.Collections;
import java.util.List;

/**
 * Array split into blocks of {@code blockLength} elements, each with a cached aggregate.
 * Query and update take O(sqrt n) with the default block length.
 */
@SuppressWarnings("unchecked")
public class SqrtDecomposition<V, D> implements RangeQuery<V, D> {

  private final MonoidAction<V, D> ops;
  private final int len;
  private final int blockLength;
  private final Object[] array;
  private final Object[] block;

  public SqrtDecomposition(MonoidAction<V, D> ops, int n, V v) {
    this(ops, Collections.nCopies(n, v));
  }

  public SqrtDecomposition(MonoidAction<V, D> ops, List<V> values) {
    this(ops, values, Math.max(1, (int)Math.sqrt(values.size())));
  }

  public SqrtDecomposition(MonoidAction<V, D> ops, List<V> values, int blockLength) {
    if (blockLength < 1) {
      throw new IllegalArgumentException("block length must be positive: " + blockLength);
    }
    this.ops = ops;
    this.len = values.size();
    this.blockLength = blockLength;
    this.array = values.toArray();
    this.block = new Object[(len + blockLength - 1) / blockLength];
    for (int b = 0; b < block.length; b++) {
      rebuild(b);
    }
  }

  private void rebuild(int b) {
    int from = b * blockLength;
    int to = Math.min(len, from + blockLength);
    V acc = ops.identity();
    for (int i = from; i < to; i++) {
      acc = ops.combine(acc, (V)array[i]);
    }
    block[b] = acc;
  }

  public int blockLength() {
    return blockLength;
  }

  @Override
  public int size() {
    return len;
  }

  @Override
  public V get(int i) {
    Ranges.checkIndex(i, len);
    return (V)array[i];
  }

  @Override
  public V query(int lo, int hi) {
    if (!Ranges.checkRange(lo, hi, len)) {
      return ops.identity();
    }
    V acc = ops.identity();
    int i = lo;
    while (i <= hi) {
      if (i % blockLength == 0 && i + blockLength - 1 <= hi) {
        acc = ops.combine(acc, (V)block[i / blockLength]);
        i += blockLength;
      }
      else {
        acc = ops.combine(acc, (V)array[i]);
        i++;
      }
    }
    return acc;
  }

  @Override
  public void update(int i, D d) {
    Ranges.checkIndex(i, len);
    array[i] = ops.apply((V)array[i], d, 1);
    rebuild(i / blockLength);
  }
}
