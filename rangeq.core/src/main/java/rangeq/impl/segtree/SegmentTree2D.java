package rangeq.impl.segtree;

import org.jetbrains.annotations.Nullable;
import rangeq.MonoidAction;
import rangeq.Monoids;

/**
 * Sparse segment tree of segment trees over a {@code rows x cols} grid whose cells start out as {@code defaultValue}.
 * <p>
 * The outer tree splits rows, every outer node owns an inner tree over columns holding, per column,
 * the combination of that column over the node's rows. Nodes of both levels are created on first write;
 * a missing subtree stands for a block of default cells.
 * <p>
 * Rectangles are folded in tree order rather than row-major order, so the monoid should be commutative.
 */
@SuppressWarnings("unchecked")
public class SegmentTree2D<V, D> {

  static class ColumnNode {
    Object value;
    @Nullable ColumnNode left;
    @Nullable ColumnNode right;
  }

  static class RowNode {
    @Nullable ColumnNode columns;
    @Nullable RowNode left;
    @Nullable RowNode right;
  }

  private final MonoidAction<V, D> ops;
  private final int rows;
  private final int cols;
  private final V defaultValue;
  private final RowNode root = new RowNode();

  public SegmentTree2D(MonoidAction<V, D> ops, int rows, int cols, V defaultValue) {
    if (rows <= 0 || cols <= 0) {
      throw new IllegalArgumentException("grid must be non-empty: " + rows + "x" + cols);
    }
    this.ops = ops;
    this.rows = rows;
    this.cols = cols;
    this.defaultValue = defaultValue;
  }

  public int rows() {
    return rows;
  }

  public int cols() {
    return cols;
  }

  private V defaults(long count) {
    return Monoids.power(ops, defaultValue, count);
  }

  private V columnValue(@Nullable ColumnNode n, int lo, int hi, long rowSpan) {
    return n == null ? defaults(rowSpan * ((long)hi - lo + 1)) : (V)n.value;
  }

  private V columnGet(@Nullable ColumnNode n, int lo, int hi, int c, long rowSpan) {
    while (n != null && lo != hi) {
      int mid = lo + (hi - lo) / 2;
      if (c <= mid) {
        n = n.left;
        hi = mid;
      }
      else {
        n = n.right;
        lo = mid + 1;
      }
    }
    return n == null ? defaults(rowSpan) : (V)n.value;
  }

  private ColumnNode columnSet(@Nullable ColumnNode n, int lo, int hi, int c, V v, long rowSpan) {
    if (n == null) {
      n = new ColumnNode();
    }
    if (lo == hi) {
      n.value = v;
      return n;
    }
    int mid = lo + (hi - lo) / 2;
    if (c <= mid) {
      n.left = columnSet(n.left, lo, mid, c, v, rowSpan);
    }
    else {
      n.right = columnSet(n.right, mid + 1, hi, c, v, rowSpan);
    }
    n.value = ops.combine(columnValue(n.left, lo, mid, rowSpan), columnValue(n.right, mid + 1, hi, rowSpan));
    return n;
  }

  private V columnQuery(@Nullable ColumnNode n, int lo, int hi, int c1, int c2, long rowSpan) {
    if (n == null) {
      return defaults(rowSpan * ((long)c2 - c1 + 1));
    }
    if (lo == c1 && hi == c2) {
      return (V)n.value;
    }
    int mid = lo + (hi - lo) / 2;
    if (c2 <= mid) {
      return columnQuery(n.left, lo, mid, c1, c2, rowSpan);
    }
    if (c1 > mid) {
      return columnQuery(n.right, mid + 1, hi, c1, c2, rowSpan);
    }
    return ops.combine(columnQuery(n.left, lo, mid, c1, mid, rowSpan),
                       columnQuery(n.right, mid + 1, hi, mid + 1, c2, rowSpan));
  }

  private V rowColumn(@Nullable RowNode n, int lo, int hi, int c) {
    long rowSpan = (long)hi - lo + 1;
    return n == null ? defaults(rowSpan) : columnGet(n.columns, 0, cols - 1, c, rowSpan);
  }

  private void update(RowNode n, int lo, int hi, int r, int c, D d) {
    if (lo == hi) {
      V old = columnGet(n.columns, 0, cols - 1, c, 1);
      n.columns = columnSet(n.columns, 0, cols - 1, c, ops.apply(old, d, 1), 1);
      return;
    }
    int mid = lo + (hi - lo) / 2;
    if (r <= mid) {
      if (n.left == null) {
        n.left = new RowNode();
      }
      update(n.left, lo, mid, r, c, d);
    }
    else {
      if (n.right == null) {
        n.right = new RowNode();
      }
      update(n.right, mid + 1, hi, r, c, d);
    }
    V merged = ops.combine(rowColumn(n.left, lo, mid, c), rowColumn(n.right, mid + 1, hi, c));
    n.columns = columnSet(n.columns, 0, cols - 1, c, merged, (long)hi - lo + 1);
  }

  private V query(@Nullable RowNode n, int lo, int hi, int r1, int r2, int c1, int c2) {
    if (n == null) {
      return defaults(((long)r2 - r1 + 1) * ((long)c2 - c1 + 1));
    }
    if (lo == r1 && hi == r2) {
      return columnQuery(n.columns, 0, cols - 1, c1, c2, (long)hi - lo + 1);
    }
    int mid = lo + (hi - lo) / 2;
    if (r2 <= mid) {
      return query(n.left, lo, mid, r1, r2, c1, c2);
    }
    if (r1 > mid) {
      return query(n.right, mid + 1, hi, r1, r2, c1, c2);
    }
    return ops.combine(query(n.left, lo, mid, r1, mid, c1, c2),
                       query(n.right, mid + 1, hi, mid + 1, r2, c1, c2));
  }

  private void checkCell(int r, int c) {
    if (r < 0 || r >= rows || c < 0 || c >= cols) {
      throw new IndexOutOfBoundsException("cell (" + r + ", " + c + ") out of " + rows + "x" + cols);
    }
  }

  /**
   * {@code cell(r, c) = apply(cell(r, c), d, 1)}.
   */
  public void update(int r, int c, D d) {
    checkCell(r, c);
    update(root, 0, rows - 1, r, c, d);
  }

  public V get(int r, int c) {
    return query(r, c, r, c);
  }

  /**
   * Combination of every cell in rows {@code r1..r2} and columns {@code c1..c2}, bounds inclusive.
   */
  public V query(int r1, int c1, int r2, int c2) {
    checkCell(r1, c1);
    checkCell(r2, c2);
    if (r1 > r2 || c1 > c2) {
      throw new IndexOutOfBoundsException("empty rectangle (" + r1 + ", " + c1 + ")-(" + r2 + ", " + c2 + ")");
    }
    return query(root, 0, rows - 1, r1, r2, c1, c2);
  }
}
