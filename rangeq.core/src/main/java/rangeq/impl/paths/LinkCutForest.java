package rangeq.impl.paths;

import io.lacuna.bifurcan.IntMap;
import org.jetbrains.annotations.Nullable;
import rangeq.MonoidAction;

import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forest of rooted trees with dynamic topology and path queries, nodes labelled by arbitrary {@code long} ids.
 * <p>
 * Every preferred path is a splay tree keyed by depth. The topmost node of a path has no splay parent; instead its
 * splay root carries a {@code pathParent} pointing to the parent of that topmost node in the represented tree.
 * Stored values and aggregates of a splay node already include its own pending delta and reversal.
 * All operations take O(log n) amortized time.
 */
public class LinkCutForest<V, D> {
  private static final Logger LOG = Logger.getLogger(LinkCutForest.class.getName());

  static class Node<V, D> {
    final long id;
    V value;
    V sum;
    V reversedSum;
    D delta;
    boolean pending;
    boolean reversed;
    int size = 1;
    @Nullable Node<V, D> left;
    @Nullable Node<V, D> right;
    @Nullable Node<V, D> parent;
    @Nullable Node<V, D> pathParent;

    Node(long id, V value) {
      this.id = id;
      this.value = value;
      this.sum = value;
      this.reversedSum = value;
    }
  }

  private final MonoidAction<V, D> ops;
  private IntMap<Node<V, D>> nodes = new IntMap<Node<V, D>>().linear();
  private int trees = 0;

  public LinkCutForest(MonoidAction<V, D> ops) {
    this.ops = ops;
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

  private void push(Node<V, D> n) {
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
    n.size = 1;
    V sum = n.value;
    V reversedSum = n.value;
    if (n.left != null) {
      n.size += n.left.size;
      sum = ops.combine(n.left.sum, sum);
      reversedSum = ops.combine(reversedSum, n.left.reversedSum);
    }
    if (n.right != null) {
      n.size += n.right.size;
      sum = ops.combine(sum, n.right.sum);
      reversedSum = ops.combine(n.right.reversedSum, reversedSum);
    }
    n.sum = sum;
    n.reversedSum = reversedSum;
  }

  private void rotate(Node<V, D> x) {
    Node<V, D> p = x.parent;
    assert p != null;
    Node<V, D> g = p.parent;
    if (p.left == x) {
      p.left = x.right;
      if (x.right != null) {
        x.right.parent = p;
      }
      x.right = p;
    }
    else {
      p.right = x.left;
      if (x.left != null) {
        x.left.parent = p;
      }
      x.left = p;
    }
    p.parent = x;
    x.parent = g;
    if (g != null) {
      if (g.left == p) {
        g.left = x;
      }
      else {
        g.right = x;
      }
    }
    x.pathParent = p.pathParent;
    p.pathParent = null;
    pull(p);
    pull(x);
  }

  private void splay(Node<V, D> x) {
    ArrayList<Node<V, D>> path = new ArrayList<>();
    for (Node<V, D> n = x; n != null; n = n.parent) {
      path.add(n);
    }
    for (int i = path.size() - 1; i >= 0; i--) {
      push(path.get(i));
    }
    while (x.parent != null) {
      Node<V, D> p = x.parent;
      Node<V, D> g = p.parent;
      if (g != null) {
        rotate((g.left == p) == (p.left == x) ? p : x);
      }
      rotate(x);
    }
  }

  private void detachRight(Node<V, D> n) {
    Node<V, D> r = n.right;
    if (r != null) {
      r.parent = null;
      r.pathParent = n;
      n.right = null;
      pull(n);
    }
  }

  // afterwards v is the splay root of the preferred path from the tree root down to v, with nothing below v
  private void access(Node<V, D> v) {
    splay(v);
    detachRight(v);
    while (v.pathParent != null) {
      Node<V, D> w = v.pathParent;
      splay(w);
      detachRight(w);
      w.right = v;
      v.parent = w;
      v.pathParent = null;
      pull(w);
      splay(v);
    }
  }

  private void makeRoot(Node<V, D> v) {
    access(v);
    flip(v);
  }

  private Node<V, D> node(long id) {
    Node<V, D> n = nodes.get(id, null);
    if (n == null) {
      throw new IllegalArgumentException("node " + id + " does not exist in the forest");
    }
    return n;
  }

  private boolean connected(Node<V, D> u, Node<V, D> v) {
    return u == v || findRoot(u) == findRoot(v);
  }

  private Node<V, D> findRoot(Node<V, D> v) {
    access(v);
    Node<V, D> r = v;
    push(r);
    while (r.left != null) {
      r = r.left;
      push(r);
    }
    splay(r);
    return r;
  }

  private void exposePath(Node<V, D> u, Node<V, D> v) {
    if (!connected(u, v)) {
      throw new IllegalArgumentException("nodes " + u.id + " and " + v.id + " are not connected");
    }
    makeRoot(u);
    access(v);
  }

  public int size() {
    return (int)nodes.size();
  }

  public int trees() {
    return trees;
  }

  public boolean contains(long id) {
    return nodes.contains(id);
  }

  /**
   * Adds a new single-node tree.
   */
  public void addNode(long id, V value) {
    if (nodes.contains(id)) {
      throw new IllegalArgumentException("node " + id + " already exists in the forest");
    }
    nodes = nodes.put(id, new Node<>(id, value));
    trees++;
  }

  public V get(long id) {
    Node<V, D> n = node(id);
    splay(n);
    return n.value;
  }

  public boolean connected(long a, long b) {
    return connected(node(a), node(b));
  }

  /**
   * Adds the edge {@code a - b}; the two nodes must be in different trees.
   */
  public void link(long a, long b) {
    Node<V, D> u = node(a);
    Node<V, D> v = node(b);
    if (connected(u, v)) {
      throw new IllegalArgumentException("nodes " + a + " and " + b + " are already connected");
    }
    makeRoot(u);
    u.pathParent = v;
    trees--;
    if (LOG.isLoggable(Level.FINEST)) {
      LOG.finest("linked " + a + " - " + b + ", " + trees + " trees");
    }
  }

  /**
   * Removes the edge {@code a - b}, which must exist.
   */
  public void cut(long a, long b) {
    Node<V, D> u = node(a);
    Node<V, D> v = node(b);
    if (u == v) {
      throw new IllegalArgumentException("no edge between " + a + " and itself");
    }
    makeRoot(u);
    access(v);
    if (v.left != u) {
      throw new IllegalArgumentException("no edge between " + a + " and " + b);
    }
    push(u);
    if (u.right != null) {
      throw new IllegalArgumentException("no edge between " + a + " and " + b);
    }
    v.left = null;
    u.parent = null;
    pull(v);
    trees++;
    if (LOG.isLoggable(Level.FINEST)) {
      LOG.finest("cut " + a + " - " + b + ", " + trees + " trees");
    }
  }

  /**
   * Combination of node values along the path from {@code a} to {@code b}, in path order.
   */
  public V query(long a, long b) {
    Node<V, D> v = node(b);
    exposePath(node(a), v);
    return v.sum;
  }

  /**
   * Applies {@code d} to every node on the path between {@code a} and {@code b}.
   */
  public void update(long a, long b, D d) {
    Node<V, D> v = node(b);
    exposePath(node(a), v);
    applyDelta(v, d);
  }
}
