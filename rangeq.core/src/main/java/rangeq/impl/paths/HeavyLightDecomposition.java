package rangeq.impl.paths;

import rangeq.MonoidAction;
import rangeq.impl.segtree.LazySegmentTree;
import rangeq.impl.util.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Path queries and path updates on a static tree rooted at node 0.
 * <p>
 * The tree is split into chains of heavy edges, each chain backed by its own {@link LazySegmentTree} indexed by
 * depth below the chain root. A path touches O(log n) chains, so each operation costs O(log^2 n).
 * <p>
 * With {@code valuesOnEdges} the slot of a node holds the value of the edge to its parent and the slot of the
 * lowest common ancestor is left out of every path. Chain segments are combined in walk order, not path order,
 * so the monoid should be commutative.
 */
public class HeavyLightDecomposition<V, D> {
  private static final Logger LOG = Logger.getLogger(HeavyLightDecomposition.class.getName());

  private final MonoidAction<V, D> ops;
  private final boolean valuesOnEdges;
  private final int n;
  private final int[] parent;
  private final int[] depth;
  private final int[] subtreeSize;
  private final int[] tin;
  private final int[] chain;
  private final int[] pos;
  private final int[] chainRoot;
  private final List<LazySegmentTree<V, D>> chains;

  public static <V, D> HeavyLightDecomposition<V, D> fromEdges(MonoidAction<V, D> ops,
                                                             int n,
                                                             int[][] edges,
                                                             V v,
                                                             boolean valuesOnEdges) {
    IntArrayList[] lists = new IntArrayList[n];
    for (int i = 0; i < n; i++) {
      lists[i] = new IntArrayList(4);
    }
    for (int[] edge : edges) {
      if (edge.length != 2) {
        throw new IllegalArgumentException("edge must have two endpoints: " + edge.length);
      }
      checkNode(edge[0], n);
      checkNode(edge[1], n);
      lists[edge[0]].add(edge[1]);
      lists[edge[1]].add(edge[0]);
    }
    int[][] adj = new int[n][];
    for (int i = 0; i < n; i++) {
      adj[i] = lists[i].toArray();
    }
    return new HeavyLightDecomposition<>(ops, adj, v, valuesOnEdges);
  }

  public HeavyLightDecomposition(MonoidAction<V, D> ops, int[][] adj, V v, boolean valuesOnEdges) {
    this(ops, adj, Collections.nCopies(adj.length, v), valuesOnEdges);
  }

  /**
   * @param values initial slot of every node; with {@code valuesOnEdges} the value of the edge to its parent
   */
  public HeavyLightDecomposition(MonoidAction<V, D> ops, int[][] adj, List<V> values, boolean valuesOnEdges) {
    if (adj.length == 0) {
      throw new IllegalArgumentException("tree must have at least one node");
    }
    if (values.size() != adj.length) {
      throw new IllegalArgumentException("expected " + adj.length + " values, got " + values.size());
    }
    this.ops = ops;
    this.valuesOnEdges = valuesOnEdges;
    this.n = adj.length;
    this.parent = new int[n];
    this.depth = new int[n];
    this.subtreeSize = new int[n];
    this.tin = new int[n];
    this.chain = new int[n];
    this.pos = new int[n];

    int[] order = preorder(adj);
    int[] heavy = new int[n];
    for (int i = n - 1; i >= 0; i--) {
      int u = order[i];
      subtreeSize[u] = 1;
      heavy[u] = -1;
      for (int w : adj[u]) {
        if (w != parent[u]) {
          subtreeSize[u] += subtreeSize[w];
          if (heavy[u] == -1 || subtreeSize[w] > subtreeSize[heavy[u]]) {
            heavy[u] = w;
          }
        }
      }
    }

    IntArrayList roots = new IntArrayList();
    this.chains = new ArrayList<>();
    for (int u : order) {
      if (u != 0 && heavy[parent[u]] == u) {
        continue;
      }
      int id = roots.size();
      roots.add(u);
      ArrayList<V> slots = new ArrayList<>();
      for (int w = u; w != -1; w = heavy[w]) {
        chain[w] = id;
        pos[w] = slots.size();
        slots.add(values.get(w));
      }
      chains.add(new LazySegmentTree<>(ops, slots));
    }
    this.chainRoot = roots.toArray();
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine("decomposed " + n + " nodes into " + chainRoot.length + " chains");
    }
  }

  // iterative DFS from node 0; fills parent, depth and tin, rejects anything but a connected tree
  private int[] preorder(int[][] adj) {
    boolean[] visited = new boolean[n];
    int[] order = new int[n];
    int visitedCount = 0;
    long degreeSum = 0;
    IntArrayList stack = new IntArrayList();
    stack.add(0);
    parent[0] = -1;
    visited[0] = true;
    while (!stack.isEmpty()) {
      int u = stack.removeLast();
      tin[u] = visitedCount;
      order[visitedCount++] = u;
      degreeSum += adj[u].length;
      for (int w : adj[u]) {
        checkNode(w, n);
        if (w == parent[u]) {
          continue;
        }
        if (visited[w]) {
          throw new IllegalArgumentException("adjacency list is not a tree: cycle through node " + w);
        }
        visited[w] = true;
        parent[w] = u;
        depth[w] = depth[u] + 1;
        stack.add(w);
      }
    }
    if (visitedCount != n) {
      throw new IllegalArgumentException("adjacency list is not connected: reached " + visitedCount + " of " + n);
    }
    if (degreeSum != 2L * (n - 1)) {
      throw new IllegalArgumentException("adjacency list has duplicate or asymmetric edges");
    }
    return order;
  }

  private static void checkNode(int u, int n) {
    if (u < 0 || u >= n) {
      throw new IndexOutOfBoundsException("node " + u + " out of [0, " + n + ")");
    }
  }

  private boolean isAncestor(int a, int b) {
    return tin[a] <= tin[b] && tin[b] < tin[a] + subtreeSize[a];
  }

  private void checkPath(int u, int v) {
    checkNode(u, n);
    checkNode(v, n);
    if (valuesOnEdges && u == v) {
      throw new IllegalArgumentException("no edge on the path from " + u + " to itself");
    }
  }

  private interface ChainOp {
    void run(int chainId, int lo, int hi);
  }

  // walks u and v up to their common chain, reporting every chain segment; returns the lowest common ancestor
  private int walk(int u, int v, ChainOp op) {
    int root;
    while (!isAncestor(root = chainRoot[chain[u]], v)) {
      op.run(chain[u], 0, pos[u]);
      u = parent[root];
    }
    while (!isAncestor(root = chainRoot[chain[v]], u)) {
      op.run(chain[v], 0, pos[v]);
      v = parent[root];
    }
    assert chain[u] == chain[v];
    int lo = Math.min(pos[u], pos[v]) + (valuesOnEdges ? 1 : 0);
    int hi = Math.max(pos[u], pos[v]);
    if (lo <= hi) {
      op.run(chain[u], lo, hi);
    }
    return depth[u] < depth[v] ? u : v;
  }

  public int size() {
    return n;
  }

  public boolean valuesOnEdges() {
    return valuesOnEdges;
  }

  public int parent(int u) {
    checkNode(u, n);
    return parent[u];
  }

  public int depth(int u) {
    checkNode(u, n);
    return depth[u];
  }

  public int lca(int u, int v) {
    checkNode(u, n);
    checkNode(v, n);
    return walk(u, v, (c, lo, hi) -> {});
  }

  /**
   * Value of node {@code u}, or of the edge from {@code u} to its parent.
   */
  public V get(int u) {
    checkNode(u, n);
    if (valuesOnEdges && u == 0) {
      throw new IllegalArgumentException("root has no parent edge");
    }
    return chains.get(chain[u]).get(pos[u]);
  }

  /**
   * Combination of every value on the path between {@code u} and {@code v}.
   */
  public V query(int u, int v) {
    checkPath(u, v);
    Object[] acc = {ops.identity()};
    walk(u, v, (c, lo, hi) -> {
      @SuppressWarnings("unchecked") V prev = (V)acc[0];
      acc[0] = ops.combine(prev, chains.get(c).query(lo, hi));
    });
    @SuppressWarnings("unchecked") V result = (V)acc[0];
    return result;
  }

  /**
   * Applies {@code d} to every value on the path between {@code u} and {@code v}.
   */
  public void update(int u, int v, D d) {
    checkPath(u, v);
    walk(u, v, (c, lo, hi) -> chains.get(c).update(lo, hi, d));
  }
}
