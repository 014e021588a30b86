package io.branchtree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena of the nodes of one tree, addressed by preorder position.
 *
 * <p>Setup units and names refer to nodes by position rather than by reference: two structurally
 * equal subtrees under different parents are equal {@link Node} values but distinct positions.
 */
public final class TreeIndex {
  /** Parent position of top-level nodes. */
  public static final int ROOT = -1;

  private final BranchTree tree;
  private final List<Node> nodes = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final List<List<Integer>> children = new ArrayList<>();
  private final List<Integer> topLevel = new ArrayList<>();

  private TreeIndex(BranchTree tree) {
    this.tree = tree;
    for (Node node : tree.children()) {
      topLevel.add(add(node, ROOT));
    }
  }

  public static TreeIndex of(BranchTree tree) {
    return new TreeIndex(tree);
  }

  private int add(Node node, int parent) {
    int pos = nodes.size();
    nodes.add(node);
    parents.add(parent);
    List<Integer> kids = new ArrayList<>(node.children().size());
    children.add(kids);
    for (Node nested : node.children()) {
      kids.add(add(nested, pos));
    }
    return pos;
  }

  public BranchTree tree() {
    return tree;
  }

  public int size() {
    return nodes.size();
  }

  public Node node(int pos) {
    return nodes.get(pos);
  }

  /** Parent position, or {@link #ROOT} for top-level nodes. */
  public int parent(int pos) {
    return parents.get(pos);
  }

  public List<Integer> children(int pos) {
    return Collections.unmodifiableList(children.get(pos));
  }

  /** Positions of the children of {@code pos}, or of the top-level nodes for {@link #ROOT}. */
  public List<Integer> childrenOf(int pos) {
    return pos == ROOT ? Collections.unmodifiableList(topLevel) : children(pos);
  }

  /** Positions of the ancestors of {@code pos}, outermost first, excluding {@code pos}. */
  public List<Integer> ancestors(int pos) {
    List<Integer> chain = new ArrayList<>();
    for (int p = parent(pos); p != ROOT; p = parent(p)) {
      chain.add(p);
    }
    Collections.reverse(chain);
    return chain;
  }

  public int branchCount() {
    int count = 0;
    for (Node n : nodes) {
      if (n.kind().isBranch()) count++;
    }
    return count;
  }

  public int leafCount() {
    return nodes.size() - branchCount();
  }
}
