package io.branchtree.paths;

import io.branchtree.tree.BranchTree;
import io.branchtree.tree.Node;
import io.branchtree.tree.TreeIndex;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy depth-first, left-to-right enumeration of the scenarios of a tree. Every call to {@link
 * #iterator()} starts a fresh traversal, so the sequence can be consumed any number of times and
 * always yields the same order for the same tree.
 */
public final class PathEnumerator implements Iterable<ScenarioPath> {
  private final TreeIndex index;

  public PathEnumerator(TreeIndex index) {
    this.index = index;
  }

  public PathEnumerator(BranchTree tree) {
    this(TreeIndex.of(tree));
  }

  public TreeIndex index() {
    return index;
  }

  @Override
  public Iterator<ScenarioPath> iterator() {
    return new Walk();
  }

  public Stream<ScenarioPath> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(
            iterator(), Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.IMMUTABLE),
        false);
  }

  public long count() {
    return index.leafCount();
  }

  private final class Walk implements Iterator<ScenarioPath> {
    private final Deque<Integer> pending = new ArrayDeque<>();
    private ScenarioPath next;

    Walk() {
      pushChildren(TreeIndex.ROOT);
      advance();
    }

    private void pushChildren(int pos) {
      List<Integer> kids = index.childrenOf(pos);
      for (int i = kids.size() - 1; i >= 0; i--) {
        pending.push(kids.get(i));
      }
    }

    private void advance() {
      next = null;
      while (!pending.isEmpty()) {
        int pos = pending.pop();
        Node node = index.node(pos);
        if (node.isLeaf()) {
          next = pathTo(pos);
          return;
        }
        pushChildren(pos);
      }
    }

    private ScenarioPath pathTo(int leaf) {
      List<Integer> positions = new ArrayList<>(index.ancestors(leaf));
      positions.add(leaf);
      List<Node> nodes = new ArrayList<>(positions.size());
      for (int p : positions) nodes.add(index.node(p));
      return new ScenarioPath(positions, nodes);
    }

    @Override
    public boolean hasNext() {
      return next != null;
    }

    @Override
    public ScenarioPath next() {
      if (next == null) throw new NoSuchElementException();
      ScenarioPath current = next;
      advance();
      return current;
    }
  }
}
