package io.branchtree.property;

import io.branchtree.naming.NamingEngine;
import io.branchtree.tree.BranchTree;
import io.branchtree.tree.Node;
import io.branchtree.tree.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.Tuple;

/**
 * Generators for valid branching trees. Labels come from a small vocabulary, stopwords included,
 * so the same condition often appears in several places of one tree.
 *
 * <p>{@link #trees()} keeps sibling names distinct after normalization. {@link #collidingTrees()}
 * only keeps sibling labels distinct, so siblings such as {@code when id} and {@code when the id}
 * end up sharing a name.
 */
final class TreeArbitraries {
  private static final int MAX_DEPTH = 3;

  private TreeArbitraries() {}

  static Arbitrary<BranchTree> trees() {
    return trees(TreeArbitraries::name);
  }

  static Arbitrary<BranchTree> collidingTrees() {
    return trees(TreeArbitraries::text);
  }

  private static Arbitrary<BranchTree> trees(Function<Node, Object> sibling) {
    return node(MAX_DEPTH, sibling)
        .list()
        .ofMinSize(1)
        .ofMaxSize(3)
        .uniqueElements(sibling)
        .map(children -> new BranchTree("Subject Test", children, 0));
  }

  static Arbitrary<String> labels() {
    return Arbitraries.of("id", "amount", "owner", "is", "the", "zero", "null", "paused", "Expired", "cap-reached", "cap reached")
        .list()
        .ofMinSize(1)
        .ofMaxSize(3)
        .map(words -> String.join(" ", words));
  }

  static Arbitrary<Node> leaf() {
    return labels().map(Node::it);
  }

  @SuppressWarnings("unchecked")
  static Arbitrary<Node> node(int depth, Function<Node, Object> sibling) {
    if (depth == 0) {
      return leaf();
    }
    return Arbitraries.frequencyOf(Tuple.of(1, leaf()), Tuple.of(2, branch(depth, sibling)));
  }

  @SuppressWarnings("unchecked")
  static Arbitrary<Node> branch(int depth, Function<Node, Object> sibling) {
    Arbitrary<List<Node>> children =
        Arbitraries.oneOf(
            leaf().list().ofSize(1),
            node(depth - 1, sibling).list().ofMinSize(2).ofMaxSize(3).uniqueElements(sibling));
    return Combinators.combine(Arbitraries.of(NodeKind.WHEN, NodeKind.GIVEN), labels(), children)
        .as((kind, label, kids) -> new Node(kind, label, kids, 0));
  }

  private static String name(Node node) {
    return NamingEngine.normalize(node.kind(), node.label());
  }

  private static String text(Node node) {
    return node.text().toLowerCase(Locale.ROOT);
  }

  /** Same tree with every sibling list reversed. */
  static BranchTree reversed(BranchTree tree) {
    return tree.withChildren(reversed(tree.children()));
  }

  private static List<Node> reversed(List<Node> nodes) {
    List<Node> out = new ArrayList<>(nodes.size());
    for (int i = nodes.size() - 1; i >= 0; i--) {
      Node n = nodes.get(i);
      out.add(new Node(n.kind(), n.label(), reversed(n.children()), n.line()));
    }
    return out;
  }
}
