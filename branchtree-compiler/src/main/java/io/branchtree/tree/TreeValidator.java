package io.branchtree.tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the structural invariants of a parsed tree. Labels are compared for equality only; their
 * meaning is never inspected.
 *
 * <p>Siblings are compared ignoring case and runs of whitespace, so {@code when ID  is null} and
 * {@code when id is null} under one parent are duplicates. Distinct siblings make every
 * root-to-leaf label sequence distinct; {@link #checkKeys} then checks the names derived from
 * those sequences.
 */
public final class TreeValidator {
  private static final Logger log = LoggerFactory.getLogger(TreeValidator.class);

  /**
   * Validates a tree.
   *
   * @param tree tree to check
   * @return the same tree
   * @throws TreeValidationException on the first violation, in preorder
   */
  public BranchTree validate(BranchTree tree) throws TreeValidationException {
    if (tree.children().isEmpty()) {
      throw new EmptyTreeException(
          "tree '" + tree.subject() + "' has no branches", tree.line(), List.of());
    }
    List<String> trail = new ArrayList<>();
    checkSiblings(tree.children(), trail);
    int leaves = 0;
    for (Node child : tree.children()) {
      leaves += validateNode(child, trail);
    }
    log.debug("Validated tree '{}': {} scenarios", tree.subject(), leaves);
    return tree;
  }

  private int validateNode(Node node, List<String> trail) throws TreeValidationException {
    trail.add(node.text());
    try {
      return switch (node.kind()) {
        case THEN -> validateLeaf(node, trail);
        case WHEN, GIVEN -> validateBranch(node, trail);
      };
    } finally {
      trail.remove(trail.size() - 1);
    }
  }

  private static int validateLeaf(Node leaf, List<String> trail) throws DanglingLeafException {
    if (!leaf.children().isEmpty()) {
      Node nested = leaf.children().get(0);
      throw new DanglingLeafException(
          "'" + nested.text() + "' is nested under an outcome", nested.line(), trail);
    }
    return 1;
  }

  private int validateBranch(Node branch, List<String> trail) throws TreeValidationException {
    List<Node> children = branch.children();
    if (children.isEmpty()) {
      throw new SingleChildBranchException("branch has no outcome", branch.line(), trail);
    }
    if (children.size() == 1 && children.get(0).kind().isBranch()) {
      throw new SingleChildBranchException(
          "branch has a single nested condition '"
              + children.get(0).text()
              + "'; merge it or add its complement",
          branch.line(),
          trail);
    }
    checkSiblings(children, trail);
    int leaves = 0;
    for (Node child : children) {
      leaves += validateNode(child, trail);
    }
    return leaves;
  }

  private static void checkSiblings(List<Node> siblings, List<String> trail)
      throws DuplicateSiblingLabelException {
    Set<String> seen = new HashSet<>();
    for (Node sibling : siblings) {
      if (!seen.add(comparable(sibling))) {
        throw new DuplicateSiblingLabelException(
            "duplicate sibling '" + sibling.text() + "'", sibling.line(), trail);
      }
    }
  }

  private static String comparable(Node node) {
    return node.text().strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }

  /**
   * Checks that no two scenarios of a validated tree share a path-identity key.
   *
   * @param keys key of each scenario
   * @param scenarios nodes of each scenario, same order as {@code keys}, leaf last
   * @throws DuplicatePathException naming the second scenario that uses a key
   */
  public void checkKeys(List<String> keys, List<List<Node>> scenarios)
      throws DuplicatePathException {
    Map<String, Node> seen = new HashMap<>();
    for (int i = 0; i < keys.size(); i++) {
      List<Node> nodes = scenarios.get(i);
      Node leaf = nodes.get(nodes.size() - 1);
      Node previous = seen.putIfAbsent(keys.get(i), leaf);
      if (previous != null) {
        List<String> trail = new ArrayList<>(nodes.size());
        for (Node n : nodes) trail.add(n.text());
        throw new DuplicatePathException(
            "scenario key '"
                + keys.get(i)
                + "' is also used by the scenario on line "
                + previous.line(),
            leaf.line(),
            trail);
      }
    }
  }
}
