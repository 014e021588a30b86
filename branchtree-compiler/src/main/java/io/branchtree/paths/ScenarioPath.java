package io.branchtree.paths;

import io.branchtree.tree.Node;
import java.util.List;

/**
 * One scenario: the nodes from the first level below the root down to a leaf.
 *
 * @param positions arena positions of {@code nodes}, same order
 * @param nodes ordered nodes, the last one is the leaf
 */
public record ScenarioPath(List<Integer> positions, List<Node> nodes) {

  public ScenarioPath {
    positions = List.copyOf(positions);
    nodes = List.copyOf(nodes);
    if (nodes.isEmpty() || positions.size() != nodes.size()) {
      throw new IllegalArgumentException("a path needs one position per node and a leaf");
    }
  }

  public Node leaf() {
    return nodes.get(nodes.size() - 1);
  }

  public int leafPosition() {
    return positions.get(positions.size() - 1);
  }

  /** Outcome declared at the leaf, without the keyword. */
  public String outcome() {
    return leaf().label();
  }

  /** Branch nodes of the path, outermost first. */
  public List<Node> preconditions() {
    return nodes.subList(0, nodes.size() - 1);
  }

  public List<Integer> preconditionPositions() {
    return positions.subList(0, positions.size() - 1);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Node n : nodes) {
      if (sb.length() > 0) sb.append(" > ");
      sb.append(n.text());
    }
    return sb.toString();
  }
}
