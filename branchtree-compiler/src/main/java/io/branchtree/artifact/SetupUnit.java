package io.branchtree.artifact;

import io.branchtree.tree.NodeKind;

/**
 * Establishes the precondition of one branch node. Shared by every scenario passing through the
 * node.
 *
 * @param position arena position of the branch node
 * @param identifier member name, unique within the artifact
 * @param kind WHEN or GIVEN
 * @param label condition text without keyword
 * @param parentPosition position of the enclosing setup unit, or -1 at the top level
 * @param line source line of the node, 0 if unknown
 */
public record SetupUnit(
    int position, String identifier, NodeKind kind, String label, int parentPosition, int line) {

  public boolean hasParent() {
    return parentPosition >= 0;
  }

  /** Condition as written in the tree, e.g. {@code given fully withdrawn}. */
  public String condition() {
    return kind.keyword() + " " + label;
  }
}
