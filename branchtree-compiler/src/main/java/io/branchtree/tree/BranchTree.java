package io.branchtree.tree;

import java.util.List;
import java.util.Objects;

/**
 * A parsed branching tree for one unit under test.
 *
 * <p>The root header line names the subject; it is not a {@link Node} and never becomes a setup
 * unit. Its children are the top-level branch set.
 */
public final class BranchTree {
  private final String subject;
  private final List<Node> children;
  private final int line;

  public BranchTree(String subject, List<Node> children, int line) {
    this.subject = Objects.requireNonNull(subject, "subject");
    this.children = List.copyOf(children);
    this.line = line;
  }

  public static BranchTree of(String subject, Node... children) {
    return new BranchTree(subject, List.of(children), 0);
  }

  public String subject() {
    return subject;
  }

  public List<Node> children() {
    return children;
  }

  public int line() {
    return line;
  }

  /** Copy of this tree with different top-level children. */
  public BranchTree withChildren(List<Node> newChildren) {
    return new BranchTree(subject, newChildren, line);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BranchTree other)) return false;
    return subject.equals(other.subject) && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subject, children);
  }

  @Override
  public String toString() {
    return "BranchTree{" + subject + ", " + children + "}";
  }
}
