package io.branchtree.tree;

import java.util.List;
import java.util.Objects;

/**
 * One line of a branching tree.
 *
 * <p>Equality is structural: kind, label and children. The source line is carried for error
 * reporting only and does not take part in {@link #equals(Object)}, so a tree parsed from its own
 * canonical rendering compares equal to the original.
 */
public final class Node {
  private final NodeKind kind;
  private final String label;
  private final List<Node> children;
  private final int line;

  public Node(NodeKind kind, String label, List<Node> children, int line) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.label = Objects.requireNonNull(label, "label");
    this.children = List.copyOf(children);
    this.line = line;
  }

  public static Node when(String label, Node... children) {
    return new Node(NodeKind.WHEN, label, List.of(children), 0);
  }

  public static Node given(String label, Node... children) {
    return new Node(NodeKind.GIVEN, label, List.of(children), 0);
  }

  public static Node it(String label) {
    return new Node(NodeKind.THEN, label, List.of(), 0);
  }

  public NodeKind kind() {
    return kind;
  }

  /** Label text without the kind keyword. */
  public String label() {
    return label;
  }

  public List<Node> children() {
    return children;
  }

  /** 1-based source line, or 0 for nodes built in code. */
  public int line() {
    return line;
  }

  public boolean isLeaf() {
    return !kind.isBranch();
  }

  /** Keyword and label as they appear in the canonical notation, e.g. {@code when id is null}. */
  public String text() {
    return kind.keyword() + " " + label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Node other)) return false;
    return kind == other.kind && label.equals(other.label) && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, label, children);
  }

  @Override
  public String toString() {
    return children.isEmpty() ? text() : text() + " " + children;
  }
}
