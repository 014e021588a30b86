package io.branchtree.tree;

/** Kind of a tree node, derived from the leading keyword of its line. */
public enum NodeKind {
  /** Parameter-driven precondition. */
  WHEN("when"),
  /** State-driven precondition. */
  GIVEN("given"),
  /** Expected outcome of one scenario. */
  THEN("it should");

  private final String keyword;

  NodeKind(String keyword) {
    this.keyword = keyword;
  }

  /** Canonical (lowercase) keyword that introduces nodes of this kind. */
  public String keyword() {
    return keyword;
  }

  public boolean isBranch() {
    return switch (this) {
      case WHEN, GIVEN -> true;
      case THEN -> false;
    };
  }
}
