package io.branchtree.reconcile;

/**
 * One scenario-level difference between a previous artifact and the current tree.
 *
 * @param pathIdentity current key, or the removed key for {@link DriftKind#REMOVED}
 * @param kind kind of change
 * @param previousIdentity key before a rename, null for other kinds
 */
public record DriftEntry(String pathIdentity, DriftKind kind, String previousIdentity) {

  public static DriftEntry of(String pathIdentity, DriftKind kind) {
    return new DriftEntry(pathIdentity, kind, null);
  }

  @Override
  public String toString() {
    return previousIdentity == null
        ? kind + " " + pathIdentity
        : kind + " " + previousIdentity + " -> " + pathIdentity;
  }
}
