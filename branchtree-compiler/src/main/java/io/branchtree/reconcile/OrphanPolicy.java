package io.branchtree.reconcile;

/** What happens to orphaned scenarios in the merged artifact. Either way they are reported. */
public enum OrphanPolicy {
  /** Keep them as commented blocks; a later run restores them if their key comes back. */
  RETAIN,
  /** Drop them from the output. */
  PRUNE
}
