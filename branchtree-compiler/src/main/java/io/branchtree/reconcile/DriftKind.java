package io.branchtree.reconcile;

public enum DriftKind {
  ADDED,
  REMOVED,
  RENAMED,
  REORDERED
}
