package io.branchtree.reconcile;

import io.branchtree.tree.TreeException;

/**
 * Thrown when a previously generated artifact cannot be read back, e.g. a body tag was deleted by
 * hand. Reconciliation refuses to guess so no hand-written body is lost.
 */
public final class MalformedArtifactException extends TreeException {

  public MalformedArtifactException(String message, int line) {
    super(message, line);
  }
}
