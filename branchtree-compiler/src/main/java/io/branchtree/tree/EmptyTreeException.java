package io.branchtree.tree;

import java.util.List;

/** Validation failure: the tree has no branches. */
public final class EmptyTreeException extends TreeValidationException {

  public EmptyTreeException(String message, int line, List<String> trail) {
    super(message, line, trail);
  }
}
