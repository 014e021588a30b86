package io.branchtree.tree;

import java.util.List;

/** Validation failure: two outcomes describe the same scenario. */
public final class DuplicatePathException extends TreeValidationException {

  public DuplicatePathException(String message, int line, List<String> trail) {
    super(message, line, trail);
  }
}
