package io.branchtree.tree;

import java.util.List;

/** Validation failure: two siblings share a label. */
public final class DuplicateSiblingLabelException extends TreeValidationException {

  public DuplicateSiblingLabelException(String message, int line, List<String> trail) {
    super(message, line, trail);
  }
}
