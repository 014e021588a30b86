package io.branchtree.tree;

import java.util.List;

/** Validation failure: an outcome has nested lines. */
public final class DanglingLeafException extends TreeValidationException {

  public DanglingLeafException(String message, int line, List<String> trail) {
    super(message, line, trail);
  }
}
