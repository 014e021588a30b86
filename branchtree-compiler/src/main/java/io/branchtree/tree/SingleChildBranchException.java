package io.branchtree.tree;

import java.util.List;

/** Validation failure: a branch does not represent a real choice. */
public final class SingleChildBranchException extends TreeValidationException {

  public SingleChildBranchException(String message, int line, List<String> trail) {
    super(message, line, trail);
  }
}
