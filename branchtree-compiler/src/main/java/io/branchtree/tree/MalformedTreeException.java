package io.branchtree.tree;

/** Thrown by {@link TreeParser} when the input is not valid tree notation. */
public final class MalformedTreeException extends TreeException {

  public MalformedTreeException(String message, int line) {
    super(message, line);
  }
}
