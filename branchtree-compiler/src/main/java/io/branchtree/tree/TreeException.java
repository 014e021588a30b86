package io.branchtree.tree;

/**
 * Base of all errors that make a branching tree unusable for code generation.
 *
 * <p>Errors are fatal for the tree they were raised for: nothing is generated for it.
 */
public class TreeException extends Exception {
  private final int line;

  public TreeException(String message, int line) {
    super(line > 0 ? "line " + line + ": " + message : message);
    this.line = line;
  }

  /** 1-based line of the offending input, or 0 when unknown. */
  public int line() {
    return line;
  }
}
