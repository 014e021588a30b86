package io.branchtree.cli;

/** Process exit codes of the command line tool. */
final class ExitCodes {
  private ExitCodes() {}

  static final int OK = 0;
  /** A tree failed to parse or validate, or its previous artifact was unreadable. */
  static final int INVALID = 1;
  /** {@code --check} found drift. */
  static final int DRIFT = 2;
  /** A file could not be read or written, or a tree failed to compile for an unexpected reason. */
  static final int IO_ERROR = 3;
}
