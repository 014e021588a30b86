package io.branchtree.cli;

/** Two trees of one run map to the same artifact file. */
final class OutputConflictException extends Exception {

  OutputConflictException(String message) {
    super(message);
  }
}
