package io.branchtree.cli;

import io.branchtree.CompilationResult;
import java.nio.file.Path;

/**
 * Result of compiling one tree file.
 *
 * @param tree tree file
 * @param status outcome
 * @param output artifact path, null if it could not be determined
 * @param result compilation result, null unless the tree compiled
 * @param error message for failed jobs, null otherwise
 */
record JobOutcome(Path tree, Status status, Path output, CompilationResult result, String error) {

  enum Status {
    /** Artifact written (or already identical). */
    WRITTEN,
    /** Check mode: nothing to report. */
    CLEAN,
    /** Check mode: drift found. */
    DRIFT,
    /** Tree or previous artifact rejected, or its output already claimed by another tree. */
    INVALID,
    /** File system or unexpected failure. */
    IO_ERROR
  }

  int exitCode() {
    return switch (status) {
      case WRITTEN, CLEAN -> ExitCodes.OK;
      case DRIFT -> ExitCodes.DRIFT;
      case INVALID -> ExitCodes.INVALID;
      case IO_ERROR -> ExitCodes.IO_ERROR;
    };
  }

  static JobOutcome failed(Path tree, Status status, Path output, String error) {
    return new JobOutcome(tree, status, output, null, error);
  }
}
