package io.branchtree.tree;

import java.util.List;

/**
 * Structural violation found by {@link TreeValidator}.
 *
 * <p>Carries the label trail from the root to the offending node so the author can locate it
 * without line numbers (trees built in code have none).
 */
public abstract class TreeValidationException extends TreeException {
  private final List<String> trail;

  protected TreeValidationException(String message, int line, List<String> trail) {
    super(trail.isEmpty() ? message : message + " at [" + String.join(" > ", trail) + "]", line);
    this.trail = List.copyOf(trail);
  }

  public List<String> trail() {
    return trail;
  }
}
