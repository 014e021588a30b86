package io.branchtree.artifact;

import java.util.List;

/**
 * A scenario of a previous artifact whose path identity no longer exists in the tree. Advisory:
 * reported to the caller, never an error.
 *
 * @param key path-identity key it was generated under
 * @param body body lines as last written
 * @param carried whether it was already an orphan in the previous artifact
 */
public record OrphanedScenario(String key, List<String> body, boolean carried) {

  public OrphanedScenario {
    body = List.copyOf(body);
  }
}
