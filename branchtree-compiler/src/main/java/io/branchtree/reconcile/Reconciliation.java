package io.branchtree.reconcile;

import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.OrphanedScenario;
import java.util.List;

/**
 * Outcome of merging a fresh artifact with a previous one.
 *
 * @param artifact merged artifact to emit
 * @param orphans previous scenarios whose key no longer exists, retained in {@code artifact} or not
 *     depending on the policy
 * @param drift scenario-level changes since the previous artifact
 * @param preservedBodies number of assertion bodies taken from the previous artifact
 */
public record Reconciliation(
    GeneratedArtifact artifact,
    List<OrphanedScenario> orphans,
    List<DriftEntry> drift,
    int preservedBodies) {

  public Reconciliation {
    orphans = List.copyOf(orphans);
    drift = List.copyOf(drift);
  }

  /** Scenarios that received a fresh placeholder body. */
  public int placeholders() {
    return artifact.assertionUnits().size() - preservedBodies;
  }
}
