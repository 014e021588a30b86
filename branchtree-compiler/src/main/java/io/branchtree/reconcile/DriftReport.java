package io.branchtree.reconcile;

import io.branchtree.artifact.OrphanedScenario;
import java.util.List;

/**
 * Everything that differs between the stored state of one tree and what the compiler produces.
 *
 * @param tree name of the tree file
 * @param formattingDrift whether the tree text is not in canonical form
 * @param artifactStale whether the stored artifact differs from the regenerated one (or is missing)
 * @param entries scenario-level changes
 * @param orphans scenarios of the stored artifact that no longer match the tree
 */
public record DriftReport(
    String tree,
    boolean formattingDrift,
    boolean artifactStale,
    List<DriftEntry> entries,
    List<OrphanedScenario> orphans) {

  public DriftReport {
    entries = List.copyOf(entries);
    orphans = List.copyOf(orphans);
  }

  public boolean hasDrift() {
    return formattingDrift || artifactStale || !entries.isEmpty();
  }
}
