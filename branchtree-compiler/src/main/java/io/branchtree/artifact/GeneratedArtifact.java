package io.branchtree.artifact;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scaffold for one tree: setup units then assertion units, both in visitation order, plus
 * scenarios retained from an earlier artifact that no longer match the tree.
 */
public record GeneratedArtifact(
    String subject,
    List<SetupUnit> setupUnits,
    List<AssertionUnit> assertionUnits,
    List<OrphanedScenario> retainedOrphans) {

  public GeneratedArtifact {
    setupUnits = List.copyOf(setupUnits);
    assertionUnits = List.copyOf(assertionUnits);
    retainedOrphans = List.copyOf(retainedOrphans);
  }

  public Optional<AssertionUnit> assertion(String key) {
    for (AssertionUnit unit : assertionUnits) {
      if (unit.key().equals(key)) return Optional.of(unit);
    }
    return Optional.empty();
  }

  public Optional<SetupUnit> setup(int position) {
    for (SetupUnit unit : setupUnits) {
      if (unit.position() == position) return Optional.of(unit);
    }
    return Optional.empty();
  }

  /** Setup unit this one depends on, if any. */
  public Optional<SetupUnit> parentOf(SetupUnit unit) {
    return unit.hasParent() ? setup(unit.parentPosition()) : Optional.empty();
  }

  public List<String> keys() {
    List<String> keys = new ArrayList<>(assertionUnits.size());
    for (AssertionUnit unit : assertionUnits) keys.add(unit.key());
    return keys;
  }

  public GeneratedArtifact withAssertions(
      List<AssertionUnit> assertions, List<OrphanedScenario> orphans) {
    return new GeneratedArtifact(subject, setupUnits, assertions, orphans);
  }
}
