package io.branchtree.reconcile;

import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.OrphanedScenario;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a freshly generated artifact with the one written by an earlier run.
 *
 * <p>Setup units always come from the fresh generation. An assertion body is taken from the
 * previous artifact when a scenario with the same path-identity key exists there, live or
 * retained as an orphan; otherwise the fresh placeholder stays. Previous scenarios whose key is
 * gone are reported as {@link OrphanedScenario}s and kept or dropped according to the {@link
 * OrphanPolicy}. Neither input is modified.
 */
public final class Reconciler {
  private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

  private final OrphanPolicy policy;
  private final DriftDetector driftDetector = new DriftDetector();

  public Reconciler(OrphanPolicy policy) {
    this.policy = policy;
  }

  public Reconciliation reconcile(GeneratedArtifact fresh, Optional<PreviousArtifact> previous) {
    PreviousArtifact before = previous.orElse(PreviousArtifact.empty());

    List<AssertionUnit> merged = new ArrayList<>(fresh.assertionUnits().size());
    Set<String> liveKeys = new HashSet<>();
    int preserved = 0;
    for (AssertionUnit unit : fresh.assertionUnits()) {
      liveKeys.add(unit.key());
      Optional<PreviousArtifact.Scenario> match = before.find(unit.key());
      if (match.isPresent()) {
        merged.add(unit.withPreservedBody(match.get().body()));
        preserved++;
      } else {
        merged.add(unit);
      }
    }

    List<OrphanedScenario> orphans = new ArrayList<>();
    for (PreviousArtifact.Scenario scenario : before.scenarios()) {
      if (!liveKeys.contains(scenario.key())) {
        orphans.add(new OrphanedScenario(scenario.key(), scenario.body(), scenario.orphaned()));
      }
    }
    for (OrphanedScenario orphan : orphans) {
      if (!orphan.carried()) {
        log.debug("Scenario {} no longer exists in tree '{}'", orphan.key(), fresh.subject());
      }
    }

    List<OrphanedScenario> retained = policy == OrphanPolicy.RETAIN ? orphans : List.of();
    List<DriftEntry> drift = driftDetector.compare(before.activeKeys(), fresh.keys());
    log.debug(
        "Reconciled '{}': {} bodies preserved, {} placeholders, {} orphans ({})",
        fresh.subject(),
        preserved,
        merged.size() - preserved,
        orphans.size(),
        policy);
    return new Reconciliation(fresh.withAssertions(merged, retained), orphans, drift, preserved);
  }
}
