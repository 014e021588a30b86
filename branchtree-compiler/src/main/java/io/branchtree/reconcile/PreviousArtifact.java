package io.branchtree.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Scenarios recovered from an artifact written by an earlier run, in file order. */
public record PreviousArtifact(List<Scenario> scenarios) {

  /**
   * One scenario block.
   *
   * @param key path-identity key from the tag
   * @param body lines between the body tags, verbatim
   * @param orphaned whether the block was a retained orphan
   * @param line 1-based line of the tag
   */
  public record Scenario(String key, List<String> body, boolean orphaned, int line) {
    public Scenario {
      body = List.copyOf(body);
    }
  }

  public PreviousArtifact {
    scenarios = List.copyOf(scenarios);
  }

  public static PreviousArtifact empty() {
    return new PreviousArtifact(List.of());
  }

  public Optional<Scenario> find(String key) {
    for (Scenario s : scenarios) {
      if (s.key().equals(key)) return Optional.of(s);
    }
    return Optional.empty();
  }

  /** Keys of the scenarios that were live (not orphaned) in the previous artifact. */
  public List<String> activeKeys() {
    List<String> keys = new ArrayList<>();
    for (Scenario s : scenarios) {
      if (!s.orphaned()) keys.add(s.key());
    }
    return keys;
  }
}
