package io.branchtree.naming;

import io.branchtree.paths.ScenarioPath;
import io.branchtree.tree.TreeIndex;
import java.util.ArrayList;
import java.util.List;

/** Names assigned by {@link NamingEngine} to every position of one {@link TreeIndex}. */
public final class Names {
  /** Separator between segments of a path-identity key. */
  public static final String KEY_SEPARATOR = "/";

  private final TreeIndex index;
  private final String[] segments;
  private final String[] identifiers;

  Names(TreeIndex index, String[] segments, String[] identifiers) {
    this.index = index;
    this.segments = segments;
    this.identifiers = identifiers;
  }

  public TreeIndex index() {
    return index;
  }

  /** Sibling-unique name, the building block of path-identity keys. */
  public String segment(int pos) {
    return segments[pos];
  }

  /** Member name: unique among all branch nodes, sibling-unique for leaves. */
  public String identifier(int pos) {
    return identifiers[pos];
  }

  /**
   * Stable identity of a scenario: its segments joined with {@value #KEY_SEPARATOR}. Survives
   * sibling reordering, changes when any node on the path is renamed.
   */
  public String key(ScenarioPath path) {
    List<String> parts = new ArrayList<>(path.positions().size());
    for (int pos : path.positions()) parts.add(segments[pos]);
    return String.join(KEY_SEPARATOR, parts);
  }

  /** Identifiers along the path, outermost first, leaf last. */
  public List<String> identifiers(ScenarioPath path) {
    List<String> parts = new ArrayList<>(path.positions().size());
    for (int pos : path.positions()) parts.add(identifiers[pos]);
    return parts;
  }
}
