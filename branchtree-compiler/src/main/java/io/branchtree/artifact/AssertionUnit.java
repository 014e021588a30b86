package io.branchtree.artifact;

import java.util.ArrayList;
import java.util.List;

/**
 * Terminal unit of one scenario.
 *
 * @param key stable path-identity key
 * @param identifiers naming-engine identifiers along the path, leaf last
 * @param chain setup units to run before the body, outermost first; the same instances the
 *     artifact lists in its setup section
 * @param outcome expected outcome text without keyword
 * @param body body lines, verbatim including indentation
 * @param preserved whether {@code body} was carried over from a previous artifact
 * @param line source line of the leaf, 0 if unknown
 */
public record AssertionUnit(
    String key,
    List<String> identifiers,
    List<SetupUnit> chain,
    String outcome,
    List<String> body,
    boolean preserved,
    int line) {

  public AssertionUnit {
    identifiers = List.copyOf(identifiers);
    chain = List.copyOf(chain);
    body = List.copyOf(body);
  }

  /** Copy of this unit with a body taken from a previous artifact. */
  public AssertionUnit withPreservedBody(List<String> previousBody) {
    return new AssertionUnit(key, identifiers, chain, outcome, previousBody, true, line);
  }

  public List<String> chainIdentifiers() {
    List<String> ids = new ArrayList<>(chain.size());
    for (SetupUnit unit : chain) ids.add(unit.identifier());
    return ids;
  }
}
