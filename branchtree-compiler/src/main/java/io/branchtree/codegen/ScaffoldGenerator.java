package io.branchtree.codegen;

import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.SetupUnit;
import io.branchtree.naming.Names;
import io.branchtree.paths.ScenarioPath;
import io.branchtree.tree.Node;
import io.branchtree.tree.TreeIndex;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the scenarios of a validated tree to setup and assertion units.
 *
 * <p>Scenarios are visited once, in enumeration order. A setup unit is emitted the first time its
 * branch node is reached and then shared by every later scenario through the same node, so the
 * artifact holds one setup unit per branch node however many scenarios pass through it. Each
 * assertion unit lists its chain in root-to-leaf order; setup routines may depend on running in
 * that order.
 */
public final class ScaffoldGenerator {
  private static final Logger log = LoggerFactory.getLogger(ScaffoldGenerator.class);

  private final ArtifactFormat format;

  public ScaffoldGenerator(ArtifactFormat format) {
    this.format = format;
  }

  public GeneratedArtifact generate(Names names, Iterable<ScenarioPath> paths) {
    TreeIndex index = names.index();
    Map<Integer, SetupUnit> emitted = new HashMap<>();
    List<SetupUnit> setups = new ArrayList<>(index.branchCount());
    List<AssertionUnit> assertions = new ArrayList<>(index.leafCount());

    for (ScenarioPath path : paths) {
      List<SetupUnit> chain = new ArrayList<>(path.positions().size() - 1);
      for (int pos : path.preconditionPositions()) {
        SetupUnit unit = emitted.get(pos);
        if (unit == null) {
          Node node = index.node(pos);
          unit =
              new SetupUnit(
                  pos,
                  names.identifier(pos),
                  node.kind(),
                  node.label(),
                  index.parent(pos),
                  node.line());
          emitted.put(pos, unit);
          setups.add(unit);
        }
        chain.add(unit);
      }
      Node leaf = path.leaf();
      assertions.add(
          new AssertionUnit(
              names.key(path),
              names.identifiers(path),
              chain,
              leaf.label(),
              format.placeholderBody(leaf.label()),
              false,
              leaf.line()));
    }
    log.debug(
        "Generated {} setup units and {} assertion units for '{}'",
        setups.size(),
        assertions.size(),
        index.tree().subject());
    return new GeneratedArtifact(index.tree().subject(), setups, assertions, List.of());
  }
}
