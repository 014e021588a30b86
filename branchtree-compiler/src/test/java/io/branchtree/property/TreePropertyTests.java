package io.branchtree.property;

import static org.junit.jupiter.api.Assertions.*;

import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.SetupUnit;
import io.branchtree.codegen.EmitOptions;
import io.branchtree.codegen.JUnitFormat;
import io.branchtree.codegen.ScaffoldGenerator;
import io.branchtree.naming.NamingEngine;
import io.branchtree.naming.Names;
import io.branchtree.paths.PathEnumerator;
import io.branchtree.paths.ScenarioPath;
import io.branchtree.reconcile.ArtifactReader;
import io.branchtree.reconcile.OrphanPolicy;
import io.branchtree.reconcile.Reconciler;
import io.branchtree.tree.BranchTree;
import io.branchtree.tree.CanonicalRenderer;
import io.branchtree.tree.TreeIndex;
import io.branchtree.tree.TreeParser;
import io.branchtree.tree.TreeValidator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.jqwik.api.*;

/** Properties that must hold for every valid tree. */
@PropertyDefaults(tries = 300)
class TreePropertyTests {
  private static final Pattern IDENTIFIER = Pattern.compile("[a-z][A-Za-z0-9]*(_[0-9][A-Za-z0-9]*)*");

  private final CanonicalRenderer renderer = new CanonicalRenderer();
  private final JUnitFormat format = new JUnitFormat();

  @Provide
  Arbitrary<BranchTree> trees() {
    return TreeArbitraries.trees();
  }

  @Provide
  Arbitrary<BranchTree> collidingTrees() {
    return TreeArbitraries.collidingTrees();
  }

  private GeneratedArtifact scaffold(TreeIndex index) {
    Names names = new NamingEngine().assign(index);
    return new ScaffoldGenerator(format).generate(names, new PathEnumerator(index));
  }

  @Property
  void generatedTreesAreValid(@ForAll("trees") BranchTree tree) throws Exception {
    assertSame(tree, new TreeValidator().validate(tree));
  }

  @Property
  void renderThenParseIsIdentity(@ForAll("trees") BranchTree tree) throws Exception {
    assertEquals(tree, TreeParser.parse(renderer.render(tree)));
  }

  @Property
  void renderingIsIdempotent(@ForAll("trees") BranchTree tree) throws Exception {
    String once = renderer.render(tree);
    assertEquals(once, renderer.render(TreeParser.parse(once)));
    assertTrue(renderer.isCanonical(once));
  }

  @Property
  void treesWithCollidingNamesAreValid(@ForAll("collidingTrees") BranchTree tree) throws Exception {
    assertSame(tree, new TreeValidator().validate(tree));
  }

  @Property
  void oneSetupUnitPerBranchNode(@ForAll("collidingTrees") BranchTree tree) {
    TreeIndex index = TreeIndex.of(tree);
    GeneratedArtifact artifact = scaffold(index);
    assertEquals(index.branchCount(), artifact.setupUnits().size());
    assertEquals(index.leafCount(), artifact.assertionUnits().size());
    Set<String> ids = new HashSet<>();
    for (SetupUnit unit : artifact.setupUnits()) {
      assertTrue(IDENTIFIER.matcher(unit.identifier()).matches(), unit.identifier());
      assertTrue(ids.add(unit.identifier()), "duplicate identifier " + unit.identifier());
    }
  }

  @Property
  void chainMatchesTheAncestorsOfEachLeaf(@ForAll("trees") BranchTree tree) {
    TreeIndex index = TreeIndex.of(tree);
    Names names = new NamingEngine().assign(index);
    GeneratedArtifact artifact = new ScaffoldGenerator(format).generate(names, new PathEnumerator(index));
    List<ScenarioPath> paths = new PathEnumerator(index).stream().collect(Collectors.toList());
    for (int i = 0; i < paths.size(); i++) {
      ScenarioPath path = paths.get(i);
      AssertionUnit unit = artifact.assertionUnits().get(i);
      List<String> expected = new ArrayList<>();
      for (int pos : index.ancestors(path.leafPosition())) expected.add(names.identifier(pos));
      assertEquals(expected, unit.chainIdentifiers());
    }
  }

  @Property
  void scenarioKeysAndTestNamesAreUnique(@ForAll("collidingTrees") BranchTree tree) {
    GeneratedArtifact artifact = scaffold(TreeIndex.of(tree));
    List<String> keys = artifact.keys();
    assertEquals(keys.size(), new HashSet<>(keys).size());
    Set<String> testNames = new HashSet<>();
    for (AssertionUnit unit : artifact.assertionUnits()) {
      assertTrue(testNames.add(format.testName(unit)), "duplicate test " + format.testName(unit));
    }
  }

  @Property
  void writtenArtifactReadsBackWithEveryBody(@ForAll("collidingTrees") BranchTree tree)
      throws Exception {
    GeneratedArtifact artifact = scaffold(TreeIndex.of(tree));
    String written = format.render(artifact, EmitOptions.defaults());

    var result =
        new Reconciler(OrphanPolicy.RETAIN)
            .reconcile(artifact, Optional.of(new ArtifactReader().read(written)));
    assertTrue(result.orphans().isEmpty());
    assertEquals(artifact.assertionUnits().size(), result.preservedBodies());
  }

  @Property
  void reorderingSiblingsOrphansNothing(@ForAll("trees") BranchTree tree) throws Exception {
    GeneratedArtifact before = scaffold(TreeIndex.of(tree));
    String written = format.render(before, EmitOptions.defaults());
    GeneratedArtifact after = scaffold(TreeIndex.of(TreeArbitraries.reversed(tree)));

    var result =
        new Reconciler(OrphanPolicy.RETAIN)
            .reconcile(after, Optional.of(new ArtifactReader().read(written)));
    assertTrue(result.orphans().isEmpty());
    assertEquals(after.assertionUnits().size(), result.preservedBodies());
  }
}
