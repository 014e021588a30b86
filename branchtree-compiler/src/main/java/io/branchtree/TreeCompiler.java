package io.branchtree;

import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.codegen.ArtifactFormat;
import io.branchtree.codegen.EmitOptions;
import io.branchtree.codegen.ScaffoldGenerator;
import io.branchtree.naming.NamingEngine;
import io.branchtree.naming.Names;
import io.branchtree.paths.PathEnumerator;
import io.branchtree.paths.ScenarioPath;
import io.branchtree.reconcile.ArtifactReader;
import io.branchtree.reconcile.DriftReport;
import io.branchtree.reconcile.OrphanPolicy;
import io.branchtree.reconcile.PreviousArtifact;
import io.branchtree.reconcile.Reconciler;
import io.branchtree.reconcile.Reconciliation;
import io.branchtree.tree.BranchTree;
import io.branchtree.tree.CanonicalRenderer;
import io.branchtree.tree.Node;
import io.branchtree.tree.TreeException;
import io.branchtree.tree.TreeIndex;
import io.branchtree.tree.TreeParser;
import io.branchtree.tree.TreeValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline for one tree: parse, validate, name, generate, reconcile, render.
 *
 * <p>Instances hold configuration only and can be shared by concurrent compilations of different
 * trees.
 */
public final class TreeCompiler {
  private static final Logger log = LoggerFactory.getLogger(TreeCompiler.class);

  private final ArtifactFormat format;
  private final EmitOptions options;
  private final OrphanPolicy orphanPolicy;

  private final TreeValidator validator = new TreeValidator();
  private final CanonicalRenderer renderer = new CanonicalRenderer();
  private final NamingEngine namingEngine = new NamingEngine();
  private final ArtifactReader reader = new ArtifactReader();

  public TreeCompiler(ArtifactFormat format, EmitOptions options, OrphanPolicy orphanPolicy) {
    this.format = format;
    this.options = options;
    this.orphanPolicy = orphanPolicy;
  }

  public ArtifactFormat format() {
    return format;
  }

  /**
   * File name the artifact of {@code treeText} gets in this compiler's target.
   *
   * @throws TreeException if the tree text does not parse
   */
  public String fileNameFor(String treeText) throws TreeException {
    return format.fileName(TreeParser.parse(treeText.replace("\r\n", "\n")).subject());
  }

  /**
   * Compiles one tree.
   *
   * @param sourceName tree file name, used in the artifact header and the report
   * @param treeText tree text
   * @param previousArtifact text of the artifact written by an earlier run, if any
   * @throws TreeException if the tree or the previous artifact cannot be used; nothing should be
   *     written in that case
   */
  public CompilationResult compile(
      String sourceName, String treeText, Optional<String> previousArtifact)
      throws TreeException {
    String text = treeText.replace("\r\n", "\n");
    BranchTree tree = validator.validate(TreeParser.parse(text));
    String canonical = renderer.render(tree);

    TreeIndex index = TreeIndex.of(tree);
    Names names = namingEngine.assign(index);
    PathEnumerator paths = new PathEnumerator(index);
    List<String> keys = new ArrayList<>();
    List<List<Node>> scenarios = new ArrayList<>();
    for (ScenarioPath path : paths) {
      keys.add(names.key(path));
      scenarios.add(path.nodes());
    }
    validator.checkKeys(keys, scenarios);
    GeneratedArtifact fresh = new ScaffoldGenerator(format).generate(names, paths);

    Optional<PreviousArtifact> previous = Optional.empty();
    if (previousArtifact.isPresent()) {
      previous = Optional.of(reader.read(previousArtifact.get()));
    }
    Reconciliation merged = new Reconciler(orphanPolicy).reconcile(fresh, previous);
    String output = format.render(merged.artifact(), options.withSourceName(sourceName));

    boolean stale =
        previousArtifact.map(p -> !p.replace("\r\n", "\n").equals(output)).orElse(true);
    DriftReport report =
        new DriftReport(
            sourceName, !canonical.equals(text), stale, merged.drift(), merged.orphans());
    log.debug(
        "Compiled {}: {} setup units, {} scenarios, drift={}",
        sourceName,
        fresh.setupUnits().size(),
        fresh.assertionUnits().size(),
        report.hasDrift());
    return new CompilationResult(
        tree, canonical, merged, output, format.fileName(tree.subject()), report);
  }
}
