package io.branchtree.cli;

import io.branchtree.CompilationResult;
import io.branchtree.TreeCompiler;
import io.branchtree.store.ArtifactStore;
import io.branchtree.tree.TreeException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles one tree file. Jobs share no mutable state except the output layout, which hands each
 * artifact path to a single unit, so any number of them can run in parallel.
 *
 * <p>The artifact is saved only when the whole pipeline succeeded; a rejected tree leaves its
 * previous artifact untouched.
 */
final class CompileJob implements Callable<JobOutcome> {
  private static final Logger log = LoggerFactory.getLogger(CompileJob.class);

  private final Path tree;
  private final TreeCompiler compiler;
  private final OutputLayout layout;
  private final ArtifactStore store;
  private final boolean check;

  CompileJob(
      Path tree, TreeCompiler compiler, OutputLayout layout, ArtifactStore store, boolean check) {
    this.tree = tree;
    this.compiler = compiler;
    this.layout = layout;
    this.store = store;
    this.check = check;
  }

  @Override
  public JobOutcome call() {
    String unitId = OutputLayout.unitId(tree);
    Path output = null;
    try {
      String text = Files.readString(tree, StandardCharsets.UTF_8);
      output = layout.assign(tree, compiler.fileNameFor(text));
      Optional<String> previous = store.load(unitId);
      CompilationResult result =
          compiler.compile(String.valueOf(tree.getFileName()), text, previous);

      if (check) {
        JobOutcome.Status status =
            result.report().hasDrift() ? JobOutcome.Status.DRIFT : JobOutcome.Status.CLEAN;
        return new JobOutcome(tree, status, output, result, null);
      }
      if (result.report().artifactStale()) {
        store.save(unitId, result.output());
      } else {
        log.debug("{} is up to date", output);
      }
      return new JobOutcome(tree, JobOutcome.Status.WRITTEN, output, result, null);
    } catch (TreeException e) {
      log.debug("Rejected {}", tree, e);
      return JobOutcome.failed(tree, JobOutcome.Status.INVALID, output, e.getMessage());
    } catch (OutputConflictException e) {
      log.debug("Output conflict for {}", tree, e);
      return JobOutcome.failed(tree, JobOutcome.Status.INVALID, null, e.getMessage());
    } catch (IOException e) {
      log.debug("I/O failure for {}", tree, e);
      return JobOutcome.failed(
          tree, JobOutcome.Status.IO_ERROR, output, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }
}
