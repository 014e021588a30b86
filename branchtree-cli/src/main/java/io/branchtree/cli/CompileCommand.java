package io.branchtree.cli;

import io.branchtree.TreeCompiler;
import io.branchtree.reconcile.OrphanPolicy;
import io.branchtree.store.ArtifactStore;
import io.branchtree.store.FileArtifactStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "compile",
    description = "Generate test scaffolding from branching tree files",
    mixinStandardHelpOptions = true)
public class CompileCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(arity = "1..*", paramLabel = "<tree-file>", description = "Tree files")
  private List<Path> trees;

  @CommandLine.Option(
      names = "--check",
      description = "Report drift without writing anything; exit 2 when drift is found")
  private boolean check;

  @CommandLine.Option(
      names = {"-o", "--out"},
      description = "Output file (one tree) or directory (several trees)")
  private Path out;

  @CommandLine.Option(
      names = {"-t", "--target"},
      description = "Target: junit or solidity")
  private String target;

  @CommandLine.Option(
      names = {"-p", "--package"},
      description = "Java package of generated test classes")
  private String packageName;

  @CommandLine.Option(
      names = "--prune-orphans",
      description = "Drop scenarios that no longer exist instead of keeping them as comments")
  private boolean pruneOrphans;

  @CommandLine.Option(names = "--report", description = "Report format: text or jsonl")
  private String report;

  @CommandLine.Option(
      names = {"-j", "--jobs"},
      description = "Number of trees compiled in parallel")
  private Integer jobs;

  /** Configuration before command line options apply. */
  interface ConfigSource {
    CompilerConfig load() throws IOException;
  }

  /** Replaced in tests to avoid reading the user's files. */
  ConfigSource configSource = CompilerConfig::load;

  @Override
  public Integer call() throws Exception {
    PrintWriter stdout = spec.commandLine().getOut();
    PrintWriter stderr = spec.commandLine().getErr();
    CompilerConfig config;
    try {
      config = effectiveConfig();
    } catch (IllegalArgumentException e) {
      stderr.println("Error: " + e.getMessage());
      return ExitCodes.INVALID;
    } catch (IOException e) {
      log.debug("Cannot read configuration", e);
      stderr.println("Error: cannot read configuration: " + e.getMessage());
      return ExitCodes.IO_ERROR;
    }

    TreeCompiler compiler =
        new TreeCompiler(config.format(), config.emitOptions(), config.orphans());
    OutputLayout layout = new OutputLayout(out, trees.size());
    ArtifactStore store = new FileArtifactStore(layout::pathOf);
    ReportWriter writer = new ReportWriter(config.report(), stdout, stderr);

    List<JobOutcome> outcomes = runAll(compiler, layout, store, config.jobs());
    int exit = ExitCodes.OK;
    for (JobOutcome outcome : outcomes) {
      writer.write(outcome);
      exit = worse(exit, outcome.exitCode());
    }
    log.debug("Compiled {} trees, exit code {}", outcomes.size(), exit);
    return exit;
  }

  private List<JobOutcome> runAll(
      TreeCompiler compiler, OutputLayout layout, ArtifactStore store, int jobCount)
      throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(Math.min(jobCount, trees.size()));
    List<Future<JobOutcome>> futures = new ArrayList<>(trees.size());
    try {
      for (Path tree : trees) {
        futures.add(executor.submit(new CompileJob(tree, compiler, layout, store, check)));
      }
      List<JobOutcome> outcomes = new ArrayList<>(futures.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(futures.get(i), trees.get(i)));
      }
      return outcomes;
    } catch (InterruptedException e) {
      for (Future<JobOutcome> f : futures) f.cancel(true);
      throw e;
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Outcome of a submitted job. Jobs report tree and file problems themselves, so an exception
   * escaping one is an unexpected failure: nothing was written for its tree and it counts as
   * {@link ExitCodes#IO_ERROR}.
   */
  static JobOutcome await(Future<JobOutcome> future, Path tree) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof UncheckedIOException unchecked) {
        cause = unchecked.getCause();
      }
      log.debug("Job for {} failed", tree, cause);
      return JobOutcome.failed(
          tree,
          JobOutcome.Status.IO_ERROR,
          null,
          cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
  }

  /** Exit codes ranked by severity: I/O failure, then invalid input, then drift. */
  static int worse(int a, int b) {
    return rank(b) > rank(a) ? b : a;
  }

  private static int rank(int code) {
    return switch (code) {
      case ExitCodes.IO_ERROR -> 3;
      case ExitCodes.INVALID -> 2;
      case ExitCodes.DRIFT -> 1;
      default -> 0;
    };
  }

  CompilerConfig effectiveConfig() throws IOException {
    CompilerConfig config = configSource.load();
    Properties overrides = new Properties();
    if (target != null) overrides.setProperty("target", target);
    if (packageName != null) overrides.setProperty("package", packageName);
    if (pruneOrphans) overrides.setProperty("orphans", OrphanPolicy.PRUNE.name());
    if (report != null) overrides.setProperty("report", report);
    if (jobs != null) overrides.setProperty("jobs", String.valueOf(jobs));
    return config.withProperties(overrides);
  }
}
