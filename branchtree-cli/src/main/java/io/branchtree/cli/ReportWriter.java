package io.branchtree.cli;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.branchtree.CompilationResult;
import io.branchtree.artifact.OrphanedScenario;
import io.branchtree.reconcile.DriftEntry;
import io.branchtree.reconcile.DriftReport;
import java.io.PrintWriter;

/** Prints job outcomes and their drift reports as text or as JSON lines. */
final class ReportWriter {
  private final Gson gson = new Gson();
  private final CompilerConfig.ReportFormat format;
  private final PrintWriter out;
  private final PrintWriter err;

  ReportWriter(CompilerConfig.ReportFormat format, PrintWriter out, PrintWriter err) {
    this.format = format;
    this.out = out;
    this.err = err;
  }

  void write(JobOutcome outcome) {
    switch (format) {
      case TEXT -> writeText(outcome);
      case JSONL -> writeJson(outcome);
    }
    out.flush();
    err.flush();
  }

  private void writeText(JobOutcome outcome) {
    String name = String.valueOf(outcome.tree());
    CompilationResult result = outcome.result();
    if (result == null) {
      err.println(name + ": " + outcome.error());
      return;
    }
    DriftReport report = result.report();
    var reconciliation = result.reconciliation();
    String summary =
        reconciliation.artifact().setupUnits().size()
            + " setup units, "
            + reconciliation.artifact().assertionUnits().size()
            + " scenarios, "
            + reconciliation.preservedBodies()
            + " bodies preserved";
    switch (outcome.status()) {
      case WRITTEN -> out.println(
          name + ": " + (report.artifactStale() ? "wrote " : "unchanged ") + outcome.output()
              + " (" + summary + ")");
      case CLEAN -> out.println(name + ": up to date (" + summary + ")");
      case DRIFT -> out.println(name + ": drift detected against " + outcome.output());
      default -> out.println(name + ": " + outcome.status());
    }
    if (report.formattingDrift()) {
      out.println("  tree text is not in canonical form (run 'branchtree fmt')");
    }
    if (outcome.status() == JobOutcome.Status.DRIFT && report.artifactStale()) {
      out.println("  generated artifact is missing or out of date");
    }
    for (DriftEntry entry : report.entries()) {
      out.println("  " + entry);
    }
    for (OrphanedScenario orphan : report.orphans()) {
      out.println(
          "  ORPHANED "
              + orphan.key()
              + (reconciliation.artifact().retainedOrphans().contains(orphan)
                  ? " (kept as comment)"
                  : " (dropped)"));
    }
  }

  private void writeJson(JobOutcome outcome) {
    String name = String.valueOf(outcome.tree());
    JsonObject summary = new JsonObject();
    summary.addProperty("type", "summary");
    summary.addProperty("tree", name);
    summary.addProperty("status", outcome.status().name());
    if (outcome.output() != null) summary.addProperty("output", String.valueOf(outcome.output()));
    if (outcome.error() != null) summary.addProperty("error", outcome.error());
    CompilationResult result = outcome.result();
    if (result != null) {
      DriftReport report = result.report();
      summary.addProperty("formattingDrift", report.formattingDrift());
      summary.addProperty("artifactStale", report.artifactStale());
      summary.addProperty(
          "setupUnits", result.reconciliation().artifact().setupUnits().size());
      summary.addProperty(
          "scenarios", result.reconciliation().artifact().assertionUnits().size());
      summary.addProperty("preservedBodies", result.reconciliation().preservedBodies());
    }
    out.println(gson.toJson(summary));
    if (result == null) return;

    for (DriftEntry entry : result.report().entries()) {
      JsonObject json = new JsonObject();
      json.addProperty("type", "drift");
      json.addProperty("tree", name);
      json.addProperty("pathIdentity", entry.pathIdentity());
      json.addProperty("kind", entry.kind().name());
      if (entry.previousIdentity() != null) {
        json.addProperty("previousIdentity", entry.previousIdentity());
      }
      out.println(gson.toJson(json));
    }
    for (OrphanedScenario orphan : result.report().orphans()) {
      JsonObject json = new JsonObject();
      json.addProperty("type", "orphan");
      json.addProperty("tree", name);
      json.addProperty("pathIdentity", orphan.key());
      json.addProperty("carried", orphan.carried());
      json.addProperty("bodyLines", orphan.body().size());
      out.println(gson.toJson(json));
    }
  }
}
