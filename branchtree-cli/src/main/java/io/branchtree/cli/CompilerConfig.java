package io.branchtree.cli;

import io.branchtree.codegen.ArtifactFormat;
import io.branchtree.codegen.EmitOptions;
import io.branchtree.reconcile.OrphanPolicy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Compiler settings. Defaults are overlaid by {@code ~/.branchtree/config.properties}, then by
 * {@code .branchtree.properties} in the working directory, then by command line options.
 */
public record CompilerConfig(
    String target,
    String packageName,
    OrphanPolicy orphans,
    int jobs,
    ReportFormat report,
    String solidityPragma,
    String solidityImport) {

  /** Output format of the drift report. */
  public enum ReportFormat {
    /** Human readable lines. */
    TEXT,
    /** One JSON object per line, for CI. */
    JSONL
  }

  static final String USER_CONFIG = ".branchtree/config.properties";
  static final String PROJECT_CONFIG = ".branchtree.properties";

  public static CompilerConfig defaults() {
    return new CompilerConfig(
        "junit",
        "",
        OrphanPolicy.RETAIN,
        Runtime.getRuntime().availableProcessors(),
        ReportFormat.TEXT,
        "^0.8.0",
        "forge-std/Test.sol");
  }

  /**
   * Loads configuration from the user and project files, when present.
   *
   * @param home user home directory
   * @param workingDir directory the compiler runs in
   * @return merged configuration
   * @throws IOException if a file exists but cannot be read
   */
  public static CompilerConfig load(Path home, Path workingDir) throws IOException {
    CompilerConfig config = defaults();
    config = config.overlay(home.resolve(USER_CONFIG));
    config = config.overlay(workingDir.resolve(PROJECT_CONFIG));
    return config;
  }

  public static CompilerConfig load() throws IOException {
    return load(Path.of(System.getProperty("user.home")), Path.of("").toAbsolutePath());
  }

  private CompilerConfig overlay(Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      return this;
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(file)) {
      props.load(reader);
    }
    return withProperties(props);
  }

  /** Copy with every key present in {@code props} replaced; absent keys keep their value. */
  public CompilerConfig withProperties(Properties props) {
    String t = props.getProperty("target", target);
    ArtifactFormat.forId(t); // fail fast on unknown targets
    return new CompilerConfig(
        t,
        props.getProperty("package", packageName).trim(),
        parseEnum(OrphanPolicy.class, props.getProperty("orphans"), orphans),
        parseJobs(props.getProperty("jobs"), jobs),
        parseEnum(ReportFormat.class, props.getProperty("report"), report),
        props.getProperty("solidity.pragma", solidityPragma),
        props.getProperty("solidity.import", solidityImport));
  }

  public ArtifactFormat format() {
    return ArtifactFormat.forId(target);
  }

  public EmitOptions emitOptions() {
    return new EmitOptions(packageName, "tree", solidityPragma, solidityImport);
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid value '" + value + "' for " + type.getSimpleName().toLowerCase(Locale.ROOT), e);
    }
  }

  private static int parseJobs(String value, int fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      int jobs = Integer.parseInt(value.trim());
      if (jobs < 1) {
        throw new IllegalArgumentException("jobs must be at least 1, got " + jobs);
      }
      return jobs;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid jobs value: " + value, e);
    }
  }
}
