package io.branchtree.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "branchtree",
    description = "Compile branching trees into test scaffolding",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    subcommands = {CompileCommand.class, FmtCommand.class})
public class Main implements Callable<Integer> {
  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.io.branchtree";

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      scope = CommandLine.ScopeType.INHERIT,
      description = "Log pipeline details to stderr")
  private boolean verbose;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    // must happen before the first logger is created
    for (String arg : args) {
      if (arg.equals("-v") || arg.equals("--verbose")) {
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      }
    }
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    spec.commandLine().usage(spec.commandLine().getErr());
    return ExitCodes.INVALID;
  }
}
