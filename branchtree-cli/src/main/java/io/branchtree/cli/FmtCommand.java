package io.branchtree.cli;

import io.branchtree.tree.CanonicalRenderer;
import io.branchtree.tree.TreeException;
import io.branchtree.tree.TreeParser;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "fmt",
    description = "Rewrite tree files in canonical form",
    mixinStandardHelpOptions = true)
public class FmtCommand implements Callable<Integer> {
  private static final Logger log = LoggerFactory.getLogger(FmtCommand.class);

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(arity = "1..*", paramLabel = "<tree-file>", description = "Tree files")
  private List<Path> trees;

  @CommandLine.Option(
      names = "--check",
      description = "Only report files that are not canonical; exit 2 if any")
  private boolean check;

  private final CanonicalRenderer renderer = new CanonicalRenderer();

  @Override
  public Integer call() {
    PrintWriter stdout = spec.commandLine().getOut();
    PrintWriter stderr = spec.commandLine().getErr();
    int exit = ExitCodes.OK;
    for (Path tree : trees) {
      try {
        String text = Files.readString(tree, StandardCharsets.UTF_8);
        String canonical = renderer.render(TreeParser.parse(text));
        if (canonical.equals(text.replace("\r\n", "\n"))) {
          log.debug("{} is canonical", tree);
          continue;
        }
        if (check) {
          stdout.println(tree + ": not in canonical form");
          exit = CompileCommand.worse(exit, ExitCodes.DRIFT);
        } else {
          Files.writeString(tree, canonical, StandardCharsets.UTF_8);
          stdout.println(tree + ": formatted");
        }
      } catch (TreeException e) {
        stderr.println(tree + ": " + e.getMessage());
        exit = CompileCommand.worse(exit, ExitCodes.INVALID);
      } catch (IOException e) {
        stderr.println(tree + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
        exit = CompileCommand.worse(exit, ExitCodes.IO_ERROR);
      }
    }
    stdout.flush();
    stderr.flush();
    return exit;
  }
}
