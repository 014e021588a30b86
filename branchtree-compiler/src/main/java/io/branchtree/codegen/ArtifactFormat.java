package io.branchtree.codegen;

import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import java.util.List;
import java.util.Locale;

/** Target language of a generated scaffold. */
public interface ArtifactFormat {

  /** Short name used on the command line and in configuration. */
  String id();

  /** File name of the artifact generated for {@code subject}. */
  String fileName(String subject);

  /** Member name of the test generated for an assertion unit. */
  String testName(AssertionUnit unit);

  /** Body emitted for a scenario nobody has written yet. */
  List<String> placeholderBody(String outcome);

  /** Full source text of the artifact. */
  String render(GeneratedArtifact artifact, EmitOptions options);

  static ArtifactFormat forId(String id) {
    return switch (id.toLowerCase(Locale.ROOT)) {
      case "junit", "java" -> new JUnitFormat();
      case "solidity", "forge", "sol" -> new SolidityFormat();
      default -> throw new IllegalArgumentException(
          "Unknown target: " + id + " (expected junit or solidity)");
    };
  }
}
