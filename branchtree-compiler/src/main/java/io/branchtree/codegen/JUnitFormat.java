package io.branchtree.codegen;

import io.branchtree.artifact.ArtifactTags;
import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.SetupUnit;
import java.util.List;
import java.util.Optional;

/**
 * JUnit 5 test class. Setup units become private methods; every scenario becomes a {@code @Test}
 * method that calls its chain in tree order before the body.
 */
public final class JUnitFormat extends SourceFormat {
  private static final String TEMPLATE = "templates/junit-test.tmpl";

  private final ArtifactTemplate template = ArtifactTemplate.load(TEMPLATE);

  public JUnitFormat() {
    super("  ");
  }

  @Override
  public String id() {
    return "junit";
  }

  @Override
  public String fileName(String subject) {
    return testTypeName(subject) + ".java";
  }

  @Override
  public String testName(AssertionUnit unit) {
    return String.join("_", unit.identifiers());
  }

  @Override
  public List<String> placeholderBody(String outcome) {
    return List.of(bodyIndent() + "fail(\"not implemented: it should " + escape(outcome) + "\");");
  }

  @Override
  public String render(GeneratedArtifact artifact, EmitOptions options) {
    String pkg = options.packageName();
    return template
        .values()
        .set("SOURCE", options.sourceName())
        .set("PACKAGE_DECLARATION", pkg.isEmpty() ? "" : "\npackage " + pkg + ";\n")
        .set("CLASS_NAME", testTypeName(artifact.subject()))
        .set("MEMBERS", members(artifact))
        .render();
  }

  @Override
  void appendSetup(StringBuilder sb, SetupUnit unit, GeneratedArtifact artifact) {
    String indent = memberIndent();
    Optional<SetupUnit> parent = artifact.parentOf(unit);
    line(sb, indent + ArtifactTags.SETUP + " " + unit.identifier());
    line(
        sb,
        indent
            + "/** "
            + javadoc(unit.condition())
            + parent.map(p -> "; runs after {@link #" + p.identifier() + "()}").orElse("")
            + ". */");
    line(sb, indent + "private void " + unit.identifier() + "() {");
    line(sb, bodyIndent() + "// establish: " + unit.condition());
    line(sb, indent + "}");
  }

  @Override
  void appendAssertion(StringBuilder sb, AssertionUnit unit) {
    String indent = memberIndent();
    line(sb, indent + ArtifactTags.SCENARIO + " " + unit.key());
    line(sb, indent + "@Test");
    line(sb, indent + "void " + testName(unit) + "() {");
    for (SetupUnit setup : unit.chain()) {
      line(sb, bodyIndent() + setup.identifier() + "();");
    }
    appendBody(sb, unit);
    line(sb, indent + "}");
  }

  private static String escape(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private static String javadoc(String text) {
    return text.replace("*/", "*&#47;");
  }
}
