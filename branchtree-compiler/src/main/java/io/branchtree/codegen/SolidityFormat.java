package io.branchtree.codegen;

import io.branchtree.artifact.ArtifactTags;
import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.SetupUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Foundry test contract. Setup units become modifiers; every scenario becomes a {@code test_}
 * function decorated with its chain of modifiers in tree order.
 */
public final class SolidityFormat extends SourceFormat {
  private static final String TEMPLATE = "templates/forge-test.tmpl";

  private final ArtifactTemplate template = ArtifactTemplate.load(TEMPLATE);

  public SolidityFormat() {
    super("    ");
  }

  @Override
  public String id() {
    return "solidity";
  }

  @Override
  public String fileName(String subject) {
    return testTypeName(subject) + ".t.sol";
  }

  @Override
  public String testName(AssertionUnit unit) {
    List<String> parts = new ArrayList<>(unit.identifiers().size() + 1);
    parts.add("test");
    for (String id : unit.identifiers()) {
      parts.add(Character.toUpperCase(id.charAt(0)) + id.substring(1));
    }
    return String.join("_", parts);
  }

  @Override
  public List<String> placeholderBody(String outcome) {
    return List.of(bodyIndent() + "// it should " + outcome);
  }

  @Override
  public String render(GeneratedArtifact artifact, EmitOptions options) {
    return template
        .values()
        .set("SOURCE", options.sourceName())
        .set("PRAGMA", options.solidityPragma())
        .set("TEST_IMPORT", options.solidityTestImport())
        .set("CONTRACT_NAME", testTypeName(artifact.subject()))
        .set("MEMBERS", members(artifact))
        .render();
  }

  @Override
  void appendSetup(StringBuilder sb, SetupUnit unit, GeneratedArtifact artifact) {
    String indent = memberIndent();
    line(sb, indent + ArtifactTags.SETUP + " " + unit.identifier());
    line(sb, indent + "modifier " + unit.identifier() + "() {");
    line(sb, bodyIndent() + "// " + unit.condition());
    line(sb, bodyIndent() + "_;");
    line(sb, indent + "}");
  }

  @Override
  void appendAssertion(StringBuilder sb, AssertionUnit unit) {
    String indent = memberIndent();
    line(sb, indent + ArtifactTags.SCENARIO + " " + unit.key());
    if (unit.chain().isEmpty()) {
      line(sb, indent + "function " + testName(unit) + "() external {");
    } else {
      line(sb, indent + "function " + testName(unit) + "()");
      line(sb, bodyIndent() + "external");
      for (SetupUnit setup : unit.chain()) {
        line(sb, bodyIndent() + setup.identifier());
      }
      line(sb, indent + "{");
    }
    appendBody(sb, unit);
    line(sb, indent + "}");
  }
}
