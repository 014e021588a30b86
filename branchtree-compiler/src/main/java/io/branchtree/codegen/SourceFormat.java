package io.branchtree.codegen;

import io.branchtree.artifact.ArtifactTags;
import io.branchtree.artifact.AssertionUnit;
import io.branchtree.artifact.GeneratedArtifact;
import io.branchtree.artifact.OrphanedScenario;
import io.branchtree.artifact.SetupUnit;
import io.branchtree.naming.NamingEngine;
import java.util.List;

/**
 * Shared layout of line-comment based source targets: setup members, then scenario members, then
 * retained orphans as commented blocks, separated by blank lines.
 */
abstract class SourceFormat implements ArtifactFormat {
  private final String memberIndent;

  SourceFormat(String memberIndent) {
    this.memberIndent = memberIndent;
  }

  final String memberIndent() {
    return memberIndent;
  }

  final String bodyIndent() {
    return memberIndent + memberIndent;
  }

  /** Type name derived from the subject, always ending in {@code Test}. */
  static String testTypeName(String subject) {
    String base = NamingEngine.typeName(subject);
    return base.endsWith("Test") ? base : base + "Test";
  }

  abstract void appendSetup(StringBuilder sb, SetupUnit unit, GeneratedArtifact artifact);

  abstract void appendAssertion(StringBuilder sb, AssertionUnit unit);

  final String members(GeneratedArtifact artifact) {
    StringBuilder sb = new StringBuilder();
    for (SetupUnit unit : artifact.setupUnits()) {
      sb.append('\n');
      appendSetup(sb, unit, artifact);
    }
    for (AssertionUnit unit : artifact.assertionUnits()) {
      sb.append('\n');
      appendAssertion(sb, unit);
    }
    for (OrphanedScenario orphan : artifact.retainedOrphans()) {
      sb.append('\n');
      appendOrphan(sb, orphan);
    }
    return sb.toString();
  }

  final void appendBody(StringBuilder sb, AssertionUnit unit) {
    line(sb, bodyIndent() + ArtifactTags.BODY);
    for (String bodyLine : unit.body()) {
      sb.append(bodyLine).append('\n');
    }
    line(sb, bodyIndent() + ArtifactTags.END);
  }

  private void appendOrphan(StringBuilder sb, OrphanedScenario orphan) {
    line(sb, memberIndent + ArtifactTags.ORPHAN + " " + orphan.key());
    for (String bodyLine : orphan.body()) {
      line(sb, bodyLine.isEmpty()
          ? memberIndent + ArtifactTags.COMMENT
          : memberIndent + ArtifactTags.COMMENT + " " + bodyLine);
    }
    line(sb, memberIndent + ArtifactTags.END);
  }

  static void line(StringBuilder sb, String text) {
    sb.append(text).append('\n');
  }
}
