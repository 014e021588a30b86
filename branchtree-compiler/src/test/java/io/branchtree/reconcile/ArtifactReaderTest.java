package io.branchtree.reconcile;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ArtifactReaderTest {
  private final ArtifactReader reader = new ArtifactReader();

  private static final String ARTIFACT =
      "class VaultTest {\n"
          + "\n"
          + "  // @branchtree:setup whenPaused\n"
          + "  private void whenPaused() {\n"
          + "  }\n"
          + "\n"
          + "  // @branchtree:scenario whenPaused/itShouldRevert\n"
          + "  @Test\n"
          + "  void whenPaused_itShouldRevert() {\n"
          + "    whenPaused();\n"
          + "    // @branchtree:body\n"
          + "    vault.pause();\n"
          + "\n"
          + "    assertThrows(IllegalStateException.class, vault::withdraw);\n"
          + "    // @branchtree:end\n"
          + "  }\n"
          + "\n"
          + "  // @branchtree:orphan whenActive/itShouldPay\n"
          + "  //     assertEquals(1, vault.paid());\n"
          + "  //\n"
          + "  // @branchtree:end\n"
          + "}\n";

  @Test
  void readsScenarioBodiesVerbatim() throws Exception {
    var previous = reader.read(ARTIFACT);
    assertEquals(2, previous.scenarios().size());
    var live = previous.find("whenPaused/itShouldRevert").orElseThrow();
    assertFalse(live.orphaned());
    assertEquals(7, live.line());
    assertEquals(
        List.of(
            "    vault.pause();", "", "    assertThrows(IllegalStateException.class, vault::withdraw);"),
        live.body());
    assertEquals(List.of("whenPaused/itShouldRevert"), previous.activeKeys());
  }

  @Test
  void readsRetainedOrphansUncommented() throws Exception {
    var orphan = reader.read(ARTIFACT).find("whenActive/itShouldPay").orElseThrow();
    assertTrue(orphan.orphaned());
    assertEquals(List.of("    assertEquals(1, vault.paid());", ""), orphan.body());
  }

  @Test
  void acceptsCrlfAndArtifactsWithoutScenarios() throws Exception {
    assertEquals(2, reader.read(ARTIFACT.replace("\n", "\r\n")).scenarios().size());
    assertTrue(reader.read("class Empty {}\n").scenarios().isEmpty());
  }

  @Test
  void rejectsMissingBodyTag() {
    var text = ARTIFACT.replace("    // @branchtree:body\n", "");
    var e = assertThrows(MalformedArtifactException.class, () -> reader.read(text));
    assertEquals(7, e.line());
  }

  @Test
  void rejectsUnterminatedBody() {
    var text = "  // @branchtree:scenario a/b\n    // @branchtree:body\n    x();\n";
    assertThrows(MalformedArtifactException.class, () -> reader.read(text));
  }

  @Test
  void rejectsBodyRunningIntoNextTag() {
    var text = ARTIFACT.replaceFirst("    // @branchtree:end\n", "");
    assertThrows(MalformedArtifactException.class, () -> reader.read(text));
  }

  @Test
  void rejectsDuplicateKeys() {
    var block =
        "  // @branchtree:scenario a/b\n  // @branchtree:body\n  // @branchtree:end\n";
    var e = assertThrows(MalformedArtifactException.class, () -> reader.read(block + block));
    assertEquals(4, e.line());
  }

  @Test
  void rejectsTagWithoutKey() {
    assertThrows(
        MalformedArtifactException.class,
        () -> reader.read("  // @branchtree:scenario \n  // @branchtree:body\n  // @branchtree:end\n"));
  }

  @Test
  void rejectsUncommentedOrphanLine() {
    var text = ARTIFACT.replace("  //     assertEquals", "      assertEquals");
    var e = assertThrows(MalformedArtifactException.class, () -> reader.read(text));
    assertEquals(19, e.line());
  }
}
