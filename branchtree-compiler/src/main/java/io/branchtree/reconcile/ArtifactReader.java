package io.branchtree.reconcile;

import io.branchtree.artifact.ArtifactTags;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads scenario blocks back from a generated artifact of any target. Only the tags are
 * interpreted; everything outside scenario bodies is regenerated and therefore ignored.
 */
public final class ArtifactReader {

  public PreviousArtifact read(String text) throws MalformedArtifactException {
    String[] lines = text.replace("\r\n", "\n").split("\n", -1);
    List<PreviousArtifact.Scenario> scenarios = new ArrayList<>();
    Set<String> keys = new HashSet<>();
    for (int i = 0; i < lines.length; i++) {
      String tag = lines[i].strip();
      boolean live = isTag(tag, ArtifactTags.SCENARIO);
      boolean orphan = isTag(tag, ArtifactTags.ORPHAN);
      if (!live && !orphan) continue;

      String key = tag.substring((live ? ArtifactTags.SCENARIO : ArtifactTags.ORPHAN).length()).trim();
      if (key.isEmpty()) {
        throw new MalformedArtifactException("scenario tag without a key", i + 1);
      }
      if (!keys.add(key)) {
        throw new MalformedArtifactException("duplicate scenario key " + key, i + 1);
      }
      int start = live ? findBody(lines, i) : i;
      List<String> body = new ArrayList<>();
      int end = start + 1;
      for (; end < lines.length; end++) {
        String current = lines[end].strip();
        if (current.equals(ArtifactTags.END)) break;
        if (current.startsWith(ArtifactTags.PREFIX)) {
          throw new MalformedArtifactException(
              "scenario " + key + " is not terminated before the next tag", end + 1);
        }
        body.add(live ? lines[end] : uncomment(lines[end], end + 1));
      }
      if (end == lines.length) {
        throw new MalformedArtifactException("scenario " + key + " is not terminated", i + 1);
      }
      scenarios.add(new PreviousArtifact.Scenario(key, body, orphan, i + 1));
      i = end;
    }
    return new PreviousArtifact(scenarios);
  }

  private static boolean isTag(String line, String tag) {
    return line.equals(tag) || line.startsWith(tag + " ");
  }

  private static int findBody(String[] lines, int tagLine) throws MalformedArtifactException {
    for (int j = tagLine + 1; j < lines.length; j++) {
      String current = lines[j].strip();
      if (current.equals(ArtifactTags.BODY)) return j;
      if (current.startsWith(ArtifactTags.PREFIX)) break;
    }
    throw new MalformedArtifactException("scenario has no body tag", tagLine + 1);
  }

  private static String uncomment(String line, int lineNo) throws MalformedArtifactException {
    String stripped = line.stripLeading();
    if (!stripped.startsWith(ArtifactTags.COMMENT)) {
      throw new MalformedArtifactException("orphaned body line is not commented out", lineNo);
    }
    String rest = stripped.substring(ArtifactTags.COMMENT.length());
    return rest.startsWith(" ") ? rest.substring(1) : rest;
  }
}
