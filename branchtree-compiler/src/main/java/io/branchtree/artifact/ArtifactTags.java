package io.branchtree.artifact;

/**
 * Machine-readable comment tags embedded in generated artifacts. Every supported target language
 * accepts {@code //} line comments, so the same tags work for all of them.
 */
public final class ArtifactTags {
  private ArtifactTags() {}

  public static final String PREFIX = "// @branchtree:";
  public static final String SETUP = PREFIX + "setup";
  public static final String SCENARIO = PREFIX + "scenario";
  public static final String BODY = PREFIX + "body";
  public static final String END = PREFIX + "end";
  public static final String ORPHAN = PREFIX + "orphan";

  /** Prefix of each body line of a retained orphan, after the member indentation. */
  public static final String COMMENT = "//";
}
