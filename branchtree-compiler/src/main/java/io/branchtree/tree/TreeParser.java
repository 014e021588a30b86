package io.branchtree.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parser for the branching tree notation. Supports box-drawing connectors, ASCII connectors and
 * plain space indentation, e.g.:
 *
 * <pre>
 * WithdrawTest
 * ├── when id is null
 * │   └── it should revert
 * └── when id is not null
 *     ├── given fully withdrawn
 *     │   └── it should return DEPLETED
 *     └── given not fully withdrawn
 *         └── it should return ACTIVE
 * </pre>
 *
 * <p>The first non-blank line names the subject. Every other line is one node whose depth comes
 * from the column where its text starts; the first child line fixes the indentation unit.
 */
public final class TreeParser {
  private static final Logger log = LoggerFactory.getLogger(TreeParser.class);

  private static final int TAB_WIDTH = 4;
  // glyphs allowed before the keyword: connectors, continuations and spaces
  private static final String PREFIX_CHARS = " │├└─|+`-";

  private final String[] lines;
  private int unit = -1;

  private TreeParser(String input) {
    this.lines = input.split("\n", -1);
  }

  /**
   * Parses tree text.
   *
   * @param input tree text, any line ending
   * @return the parsed tree
   * @throws MalformedTreeException if the text is not valid notation
   * @throws DanglingLeafException if the root header itself is an outcome
   */
  public static BranchTree parse(String input) throws TreeException {
    return new TreeParser(input).parseTree();
  }

  private BranchTree parseTree() throws TreeException {
    int rootIdx = firstNonBlank(0);
    if (rootIdx < 0) {
      throw new MalformedTreeException("tree is empty", 0);
    }
    String subject = parseRoot(rootIdx);

    List<Builder> top = new ArrayList<>();
    // open[k] is the most recent node at depth k + 1
    List<Builder> open = new ArrayList<>();
    for (int i = rootIdx + 1; i < lines.length; i++) {
      String raw = clean(lines[i]);
      if (raw.isBlank()) continue;
      int lineNo = i + 1;

      int col = labelColumn(raw);
      if (col == raw.length()) continue; // spacer line made of continuation glyphs only
      if (col == 0) {
        throw new MalformedTreeException("only one root line is allowed: '" + raw.trim() + "'", lineNo);
      }
      int depth = depthOf(col, lineNo);
      if (depth > open.size() + 1) {
        throw new MalformedTreeException(
            "inconsistent indentation: depth " + depth + " follows depth " + open.size(), lineNo);
      }
      Builder node = keywordNode(raw.substring(col), lineNo);

      while (open.size() >= depth) {
        open.remove(open.size() - 1);
      }
      if (open.isEmpty()) {
        top.add(node);
      } else {
        open.get(open.size() - 1).children.add(node);
      }
      open.add(node);
    }

    List<Node> children = new ArrayList<>(top.size());
    for (Builder b : top) children.add(b.build());
    log.debug("Parsed tree '{}' with {} top-level branches", subject, children.size());
    return new BranchTree(subject, children, rootIdx + 1);
  }

  private String parseRoot(int idx) throws TreeException {
    String raw = clean(lines[idx]);
    int lineNo = idx + 1;
    if (labelColumn(raw) != 0) {
      throw new MalformedTreeException(
          "root line must start at column 0 without a connector", lineNo);
    }
    String text = normalizeSpace(raw);
    NodeKind kind = keywordOf(text.toLowerCase(Locale.ROOT));
    if (kind == NodeKind.THEN) {
      throw new DanglingLeafException(
          "root line is an outcome; it must name the unit under test", lineNo, List.of());
    }
    if (kind != null) {
      throw new MalformedTreeException(
          "root line must name the unit under test, found condition '" + text + "'", lineNo);
    }
    return text;
  }

  private int depthOf(int col, int lineNo) throws MalformedTreeException {
    if (unit < 0) {
      unit = col;
    }
    if (col % unit != 0) {
      throw new MalformedTreeException(
          "inconsistent indentation: column " + col + " is not a multiple of " + unit, lineNo);
    }
    return col / unit;
  }

  private static Builder keywordNode(String text, int lineNo) throws MalformedTreeException {
    String normalized = normalizeSpace(text);
    NodeKind kind = keywordOf(normalized.toLowerCase(Locale.ROOT));
    if (kind == null) {
      throw new MalformedTreeException(
          "expected 'when', 'given' or 'it should' but found '" + normalized + "'", lineNo);
    }
    String label = normalized.substring(kind.keyword().length()).trim();
    if (label.isEmpty()) {
      throw new MalformedTreeException("'" + kind.keyword() + "' without a label", lineNo);
    }
    return new Builder(kind, label, lineNo);
  }

  /** Kind whose keyword starts the given lowercase text, or null. */
  static NodeKind keywordOf(String lower) {
    for (NodeKind kind : NodeKind.values()) {
      String kw = kind.keyword();
      if (lower.equals(kw) || lower.startsWith(kw + " ")) {
        return kind;
      }
    }
    return null;
  }

  private static int labelColumn(String line) {
    int i = 0;
    while (i < line.length() && PREFIX_CHARS.indexOf(line.charAt(i)) >= 0) {
      i++;
    }
    return i;
  }

  private int firstNonBlank(int from) {
    for (int i = from; i < lines.length; i++) {
      if (!lines[i].isBlank()) return i;
    }
    return -1;
  }

  private static String clean(String line) {
    String s = line.replace("\t", " ".repeat(TAB_WIDTH));
    return s.stripTrailing();
  }

  static String normalizeSpace(String text) {
    return text.trim().replaceAll("\\s+", " ");
  }

  private static final class Builder {
    final NodeKind kind;
    final String label;
    final int line;
    final List<Builder> children = new ArrayList<>();

    Builder(NodeKind kind, String label, int line) {
      this.kind = kind;
      this.label = label;
      this.line = line;
    }

    Node build() {
      List<Node> built = new ArrayList<>(children.size());
      for (Builder c : children) built.add(c.build());
      return new Node(kind, label, built, line);
    }
  }
}
