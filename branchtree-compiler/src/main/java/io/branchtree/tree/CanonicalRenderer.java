package io.branchtree.tree;

import java.util.List;

/**
 * Serializes a tree in the single canonical style: box-drawing connectors, four-column
 * indentation, lowercase keywords, original sibling order, {@code \n} line endings and a trailing
 * newline.
 */
public final class CanonicalRenderer {
  private static final String BRANCH = "├── ";
  private static final String LAST = "└── ";
  private static final String PIPE = "│   ";
  private static final String SPACE = "    ";

  public String render(BranchTree tree) {
    StringBuilder sb = new StringBuilder();
    sb.append(tree.subject()).append('\n');
    renderChildren(tree.children(), "", sb);
    return sb.toString();
  }

  private static void renderChildren(List<Node> children, String prefix, StringBuilder sb) {
    for (int i = 0; i < children.size(); i++) {
      boolean last = i == children.size() - 1;
      Node child = children.get(i);
      sb.append(prefix).append(last ? LAST : BRANCH).append(child.text()).append('\n');
      renderChildren(child.children(), prefix + (last ? SPACE : PIPE), sb);
    }
  }

  /**
   * Whether {@code text} is already in canonical form. Line endings are normalized first so a
   * checkout with CRLF endings is not reported as drift.
   *
   * @throws TreeException if the text does not parse
   */
  public boolean isCanonical(String text) throws TreeException {
    String normalized = text.replace("\r\n", "\n");
    return normalized.equals(render(TreeParser.parse(normalized)));
  }
}
