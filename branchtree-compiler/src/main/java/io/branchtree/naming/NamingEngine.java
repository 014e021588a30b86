package io.branchtree.naming;

import io.branchtree.tree.Node;
import io.branchtree.tree.NodeKind;
import io.branchtree.tree.TreeIndex;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives deterministic identifiers for the nodes of a tree.
 *
 * <p>A label is split into ASCII words, connective stopwords are dropped and the keyword plus the
 * remaining words are lower-camel-cased: {@code when id is not null} becomes {@code
 * whenIdNotNull}. Two names are produced per node:
 *
 * <ul>
 *   <li>segment: unique among siblings, used in path-identity keys
 *   <li>identifier: unique among all branch nodes, used for emitted setup members
 * </ul>
 *
 * <p>Siblings that collapse to the same name are told apart by their 1-based rank among those
 * siblings, after an underscore: {@code whenIdNull_1}, {@code whenIdNull_2}. Names never contain
 * an underscore otherwise, so a ranked segment cannot meet another sibling's name.
 *
 * <p>A nested branch whose segment is shared with another branch elsewhere in the tree is
 * qualified with its parent's identifier, e.g. {@code whenOwnerGivenPaused}.
 */
public final class NamingEngine {
  private static final Set<String> STOPWORDS = Set.of("a", "an", "the", "is", "are");
  private static final Pattern WORD_SEPARATOR = Pattern.compile("[^A-Za-z0-9]+");
  private static final Pattern MARKS = Pattern.compile("\\p{M}+");
  private static final String RANK_SEPARATOR = "_";

  public Names assign(TreeIndex index) {
    int n = index.size();
    String[] bases = new String[n];
    for (int pos = 0; pos < n; pos++) {
      Node node = index.node(pos);
      bases[pos] = normalize(node.kind(), node.label());
    }

    String[] segments = new String[n];
    assignSegments(index, TreeIndex.ROOT, bases, segments);

    String[] identifiers = new String[n];
    Map<String, Integer> segmentUse = new HashMap<>();
    for (int pos = 0; pos < n; pos++) {
      if (index.node(pos).kind().isBranch()) segmentUse.merge(segments[pos], 1, Integer::sum);
    }

    Set<String> used = new HashSet<>();
    // preorder, so a parent is always named before its children
    for (int pos = 0; pos < n; pos++) {
      if (!index.node(pos).kind().isBranch()) {
        identifiers[pos] = segments[pos];
        continue;
      }
      String id = segments[pos];
      int parent = index.parent(pos);
      if (segmentUse.get(id) > 1 && parent != TreeIndex.ROOT) {
        id = identifiers[parent] + capitalize(segments[pos]);
      }
      String unique = id;
      for (int k = 2; !used.add(unique); k++) {
        unique = id + k;
      }
      identifiers[pos] = unique;
    }
    return new Names(index, segments, identifiers);
  }

  private void assignSegments(TreeIndex index, int parent, String[] bases, String[] segments) {
    List<Integer> kids = index.childrenOf(parent);
    Map<String, Integer> use = new HashMap<>();
    for (int kid : kids) use.merge(bases[kid], 1, Integer::sum);
    Map<String, Integer> rank = new HashMap<>();
    for (int kid : kids) {
      String base = bases[kid];
      segments[kid] =
          use.get(base) > 1 ? base + RANK_SEPARATOR + rank.merge(base, 1, Integer::sum) : base;
      assignSegments(index, kid, bases, segments);
    }
  }

  /** Lower-camel name of a keyword and label with stopwords removed from the label. */
  public static String normalize(NodeKind kind, String label) {
    List<String> parts = new ArrayList<>(words(kind.keyword()));
    for (String w : words(label)) {
      if (!STOPWORDS.contains(w.toLowerCase(Locale.ROOT))) parts.add(w);
    }
    StringBuilder sb = new StringBuilder();
    for (String w : parts) {
      String lower = w.toLowerCase(Locale.ROOT);
      sb.append(sb.length() == 0 ? lower : capitalize(lower));
    }
    return sb.toString();
  }

  /** Upper-camel type name for a free-form subject, e.g. {@code Vault::withdraw} to {@code VaultWithdraw}. */
  public static String typeName(String subject) {
    StringBuilder sb = new StringBuilder();
    for (String w : words(subject)) sb.append(capitalize(w));
    if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) sb.insert(0, 'T');
    return sb.toString();
  }

  static List<String> words(String text) {
    String ascii = MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
    List<String> out = new ArrayList<>();
    for (String w : WORD_SEPARATOR.split(ascii)) {
      if (!w.isEmpty()) out.add(w);
    }
    return out;
  }

  static String capitalize(String s) {
    return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
