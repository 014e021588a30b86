package io.branchtree.reconcile;

import io.branchtree.naming.Names;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compares the scenario keys of a previous artifact with the current ones.
 *
 * <p>A removed key and an added key of the same length that differ in exactly one segment are
 * reported as a single rename. Keys present on both sides are reported as reordered when they fall
 * outside a longest run that kept its relative order.
 */
public final class DriftDetector {
  private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(Names.KEY_SEPARATOR));

  public List<DriftEntry> compare(List<String> previousKeys, List<String> currentKeys) {
    Set<String> previous = new LinkedHashSet<>(previousKeys);
    Set<String> current = new LinkedHashSet<>(currentKeys);

    List<String> removed = new ArrayList<>();
    for (String key : previous) {
      if (!current.contains(key)) removed.add(key);
    }
    List<String> added = new ArrayList<>();
    for (String key : current) {
      if (!previous.contains(key)) added.add(key);
    }

    Map<String, String> renamedFrom = new HashMap<>();
    Set<String> pairedRemovals = new HashSet<>();
    for (String old : removed) {
      for (String candidate : added) {
        if (!renamedFrom.containsKey(candidate) && differsInOneSegment(old, candidate)) {
          renamedFrom.put(candidate, old);
          pairedRemovals.add(old);
          break;
        }
      }
    }

    Set<String> reordered = reordered(new ArrayList<>(previous), new ArrayList<>(current));

    List<DriftEntry> entries = new ArrayList<>();
    for (String key : current) {
      if (renamedFrom.containsKey(key)) {
        entries.add(new DriftEntry(key, DriftKind.RENAMED, renamedFrom.get(key)));
      } else if (!previous.contains(key)) {
        entries.add(DriftEntry.of(key, DriftKind.ADDED));
      } else if (reordered.contains(key)) {
        entries.add(DriftEntry.of(key, DriftKind.REORDERED));
      }
    }
    for (String key : removed) {
      if (!pairedRemovals.contains(key)) entries.add(DriftEntry.of(key, DriftKind.REMOVED));
    }
    return entries;
  }

  private static boolean differsInOneSegment(String a, String b) {
    String[] left = SEPARATOR.split(a);
    String[] right = SEPARATOR.split(b);
    if (left.length != right.length) return false;
    int diff = 0;
    for (int i = 0; i < left.length; i++) {
      if (!left[i].equals(right[i])) diff++;
    }
    return diff == 1;
  }

  /** Common keys that are not part of a longest order-preserving subsequence. */
  private static Set<String> reordered(List<String> previous, List<String> current) {
    Map<String, Integer> previousPos = new HashMap<>();
    for (int i = 0; i < previous.size(); i++) previousPos.put(previous.get(i), i);
    List<String> common = new ArrayList<>();
    for (String key : current) {
      if (previousPos.containsKey(key)) common.add(key);
    }
    int n = common.size();
    int[] seq = new int[n];
    for (int i = 0; i < n; i++) seq[i] = previousPos.get(common.get(i));

    // patience sorting with back links
    int[] tailIdx = new int[n];
    int[] prev = new int[n];
    int len = 0;
    for (int i = 0; i < n; i++) {
      int lo = 0;
      int hi = len;
      while (lo < hi) {
        int mid = (lo + hi) >>> 1;
        if (seq[tailIdx[mid]] < seq[i]) lo = mid + 1;
        else hi = mid;
      }
      prev[i] = lo > 0 ? tailIdx[lo - 1] : -1;
      tailIdx[lo] = i;
      if (lo == len) len++;
    }
    boolean[] inOrder = new boolean[n];
    for (int i = len > 0 ? tailIdx[len - 1] : -1; i >= 0; i = prev[i]) {
      inOrder[i] = true;
    }
    Set<String> out = new HashSet<>();
    for (int i = 0; i < n; i++) {
      if (!inOrder[i]) out.add(common.get(i));
    }
    return out;
  }
}
