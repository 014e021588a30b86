package io.branchtree.cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides where the artifact of each tree goes and remembers the decision per unit, so it can act
 * as the locator of a {@link io.branchtree.store.FileArtifactStore}.
 *
 * <p>With no {@code --out} the artifact sits next to its tree. With {@code --out} and a single
 * tree it is the artifact file itself; with several trees it is a directory.
 *
 * <p>Each artifact path belongs to the first tree assigned to it. Another tree that maps to the same
 * path, e.g. a second tree with the same subject, is refused.
 */
final class OutputLayout {
  private final Path out;
  private final boolean outIsFile;
  private final Map<String, Path> assigned = new ConcurrentHashMap<>();
  private final Map<Path, String> owners = new ConcurrentHashMap<>();

  OutputLayout(Path out, int treeCount) {
    this.out = out;
    this.outIsFile = out != null && treeCount == 1;
  }

  static String unitId(Path tree) {
    return tree.toAbsolutePath().normalize().toString();
  }

  /**
   * Assigns the artifact path of a tree.
   *
   * @throws OutputConflictException if another tree already owns that path
   */
  Path assign(Path tree, String fileName) throws OutputConflictException {
    Path target;
    if (out == null) {
      Path dir = tree.toAbsolutePath().getParent();
      target = dir.resolve(fileName);
    } else if (outIsFile) {
      target = out;
    } else {
      target = out.resolve(fileName);
    }
    String unit = unitId(tree);
    String owner = owners.putIfAbsent(target.toAbsolutePath().normalize(), unit);
    if (owner != null && !owner.equals(unit)) {
      throw new OutputConflictException(
          "output " + target.toAbsolutePath() + " is already the output of " + owner);
    }
    assigned.put(unit, target);
    return target;
  }

  /** Artifact path assigned to a unit, or throws if the unit was never assigned. */
  Path pathOf(String unitId) {
    Path path = assigned.get(unitId);
    if (path == null) {
      throw new IllegalStateException("No output assigned for " + unitId);
    }
    return path;
  }
}
