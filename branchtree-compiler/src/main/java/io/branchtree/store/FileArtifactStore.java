package io.branchtree.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store backed by the generated source files themselves: the previous artifact of a unit
 * is whatever currently sits at its output path.
 *
 * <p>Saving writes a temporary sibling file and moves it into place, so a failed write never
 * leaves a half-written artifact behind.
 */
public final class FileArtifactStore implements ArtifactStore {
  private static final Logger log = LoggerFactory.getLogger(FileArtifactStore.class);

  private final Function<String, Path> locator;

  /**
   * @param locator maps a unit identifier to the path of its artifact
   */
  public FileArtifactStore(Function<String, Path> locator) {
    this.locator = locator;
  }

  @Override
  public Optional<String> load(String unitId) throws IOException {
    Path path = locator.apply(unitId);
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
  }

  @Override
  public void save(String unitId, String content) throws IOException {
    Path target = locator.apply(unitId).toAbsolutePath();
    Path dir = target.getParent();
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    try {
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, replacing in place", target);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
    log.debug("Wrote artifact for {} to {}", unitId, target);
  }
}
