package io.branchtree.store;

import java.io.IOException;
import java.util.Optional;

/**
 * Previously emitted artifacts keyed by unit-under-test identifier. Passed explicitly to whoever
 * reconciles, so separate compilations never share hidden state.
 */
public interface ArtifactStore {

  /** Last artifact saved for {@code unitId}, if any. */
  Optional<String> load(String unitId) throws IOException;

  /** Replaces the artifact of {@code unitId} as a whole. */
  void save(String unitId, String content) throws IOException;
}
