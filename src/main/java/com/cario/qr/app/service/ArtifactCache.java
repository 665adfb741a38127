package com.cario.qr.app.service;

import com.cario.qr.app.exception.ArtifactNotFoundException;
import com.cario.qr.app.model.CacheStats;
import com.cario.qr.app.model.GeneratedArtifact;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.log4j.Log4j2;

/**
 * In-memory store of generated artifacts keyed by id.
 *
 * <p>Entries live until removed or the process stops; there is no TTL and no capacity bound. All
 * operations are atomic with respect to each other. {@link #stats()} walks the current entries and
 * is not transactional with concurrent inserts.
 */
@Log4j2
public class ArtifactCache {

  private final ConcurrentMap<String, GeneratedArtifact> entries = new ConcurrentHashMap<>();

  /** Inserts the artifact, replacing any entry with the same id. */
  public void put(GeneratedArtifact artifact) {
    Objects.requireNonNull(artifact, "artifact must not be null");
    GeneratedArtifact previous = entries.put(artifact.getId(), artifact);
    if (previous != null) {
      log.warn("cache.put replaced existing id={}", artifact.getId());
    }
  }

  public Optional<GeneratedArtifact> get(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.get(id));
  }

  /**
   * Returns the cached artifact.
   *
   * @throws ArtifactNotFoundException if nothing is cached under {@code id}
   */
  public GeneratedArtifact require(String id) {
    return get(id).orElseThrow(() -> new ArtifactNotFoundException(id));
  }

  public Optional<GeneratedArtifact> remove(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.remove(id));
  }

  public CacheStats stats() {
    long count = 0;
    long total = 0;
    for (GeneratedArtifact artifact : entries.values()) {
      count++;
      total += artifact.getSizeBytes();
    }
    return CacheStats.of(count, total);
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    int dropped = entries.size();
    entries.clear();
    log.info("cache.clear dropped={}", dropped);
  }
}
