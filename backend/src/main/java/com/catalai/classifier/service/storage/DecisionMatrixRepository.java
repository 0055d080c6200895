package com.catalai.classifier.service.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.service.matrix.MatrixVersions;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only store of decision matrix versions plus the pointer naming the active one.
 *
 * <p>Publishing writes the new version document first and the pointer second, under a write
 * lock. Readers take the read lock, so they see either the old or the new active version and
 * never a version whose document is not yet written. The {@code active} flag of a returned matrix
 * is derived from the pointer; stored documents are never rewritten.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class DecisionMatrixRepository {

  static final String VERSIONS_PREFIX = "decision-matrix/versions/";
  static final String ACTIVE_POINTER = "decision-matrix/active.json";

  private final IJsonStorage storage;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private Cache<String, DecisionMatrix> versionCache;
  private volatile String activeVersion;

  @PostConstruct
  public void init() {
    versionCache =
        CacheBuilder.newBuilder()
            .maximumSize(applicationProperties.getCache().getMaxSize())
            .expireAfterAccess(
                applicationProperties.getCache().getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
            .build();
    activeVersion = storage.read(ACTIVE_POINTER, ActivePointer.class).map(ActivePointer::getVersion).orElse(null);
    log.info("Decision matrix store ready, active version: {}", activeVersion);
  }

  public Optional<DecisionMatrix> getActiveMatrix() {
    lock.readLock().lock();
    try {
      return activeVersion == null ? Optional.empty() : load(activeVersion);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<String> getActiveVersion() {
    return Optional.ofNullable(activeVersion);
  }

  public Optional<DecisionMatrix> getMatrixVersion(String version) {
    if (!MatrixVersions.isValid(version)) {
      return Optional.empty();
    }
    lock.readLock().lock();
    try {
      return load(version);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** All stored versions, oldest first. */
  public List<String> listMatrixVersions() {
    return storage.list(VERSIONS_PREFIX).stream()
        .map(key -> key.substring(key.lastIndexOf('/') + 1))
        .filter(name -> name.endsWith(".json"))
        .map(name -> name.substring(0, name.length() - ".json".length()))
        .filter(MatrixVersions::isValid)
        .sorted(MatrixVersions.ORDER)
        .collect(Collectors.toList());
  }

  /**
   * Publishes {@code draft} as the version after the newest stored one and makes it active.
   *
   * @return the published matrix with its allocated version
   */
  public DecisionMatrix saveNewMatrixVersion(DecisionMatrix draft, boolean majorBump) {
    lock.writeLock().lock();
    try {
      List<String> versions = listMatrixVersions();
      String latest = versions.isEmpty() ? null : versions.get(versions.size() - 1);
      String next = MatrixVersions.next(latest, majorBump);
      Instant now = Instant.now();

      DecisionMatrix stored =
          copy(draft).toBuilder()
              .version(next)
              .createdAt(draft.getCreatedAt() != null ? draft.getCreatedAt() : now)
              .active(true)
              .previousVersion(activeVersion)
              .build();

      storage.write(versionKey(next), stored);
      storage.write(ACTIVE_POINTER, new ActivePointer(next, now));
      versionCache.put(next, stored);
      activeVersion = next;

      log.info(
          "Published decision matrix {} (previous: {}, rules: {})",
          next,
          stored.getPreviousVersion(),
          stored.getRules().size());
      return copy(stored);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Optional<DecisionMatrix> load(String version) {
    DecisionMatrix cached = versionCache.getIfPresent(version);
    if (cached == null) {
      Optional<DecisionMatrix> read = storage.read(versionKey(version), DecisionMatrix.class);
      if (read.isEmpty()) {
        return Optional.empty();
      }
      cached = read.get();
      versionCache.put(version, cached);
    }
    DecisionMatrix result = copy(cached);
    result.setActive(version.equals(activeVersion));
    return Optional.of(result);
  }

  private DecisionMatrix copy(DecisionMatrix matrix) {
    return objectMapper.convertValue(matrix, DecisionMatrix.class);
  }

  private static String versionKey(String version) {
    return VERSIONS_PREFIX + version + ".json";
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ActivePointer {
    private String version;
    private Instant updatedAt;
  }
}
