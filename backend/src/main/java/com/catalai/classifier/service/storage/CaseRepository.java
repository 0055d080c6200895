package com.catalai.classifier.service.storage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.catalai.classifier.dto.process.ClassificationCase;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
@RequiredArgsConstructor
public class CaseRepository {

  static final String PREFIX = "sessions/";

  private final IJsonStorage storage;

  public ClassificationCase save(ClassificationCase classificationCase) {
    classificationCase.setUpdatedAt(Instant.now());
    storage.write(key(classificationCase.getCaseId()), classificationCase);
    return classificationCase;
  }

  public Optional<ClassificationCase> findById(String caseId) {
    if (caseId == null || !caseId.matches("[A-Za-z0-9-]+")) {
      return Optional.empty();
    }
    return storage.read(key(caseId), ClassificationCase.class);
  }

  public List<ClassificationCase> findAll() {
    return storage.list(PREFIX).stream()
        .map(k -> storage.read(k, ClassificationCase.class))
        .flatMap(Optional::stream)
        .collect(Collectors.toList());
  }

  /** Cases created within {@code [start, end]}; a null bound is open. */
  public List<ClassificationCase> loadCasesInRange(Instant start, Instant end) {
    return findAll().stream()
        .filter(c -> c.getCreatedAt() != null)
        .filter(c -> start == null || !c.getCreatedAt().isBefore(start))
        .filter(c -> end == null || !c.getCreatedAt().isAfter(end))
        .collect(Collectors.toList());
  }

  private static String key(String caseId) {
    return PREFIX + caseId + ".json";
  }
}
