package com.catalai.classifier.service.storage;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.catalai.classifier.dto.learning.LearningAnalysis;
import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.ValidationResult;

import lombok.RequiredArgsConstructor;

/** Analyses, suggestions and validation results produced by the learning engine. */
@Repository
@RequiredArgsConstructor
public class LearningRepository {

  static final String ANALYSES = "learning/analyses/";
  static final String SUGGESTIONS = "learning/suggestions/";
  static final String VALIDATIONS = "learning/validations/";

  private final IJsonStorage storage;

  public LearningAnalysis saveAnalysis(LearningAnalysis analysis) {
    storage.write(ANALYSES + analysis.getId() + ".json", analysis);
    return analysis;
  }

  public Optional<LearningAnalysis> findAnalysis(String id) {
    return safeId(id) ? storage.read(ANALYSES + id + ".json", LearningAnalysis.class) : Optional.empty();
  }

  /** Most recent first. */
  public List<LearningAnalysis> findAllAnalyses() {
    return readAll(ANALYSES, LearningAnalysis.class).stream()
        .sorted(
            Comparator.comparing(
                    LearningAnalysis::getAnalyzedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .reversed())
        .collect(Collectors.toList());
  }

  public LearningSuggestion saveSuggestion(LearningSuggestion suggestion) {
    storage.write(SUGGESTIONS + suggestion.getId() + ".json", suggestion);
    return suggestion;
  }

  public Optional<LearningSuggestion> findSuggestion(String id) {
    return safeId(id)
        ? storage.read(SUGGESTIONS + id + ".json", LearningSuggestion.class)
        : Optional.empty();
  }

  /** Most recent first. */
  public List<LearningSuggestion> findAllSuggestions() {
    return readAll(SUGGESTIONS, LearningSuggestion.class).stream()
        .sorted(
            Comparator.comparing(
                    LearningSuggestion::getCreatedAt,
                    Comparator.nullsLast(Comparator.naturalOrder()))
                .reversed())
        .collect(Collectors.toList());
  }

  public ValidationResult saveValidation(ValidationResult result) {
    storage.write(VALIDATIONS + result.getTestId() + ".json", result);
    return result;
  }

  public Optional<ValidationResult> findValidation(String testId) {
    return safeId(testId)
        ? storage.read(VALIDATIONS + testId + ".json", ValidationResult.class)
        : Optional.empty();
  }

  private <T> List<T> readAll(String prefix, Class<T> type) {
    return storage.list(prefix).stream()
        .map(k -> storage.read(k, type))
        .flatMap(Optional::stream)
        .collect(Collectors.toList());
  }

  private static boolean safeId(String id) {
    return id != null && id.matches("[A-Za-z0-9-]+");
  }
}
