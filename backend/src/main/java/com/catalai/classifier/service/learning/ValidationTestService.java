package com.catalai.classifier.service.learning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.learning.ValidationCaseResult;
import com.catalai.classifier.dto.learning.ValidationResult;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.matrix.DecisionMatrixEvaluator;
import com.catalai.classifier.service.matrix.DecisionMatrixService;
import com.catalai.classifier.service.storage.CaseRepository;
import com.catalai.classifier.service.storage.LearningRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Replays a random sample of misclassified cases through the rule evaluator with the active
 * matrix. No LLM calls are made: each case keeps its stored attributes and its original
 * classification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationTestService {

  private final CaseRepository caseRepository;
  private final LearningRepository learningRepository;
  private final DecisionMatrixService decisionMatrixService;
  private final DecisionMatrixEvaluator evaluator;
  private final AuditLogService auditLogService;
  private final ApplicationProperties applicationProperties;

  private final Random random = new Random();

  public ValidationResult validate(Instant startDate, Instant endDate) {
    List<ClassificationCase> population =
        caseRepository.loadCasesInRange(startDate, endDate).stream()
            .filter(ClassificationCase::isMisclassified)
            .collect(Collectors.toList());
    DecisionMatrix matrix = decisionMatrixService.getActiveMatrix();
    int sampleSize = sampleSize(population.size());
    List<ClassificationCase> sample = sample(population, sampleSize);
    log.info(
        "Validating matrix {} against {} of {} misclassified cases",
        matrix.getVersion(),
        sample.size(),
        population.size());

    List<ValidationCaseResult> details = new ArrayList<>();
    for (ClassificationCase c : sample) {
      try {
        replay(matrix, c).ifPresent(details::add);
      } catch (RuntimeException e) {
        log.warn("Skipping case {} during validation: {}", c.getCaseId(), e.getMessage());
      }
    }

    int improved = count(details, ValidationCaseResult.Outcome.IMPROVED);
    int worsened = count(details, ValidationCaseResult.Outcome.WORSENED);
    ValidationResult result =
        ValidationResult.builder()
            .testId(UUID.randomUUID().toString())
            .testedAt(Instant.now())
            .matrixVersion(matrix.getVersion())
            .populationSize(population.size())
            .sampleSize(sample.size())
            .samplePercentage(population.isEmpty() ? 0.0 : sample.size() * 100.0 / population.size())
            .totalTested(details.size())
            .improved(improved)
            .worsened(worsened)
            .unchanged(details.size() - improved - worsened)
            .improvementRate(details.isEmpty() ? 0.0 : (double) improved / details.size())
            .details(details)
            .build();
    learningRepository.saveValidation(result);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("testId", result.getTestId());
    data.put("sampleSize", result.getSampleSize());
    data.put("improved", improved);
    data.put("unchanged", result.getUnchanged());
    data.put("worsened", worsened);
    auditLogService.record(
        AuditEvent.builder()
            .caseId(AuditEvent.SYSTEM_CASE_ID)
            .eventType(AuditEventType.VALIDATION)
            .matrixVersion(matrix.getVersion())
            .data(data)
            .build());
    return result;
  }

  public ValidationResult getValidation(String testId) {
    return learningRepository
        .findValidation(testId)
        .orElseThrow(() -> ResourceNotFoundException.of("Validation test", testId));
  }

  /** {@code clamp(ceil(ratio * n), min, max)}, never more than {@code n}. */
  int sampleSize(int populationSize) {
    ApplicationProperties.Learning config = applicationProperties.getLearning();
    int proportional = (int) Math.ceil(populationSize * config.getValidationSampleRatio());
    int clamped =
        Math.max(config.getValidationMinSample(), Math.min(config.getValidationMaxSample(), proportional));
    return Math.min(populationSize, clamped);
  }

  private List<ClassificationCase> sample(List<ClassificationCase> population, int size) {
    List<ClassificationCase> shuffled = new ArrayList<>(population);
    Collections.shuffle(shuffled, random);
    return shuffled.subList(0, size);
  }

  private Optional<ValidationCaseResult> replay(DecisionMatrix matrix, ClassificationCase c) {
    Classification original =
        c.getEvaluation() != null && c.getEvaluation().getOriginalClassification() != null
            ? c.getEvaluation().getOriginalClassification()
            : c.getLlmClassification();
    if (original == null) {
      log.debug("Case {} has no stored classification to replay", c.getCaseId());
      return Optional.empty();
    }
    Map<String, Object> attributes =
        c.getEvaluation() != null && c.getEvaluation().getExtractedAttributes() != null
            ? c.getEvaluation().getExtractedAttributes()
            : new LinkedHashMap<>();

    TransformationCategory previous = c.getClassification().getCategory();
    TransformationCategory correct = c.getFeedback().getCorrectedCategory();
    TransformationCategory now =
        evaluator.evaluate(matrix, attributes, original).getFinalClassification().getCategory();

    return Optional.of(
        ValidationCaseResult.builder()
            .caseId(c.getCaseId())
            .previousCategory(previous)
            .newCategory(now)
            .correctCategory(correct)
            .outcome(outcome(previous, now, correct))
            .build());
  }

  static ValidationCaseResult.Outcome outcome(
      TransformationCategory previous, TransformationCategory now, TransformationCategory correct) {
    if (previous != correct && now == correct) {
      return ValidationCaseResult.Outcome.IMPROVED;
    }
    if (previous == correct && now != correct) {
      return ValidationCaseResult.Outcome.WORSENED;
    }
    return ValidationCaseResult.Outcome.UNCHANGED;
  }

  private static int count(List<ValidationCaseResult> details, ValidationCaseResult.Outcome outcome) {
    return (int) details.stream().filter(d -> d.getOutcome() == outcome).count();
  }
}
