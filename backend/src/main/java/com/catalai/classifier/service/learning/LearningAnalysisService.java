package com.catalai.classifier.service.learning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.learning.AnalysisTrigger;
import com.catalai.classifier.dto.learning.AnalyzeRequest;
import com.catalai.classifier.dto.learning.LearningAnalysis;
import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.MisclassificationCluster;
import com.catalai.classifier.dto.learning.SubjectConsistency;
import com.catalai.classifier.dto.learning.ThresholdCheck;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.llm.ClassificationLlmClient;
import com.catalai.classifier.service.llm.LlmResult;
import com.catalai.classifier.service.storage.CaseRepository;
import com.catalai.classifier.service.storage.LearningRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Measures how often users agree with classifications and turns the disagreements into
 * evidence for suggestion generation.
 *
 * <p>Agreement rate is confirmed feedback over all feedback. Without feedback the rate is 1.0,
 * so an empty history never looks like a failing classifier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearningAnalysisService {

  static final int MIN_CASES_PER_SUBJECT = 2;
  static final int MAX_EVIDENCE_EXAMPLES = 20;
  static final int MAX_DESCRIPTION_LENGTH = 500;

  private final CaseRepository caseRepository;
  private final LearningRepository learningRepository;
  private final LearningSuggestionService suggestionService;
  private final ClassificationLlmClient llmClient;
  private final AuditLogService auditLogService;
  private final ApplicationProperties applicationProperties;
  private final ObjectMapper objectMapper;
  private final Executor llmExecutor;

  private final AtomicBoolean automaticAnalysisRunning = new AtomicBoolean();
  private final AtomicInteger feedbackAtLastAutomaticAnalysis = new AtomicInteger(-1);

  public LearningAnalysis analyze(AnalyzeRequest request, AnalysisTrigger trigger) {
    if (request.getStartDate() != null
        && request.getEndDate() != null
        && request.getStartDate().isAfter(request.getEndDate())) {
      throw new IllegalArgumentException("startDate must not be after endDate");
    }
    List<ClassificationCase> withFeedback =
        caseRepository.loadCasesInRange(request.getStartDate(), request.getEndDate()).stream()
            .filter(ClassificationCase::hasFeedback)
            .collect(Collectors.toList());
    List<ClassificationCase> cases =
        request.isMisclassifiedOnly()
            ? withFeedback.stream().filter(ClassificationCase::isMisclassified).collect(Collectors.toList())
            : withFeedback;
    log.info("Running {} learning analysis over {} cases with feedback", trigger.getValue(), cases.size());

    List<MisclassificationCluster> clusters = clusterMisclassifications(cases);
    List<SubjectConsistency> subjects = subjectConsistency(cases);
    List<String> patterns = new ArrayList<>(identifyPatterns(cases, clusters));

    LearningAnalysis analysis =
        LearningAnalysis.builder()
            .id(UUID.randomUUID().toString())
            .trigger(trigger)
            .analyzedAt(Instant.now())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .misclassifiedOnly(request.isMisclassifiedOnly())
            .totalCases(cases.size())
            .casesWithFeedback(withFeedback.size())
            .overallAgreementRate(overallAgreementRate(cases))
            .categoryAgreementRates(categoryAgreementRates(cases))
            .misclassifications(clusters)
            .subjectConsistency(subjects)
            .build();

    if (clusters.isEmpty()) {
      analysis.setSuggestionGenerationStatus("skipped: no misclassifications");
    } else {
      String evidence = evidenceJson(analysis, cases);
      LlmResult<List<String>> llmPatterns = llmClient.generatePatternSummaries(evidence);
      if (llmPatterns.isOk()) {
        patterns.addAll(llmPatterns.getValue());
      } else {
        log.warn("Pattern summaries unavailable for analysis {}: {}", analysis.getId(), llmPatterns.getError());
      }
      try {
        List<LearningSuggestion> suggestions = suggestionService.generate(analysis.getId(), evidence);
        analysis.setSuggestionIds(
            suggestions.stream().map(LearningSuggestion::getId).collect(Collectors.toList()));
        analysis.setSuggestionGenerationStatus("completed");
      } catch (SuggestionGenerationException e) {
        log.warn("Suggestion generation failed for analysis {}: {}", analysis.getId(), e.getMessage());
        analysis.setSuggestionGenerationStatus("failed: " + e.getMessage());
      }
    }
    analysis.setIdentifiedPatterns(patterns);
    learningRepository.saveAnalysis(analysis);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("analysisId", analysis.getId());
    data.put("trigger", trigger.getValue());
    data.put("cases", analysis.getTotalCases());
    data.put("overallAgreementRate", analysis.getOverallAgreementRate());
    data.put("suggestions", analysis.getSuggestionIds().size());
    auditLogService.record(AuditEvent.SYSTEM_CASE_ID, AuditEventType.ANALYSIS, data);
    return analysis;
  }

  /** Categories whose agreement rate fell below the threshold. Categories without data never do. */
  public ThresholdCheck checkThreshold() {
    return checkThreshold(casesWithFeedback());
  }

  private ThresholdCheck checkThreshold(List<ClassificationCase> cases) {
    double threshold = applicationProperties.getLearning().getAgreementThreshold();
    Map<TransformationCategory, int[]> counts = countByCategory(cases);
    List<String> below = new ArrayList<>();
    for (Map.Entry<TransformationCategory, int[]> entry : counts.entrySet()) {
      int confirmed = entry.getValue()[0];
      int total = entry.getValue()[1];
      if (total > 0 && (double) confirmed / total < threshold) {
        below.add(entry.getKey().getDisplayName());
      }
    }
    double overall = overallAgreementRate(cases);
    return ThresholdCheck.builder()
        .belowThreshold(!below.isEmpty() || overall < threshold)
        .threshold(threshold)
        .overallRate(overall)
        .categories(below)
        .build();
  }

  /**
   * Starts an automatic analysis in the background when agreement dropped below the threshold.
   * At most one runs at a time, and none starts unless feedback arrived since the previous one.
   */
  public void onFeedbackRecorded() {
    List<ClassificationCase> withFeedback = casesWithFeedback();
    ThresholdCheck check = checkThreshold(withFeedback);
    if (!check.isBelowThreshold()) {
      return;
    }
    int feedbackCount = withFeedback.size();
    if (feedbackCount == feedbackAtLastAutomaticAnalysis.get()) {
      log.debug("No feedback since the last automatic analysis, skipping");
      return;
    }
    if (!automaticAnalysisRunning.compareAndSet(false, true)) {
      log.debug("Automatic analysis already running, skipping");
      return;
    }
    feedbackAtLastAutomaticAnalysis.set(feedbackCount);
    log.info(
        "Agreement rate below {} (overall {}, categories {}), triggering automatic analysis",
        check.getThreshold(),
        String.format("%.2f", check.getOverallRate()),
        check.getCategories());
    try {
      llmExecutor.execute(this::runAutomaticAnalysis);
    } catch (RejectedExecutionException e) {
      automaticAnalysisRunning.set(false);
      feedbackAtLastAutomaticAnalysis.set(-1);
      log.warn("Automatic analysis not started: {}", e.getMessage());
    }
  }

  private void runAutomaticAnalysis() {
    try {
      analyze(new AnalyzeRequest(), AnalysisTrigger.AUTOMATIC);
    } catch (RuntimeException e) {
      log.error("Automatic learning analysis failed", e);
    } finally {
      automaticAnalysisRunning.set(false);
    }
  }

  private List<ClassificationCase> casesWithFeedback() {
    return caseRepository.findAll().stream()
        .filter(ClassificationCase::hasFeedback)
        .collect(Collectors.toList());
  }

  public List<LearningAnalysis> listAnalyses() {
    return learningRepository.findAllAnalyses();
  }

  public LearningAnalysis getAnalysis(String id) {
    return learningRepository
        .findAnalysis(id)
        .orElseThrow(() -> ResourceNotFoundException.of("Learning analysis", id));
  }

  static double overallAgreementRate(List<ClassificationCase> cases) {
    List<ClassificationCase> withFeedback =
        cases.stream().filter(ClassificationCase::hasFeedback).collect(Collectors.toList());
    if (withFeedback.isEmpty()) {
      return 1.0;
    }
    long confirmed = withFeedback.stream().filter(c -> c.getFeedback().isConfirmed()).count();
    return (double) confirmed / withFeedback.size();
  }

  /** Rate per category display name, in tier order; 1.0 for categories without feedback. */
  static Map<String, Double> categoryAgreementRates(List<ClassificationCase> cases) {
    Map<TransformationCategory, int[]> counts = countByCategory(cases);
    Map<String, Double> rates = new LinkedHashMap<>();
    for (TransformationCategory category : TransformationCategory.values()) {
      int[] count = counts.get(category);
      rates.put(category.getDisplayName(), count[1] == 0 ? 1.0 : (double) count[0] / count[1]);
    }
    return rates;
  }

  /** Confirmed and total feedback per classified category. */
  private static Map<TransformationCategory, int[]> countByCategory(List<ClassificationCase> cases) {
    Map<TransformationCategory, int[]> counts = new EnumMap<>(TransformationCategory.class);
    for (TransformationCategory category : TransformationCategory.values()) {
      counts.put(category, new int[2]);
    }
    for (ClassificationCase c : cases) {
      if (!c.hasFeedback()) {
        continue;
      }
      int[] count = counts.get(c.getClassification().getCategory());
      count[1]++;
      if (c.getFeedback().isConfirmed()) {
        count[0]++;
      }
    }
    return counts;
  }

  /** From-to pairs by frequency, keeping a few example case ids each. */
  List<MisclassificationCluster> clusterMisclassifications(List<ClassificationCase> cases) {
    int maxExamples = applicationProperties.getLearning().getMaxExamplesPerMisclassification();
    Map<String, MisclassificationCluster> clusters = new LinkedHashMap<>();
    for (ClassificationCase c : cases) {
      if (!c.isMisclassified()) {
        continue;
      }
      TransformationCategory from = c.getClassification().getCategory();
      TransformationCategory to = c.getFeedback().getCorrectedCategory();
      MisclassificationCluster cluster =
          clusters.computeIfAbsent(
              from.name() + "->" + to.name(),
              k -> MisclassificationCluster.builder().fromCategory(from).toCategory(to).build());
      cluster.setCount(cluster.getCount() + 1);
      if (cluster.getExampleCaseIds().size() < maxExamples) {
        cluster.getExampleCaseIds().add(c.getCaseId());
      }
    }
    return clusters.values().stream()
        .sorted(Comparator.comparingInt(MisclassificationCluster::getCount).reversed())
        .collect(Collectors.toList());
  }

  static List<SubjectConsistency> subjectConsistency(List<ClassificationCase> cases) {
    Map<String, List<ClassificationCase>> bySubject = new TreeMap<>();
    for (ClassificationCase c : cases) {
      String subject = c.getSubject() == null || c.getSubject().isBlank() ? "Unknown" : c.getSubject();
      bySubject.computeIfAbsent(subject, k -> new ArrayList<>()).add(c);
    }

    List<SubjectConsistency> result = new ArrayList<>();
    for (Map.Entry<String, List<ClassificationCase>> entry : bySubject.entrySet()) {
      List<ClassificationCase> subjectCases = entry.getValue();
      if (subjectCases.size() < MIN_CASES_PER_SUBJECT) {
        continue;
      }
      Map<String, Integer> distribution = new LinkedHashMap<>();
      for (ClassificationCase c : subjectCases) {
        distribution.merge(c.getClassification().getCategory().getDisplayName(), 1, Integer::sum);
      }
      String mostCommon =
          distribution.entrySet().stream()
              .max(Map.Entry.comparingByValue())
              .map(Map.Entry::getKey)
              .orElse("Unknown");
      result.add(
          SubjectConsistency.builder()
              .subject(entry.getKey())
              .caseCount(subjectCases.size())
              .agreementRate(overallAgreementRate(subjectCases))
              .mostCommonCategory(mostCommon)
              .categoryDistribution(distribution)
              .build());
    }
    result.sort(Comparator.comparingInt(SubjectConsistency::getCaseCount).reversed());
    return result;
  }

  List<String> identifyPatterns(List<ClassificationCase> cases, List<MisclassificationCluster> clusters) {
    List<String> patterns = new ArrayList<>();
    if (!clusters.isEmpty()) {
      MisclassificationCluster top = clusters.get(0);
      patterns.add(
          String.format(
              "Most common misclassification: %s -> %s (%d occurrences)",
              top.getFromCategory().getDisplayName(), top.getToCategory().getDisplayName(), top.getCount()));
    }

    int over =
        clusters.stream()
            .filter(m -> m.getFromCategory().ordinal() > m.getToCategory().ordinal())
            .mapToInt(MisclassificationCluster::getCount)
            .sum();
    if (over > 0) {
      patterns.add(
          String.format(
              "Over-classification tendency: %d cases where the system classified higher than the correct category",
              over));
    }
    int under =
        clusters.stream()
            .filter(m -> m.getFromCategory().ordinal() < m.getToCategory().ordinal())
            .mapToInt(MisclassificationCluster::getCount)
            .sum();
    if (under > 0) {
      patterns.add(
          String.format(
              "Under-classification tendency: %d cases where the system classified lower than the correct category",
              under));
    }

    double lowConfidence = applicationProperties.getLearning().getLowConfidenceMisclassification();
    long uncertain =
        cases.stream()
            .filter(ClassificationCase::isMisclassified)
            .filter(c -> c.getClassification().getConfidence() < lowConfidence)
            .count();
    if (uncertain > 0) {
      patterns.add(
          String.format(
              "%d misclassifications had confidence below %.1f, suggesting uncertainty", uncertain, lowConfidence));
    }
    return patterns;
  }

  private String evidenceJson(LearningAnalysis analysis, List<ClassificationCase> cases) {
    List<Map<String, Object>> examples = new ArrayList<>();
    for (ClassificationCase c : cases) {
      if (!c.isMisclassified() || examples.size() >= MAX_EVIDENCE_EXAMPLES) {
        continue;
      }
      Map<String, Object> example = new LinkedHashMap<>();
      example.put("caseId", c.getCaseId());
      example.put("description", truncate(c.getDescription()));
      example.put("classifiedAs", c.getClassification().getCategory().getDisplayName());
      example.put("confidence", c.getClassification().getConfidence());
      example.put("correctCategory", c.getFeedback().getCorrectedCategory().getDisplayName());
      if (c.getEvaluation() != null) {
        example.put("attributes", c.getEvaluation().getExtractedAttributes());
      }
      if (c.getFeedback().getComments() != null) {
        example.put("comments", c.getFeedback().getComments());
      }
      examples.add(example);
    }

    Map<String, Object> evidence = new LinkedHashMap<>();
    evidence.put("overallAgreementRate", analysis.getOverallAgreementRate());
    evidence.put("categoryAgreementRates", analysis.getCategoryAgreementRates());
    evidence.put("misclassifications", analysis.getMisclassifications());
    evidence.put("examples", examples);
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(evidence);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize learning evidence", e);
    }
  }

  private static String truncate(String text) {
    if (text == null || text.length() <= MAX_DESCRIPTION_LENGTH) {
      return text;
    }
    return text.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
  }
}
