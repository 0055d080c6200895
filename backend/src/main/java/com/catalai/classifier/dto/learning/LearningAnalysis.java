package com.catalai.classifier.dto.learning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of one agreement analysis over historical feedback")
public class LearningAnalysis {

  private String id;

  private AnalysisTrigger trigger;

  private Instant analyzedAt;

  private Instant startDate;

  private Instant endDate;

  private boolean misclassifiedOnly;

  private int totalCases;

  private int casesWithFeedback;

  private double overallAgreementRate;

  /** Keyed by category display name; categories without feedback report 1.0. */
  @Builder.Default private Map<String, Double> categoryAgreementRates = new LinkedHashMap<>();

  @Builder.Default private List<MisclassificationCluster> misclassifications = new ArrayList<>();

  @Builder.Default private List<SubjectConsistency> subjectConsistency = new ArrayList<>();

  @Builder.Default private List<String> identifiedPatterns = new ArrayList<>();

  @Builder.Default private List<String> suggestionIds = new ArrayList<>();

  private String suggestionGenerationStatus;
}
