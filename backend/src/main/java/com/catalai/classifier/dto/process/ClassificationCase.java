package com.catalai.classifier.dto.process;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.catalai.classifier.dto.clarification.ClarificationSession;
import com.catalai.classifier.dto.classification.ClarificationExchange;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
import com.catalai.classifier.dto.review.ManualReview;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A submitted process description and everything produced while classifying it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassificationCase {

  private String caseId;

  private Instant createdAt;

  private Instant updatedAt;

  private String userId;

  /** Business area, used for subject consistency statistics. */
  private String subject;

  private String description;

  @Builder.Default private CaseStatus status = CaseStatus.ACTIVE;

  @Builder.Default private ClarificationSession clarification = new ClarificationSession();

  @Builder.Default private List<ClarificationExchange> exchanges = new ArrayList<>();

  /** Latest LLM classification, before rules were applied. */
  private Classification llmClassification;

  /** Classification after rule evaluation. */
  private Classification classification;

  private DecisionMatrixEvaluation evaluation;

  private String manualReviewReason;

  /** Set once a reviewer resolved the case. */
  private ManualReview manualReview;

  private boolean fallbackUsed;

  private Feedback feedback;

  @JsonIgnore
  public boolean hasFeedback() {
    return classification != null && feedback != null;
  }

  @JsonIgnore
  public boolean isMisclassified() {
    return hasFeedback() && !feedback.isConfirmed() && feedback.getCorrectedCategory() != null;
  }

  /** Category the user considers correct: the corrected one, or the confirmed classification. */
  @JsonIgnore
  public TransformationCategory getAgreedCategory() {
    if (!hasFeedback()) {
      return null;
    }
    return feedback.isConfirmed() ? classification.getCategory() : feedback.getCorrectedCategory();
  }
}
