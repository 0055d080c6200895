package com.catalai.classifier.dto.process;

import java.util.ArrayList;
import java.util.List;

import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
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
@Schema(description = "Outcome of one classification turn")
public class ProcessResponse {

  private String caseId;

  private ProcessAction action;

  @Builder.Default private List<ClarificationQuestion> questions = new ArrayList<>();

  private Classification classification;

  private DecisionMatrixEvaluation evaluation;

  private boolean manualReview;

  private String reason;

  private boolean softLimitWarning;

  private boolean interviewSkipped;

  @Schema(description = "True when manual review replaced an unusable LLM result")
  private boolean fallback;

  private int turnsTaken;
}
