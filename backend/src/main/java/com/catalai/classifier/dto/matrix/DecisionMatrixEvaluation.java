package com.catalai.classifier.dto.matrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.catalai.classifier.dto.classification.Classification;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Trace of one rule evaluation against a matrix version")
public class DecisionMatrixEvaluation {

  private String matrixVersion;

  @Builder.Default private Map<String, Object> extractedAttributes = new LinkedHashMap<>();

  /** In the order the rules were applied. */
  @Builder.Default private List<TriggeredRule> triggeredRules = new ArrayList<>();

  private Classification originalClassification;

  private Classification finalClassification;

  private boolean overridden;

  private boolean reviewFlagged;

  @Builder.Default private List<EvaluationWarning> warnings = new ArrayList<>();
}
