package com.catalai.classifier.dto.learning;

import com.catalai.classifier.dto.classification.TransformationCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationCaseResult {

  public enum Outcome {
    IMPROVED,
    UNCHANGED,
    WORSENED
  }

  private String caseId;
  private TransformationCategory previousCategory;
  private TransformationCategory newCategory;
  private TransformationCategory correctCategory;
  private Outcome outcome;
}
