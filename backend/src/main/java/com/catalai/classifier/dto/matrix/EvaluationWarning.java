package com.catalai.classifier.dto.matrix;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Non-fatal inconsistency found while evaluating a rule. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationWarning {

  public static final String UNDECLARED_ATTRIBUTE = "UNDECLARED_ATTRIBUTE";

  private String code;
  private String ruleId;
  private String attribute;
  private String message;
}
