package com.catalai.classifier.dto.matrix;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggeredRule {
  private String ruleId;
  private String ruleName;
  private int priority;
  private RuleAction action;
}
