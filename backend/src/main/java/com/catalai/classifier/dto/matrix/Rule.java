package com.catalai.classifier.dto.matrix;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Conditions joined by AND, plus the action applied when all of them hold. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Rule {

  private String ruleId;

  private String name;

  private String description;

  @Builder.Default private List<Condition> conditions = new ArrayList<>();

  private RuleAction action;

  /** Higher evaluates first. */
  private int priority;

  @Builder.Default private boolean active = true;
}
