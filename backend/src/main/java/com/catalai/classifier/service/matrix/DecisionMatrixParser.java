package com.catalai.classifier.service.matrix;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.matrix.ActionType;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.AttributeType;
import com.catalai.classifier.dto.matrix.Condition;
import com.catalai.classifier.dto.matrix.ConditionOperator;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.MatrixCreator;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.dto.matrix.RuleAction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns LLM-generated matrix content into attributes and rules the evaluator can trust. Items
 * that cannot be repaired are dropped with a warning instead of failing the whole document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionMatrixParser {

  static final int DEFAULT_PRIORITY = 50;

  private final ObjectMapper objectMapper;

  /** Parses a generated baseline matrix. The result has no version yet. */
  public DecisionMatrix parseGenerated(JsonNode root) {
    List<Attribute> attributes = new ArrayList<>();
    Set<String> names = new HashSet<>();
    for (JsonNode node : root.path("attributes")) {
      parseAttribute(node)
          .filter(a -> names.add(a.getName()))
          .ifPresent(attributes::add);
    }

    List<Rule> rules = new ArrayList<>();
    int generated = 0;
    for (JsonNode node : root.path("rules")) {
      generated++;
      parseRule(node, attributes, true, 0.0).ifPresent(rules::add);
    }
    log.info(
        "Parsed generated matrix: {} attributes, {} valid rules ({} dropped)",
        attributes.size(),
        rules.size(),
        generated - rules.size());

    return DecisionMatrix.builder()
        .createdBy(MatrixCreator.AI)
        .description(text(root, "description", "Baseline decision matrix"))
        .attributes(attributes)
        .rules(rules)
        .build();
  }

  public Optional<Attribute> parseAttribute(JsonNode node) {
    String name = text(node, "name", null);
    if (name == null || name.isBlank()) {
      log.warn("Skipping attribute without a name: {}", node);
      return Optional.empty();
    }
    AttributeType type;
    try {
      type = AttributeType.fromValue(text(node, "type", null));
    } catch (IllegalArgumentException e) {
      log.warn("Attribute '{}' has unknown type '{}', using categorical", name, node.path("type").asText());
      type = AttributeType.CATEGORICAL;
    }
    List<String> values = new ArrayList<>();
    if (type == AttributeType.CATEGORICAL) {
      for (JsonNode value : node.path("possibleValues")) {
        values.add(value.asText());
      }
    }
    return Optional.of(
        Attribute.builder()
            .name(name.trim())
            .type(type)
            .possibleValues(values.isEmpty() ? null : values)
            .weight(clamp(node.path("weight").asDouble(0.5), 0.0, 1.0))
            .description(text(node, "description", null))
            .build());
  }

  /**
   * Parses one rule.
   *
   * @param declared attributes conditions are checked against
   * @param dropInvalidConditions drop conditions on undeclared attributes or with values outside a
   *     categorical attribute's allowed values; otherwise they are kept for the evaluator to ignore
   * @param fallbackAdjustment confidence delta used when an override names no valid category
   */
  public Optional<Rule> parseRule(
      JsonNode node, List<Attribute> declared, boolean dropInvalidConditions, double fallbackAdjustment) {
    String name = text(node, "name", "Unnamed rule");

    int total = 0;
    List<Condition> conditions = new ArrayList<>();
    for (JsonNode conditionNode : node.path("conditions")) {
      total++;
      parseCondition(name, conditionNode, declared, dropInvalidConditions).ifPresent(conditions::add);
    }
    if (total > 0 && conditions.isEmpty()) {
      log.warn("Rule '{}' has no valid conditions, skipping rule", name);
      return Optional.empty();
    }

    Optional<RuleAction> action = parseAction(name, node.path("action"), fallbackAdjustment);
    if (action.isEmpty()) {
      return Optional.empty();
    }

    String ruleId = text(node, "ruleId", null);
    return Optional.of(
        Rule.builder()
            .ruleId(ruleId == null || ruleId.isBlank() ? UUID.randomUUID().toString() : ruleId)
            .name(name)
            .description(text(node, "description", null))
            .conditions(conditions)
            .action(action.get())
            .priority(clampPriority(node.path("priority").asInt(DEFAULT_PRIORITY)))
            .active(!node.has("active") || node.path("active").asBoolean(true))
            .build());
  }

  private Optional<Condition> parseCondition(
      String ruleName, JsonNode node, List<Attribute> declared, boolean dropInvalid) {
    String attributeName = text(node, "attribute", null);
    ConditionOperator operator;
    try {
      operator = ConditionOperator.fromSymbol(text(node, "operator", null));
    } catch (IllegalArgumentException e) {
      log.warn("Rule '{}' uses unsupported operator '{}', skipping condition", ruleName, node.path("operator").asText());
      return Optional.empty();
    }
    Object value = node.hasNonNull("value") ? objectMapper.convertValue(node.get("value"), Object.class) : null;

    Optional<Attribute> attribute =
        declared.stream().filter(a -> a.getName().equals(attributeName)).findFirst();
    if (attribute.isEmpty()) {
      if (dropInvalid) {
        log.warn("Rule '{}' references non-existent attribute '{}', skipping condition", ruleName, attributeName);
        return Optional.empty();
      }
      log.warn("Rule '{}' references undeclared attribute '{}'", ruleName, attributeName);
    } else if (dropInvalid && !allowedValues(attribute.get(), value)) {
      log.warn(
          "Rule '{}' uses values {} outside {} for attribute '{}', skipping condition",
          ruleName,
          value,
          attribute.get().getPossibleValues(),
          attributeName);
      return Optional.empty();
    }
    return Optional.of(Condition.builder().attribute(attributeName).operator(operator).value(value).build());
  }

  private Optional<RuleAction> parseAction(String ruleName, JsonNode node, double fallbackAdjustment) {
    ActionType type;
    try {
      type = ActionType.fromValue(text(node, "type", null));
    } catch (IllegalArgumentException e) {
      log.warn("Rule '{}' has no usable action type '{}', skipping rule", ruleName, node.path("type").asText());
      return Optional.empty();
    }
    String rationale = text(node, "rationale", null);

    if (type == ActionType.OVERRIDE) {
      JsonNode target = node.path("targetCategory");
      if (target.isArray() && target.size() > 0) {
        log.warn("Rule '{}' had targetCategory as array, using first value", ruleName);
        target = target.get(0);
      }
      Optional<TransformationCategory> category =
          target.isTextual() ? TransformationCategory.find(target.asText()) : Optional.empty();
      if (category.isPresent()) {
        return Optional.of(RuleAction.override(category.get(), rationale));
      }
      log.warn(
          "Rule '{}' has invalid targetCategory '{}', defaulting to adjust_confidence {}",
          ruleName,
          target.asText(),
          fallbackAdjustment);
      return Optional.of(RuleAction.adjustConfidence(fallbackAdjustment, rationale));
    }
    if (type == ActionType.ADJUST_CONFIDENCE) {
      double delta = clamp(node.path("confidenceAdjustment").asDouble(0.0), -1.0, 1.0);
      return Optional.of(RuleAction.adjustConfidence(delta, rationale));
    }
    return Optional.of(RuleAction.flagReview(rationale));
  }

  private static boolean allowedValues(Attribute attribute, Object value) {
    if (attribute.getType() != AttributeType.CATEGORICAL
        || attribute.getPossibleValues() == null
        || attribute.getPossibleValues().isEmpty()) {
      return true;
    }
    List<Object> values = new ArrayList<>();
    if (value instanceof List) {
      values.addAll((List<?>) value);
    } else {
      values.add(value);
    }
    return values.stream()
        .allMatch(
            v ->
                v != null
                    && attribute.getPossibleValues().stream()
                        .anyMatch(allowed -> allowed.equalsIgnoreCase(String.valueOf(v))));
  }

  public static int clampPriority(int priority) {
    return Math.max(0, Math.min(100, priority));
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  private static String text(JsonNode node, String field, String fallback) {
    JsonNode value = node.path(field);
    return value.isTextual() || value.isNumber() ? value.asText() : fallback;
  }
}
