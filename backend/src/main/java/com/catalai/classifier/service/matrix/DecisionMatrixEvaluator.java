package com.catalai.classifier.service.matrix;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.AttributeType;
import com.catalai.classifier.dto.matrix.Condition;
import com.catalai.classifier.dto.matrix.ConditionOperator;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
import com.catalai.classifier.dto.matrix.EvaluationWarning;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.dto.matrix.RuleAction;
import com.catalai.classifier.dto.matrix.TriggeredRule;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies the rules of one matrix version to extracted attribute values.
 *
 * <p>Active rules run in descending priority; equal priorities keep declaration order. Every
 * matching rule is applied and recorded. Overrides replace the category, so the last matching
 * override wins; confidence adjustments accumulate and are clamped to [0,1] after each step. The
 * evaluator performs no I/O and returns the same trace for the same inputs.
 */
@Slf4j
@Component
public class DecisionMatrixEvaluator {

  /** Value used for attributes that could not be extracted. Never satisfies a condition. */
  public static final String UNKNOWN = "unknown";

  public DecisionMatrixEvaluation evaluate(
      DecisionMatrix matrix, Map<String, Object> attributeValues, Classification incoming) {
    Map<String, Object> values =
        attributeValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributeValues);

    List<Rule> ordered =
        matrix.getRules().stream()
            .filter(Rule::isActive)
            .sorted(Comparator.comparingInt(Rule::getPriority).reversed())
            .collect(Collectors.toList());

    Classification current = incoming.toBuilder().build();
    List<TriggeredRule> triggered = new ArrayList<>();
    List<EvaluationWarning> warnings = new ArrayList<>();
    boolean overridden = false;
    boolean reviewFlagged = false;

    for (Rule rule : ordered) {
      if (!matches(matrix, rule, values, warnings)) {
        continue;
      }
      RuleAction action = rule.getAction();
      triggered.add(
          TriggeredRule.builder()
              .ruleId(rule.getRuleId())
              .ruleName(rule.getName())
              .priority(rule.getPriority())
              .action(action)
              .build());

      switch (action.getType()) {
        case OVERRIDE:
          if (action.getTargetCategory() != null) {
            current =
                current.toBuilder()
                    .category(action.getTargetCategory())
                    .rationale(
                        appendRationale(current.getRationale(), "Overridden by rule", rule))
                    .build();
            overridden = true;
          }
          break;
        case ADJUST_CONFIDENCE:
          double delta =
              action.getConfidenceAdjustment() == null ? 0.0 : action.getConfidenceAdjustment();
          current =
              current.toBuilder()
                  .confidence(clamp(current.getConfidence() + delta))
                  .rationale(
                      appendRationale(current.getRationale(), "Confidence adjusted by rule", rule))
                  .build();
          break;
        case FLAG_REVIEW:
          reviewFlagged = true;
          break;
        default:
          throw new IllegalStateException("Unhandled action type " + action.getType());
      }
    }

    return DecisionMatrixEvaluation.builder()
        .matrixVersion(matrix.getVersion())
        .extractedAttributes(values)
        .triggeredRules(triggered)
        .originalClassification(incoming)
        .finalClassification(current)
        .overridden(overridden)
        .reviewFlagged(reviewFlagged)
        .warnings(warnings)
        .build();
  }

  private boolean matches(
      DecisionMatrix matrix, Rule rule, Map<String, Object> values, List<EvaluationWarning> warnings) {
    if (rule.getAction() == null || rule.getAction().getType() == null || rule.getConditions() == null) {
      return false;
    }
    for (Condition condition : rule.getConditions()) {
      if (condition == null) {
        return false;
      }
      Optional<Attribute> declared = matrix.findAttribute(condition.getAttribute());
      if (declared.isEmpty()) {
        log.warn(
            "Rule '{}' references undeclared attribute '{}' in matrix {}; condition treated as false",
            rule.getName(),
            condition.getAttribute(),
            matrix.getVersion());
        warnings.add(
            EvaluationWarning.builder()
                .code(EvaluationWarning.UNDECLARED_ATTRIBUTE)
                .ruleId(rule.getRuleId())
                .attribute(condition.getAttribute())
                .message("Attribute is not declared in matrix " + matrix.getVersion())
                .build());
        return false;
      }
      if (!test(condition, declared.get().getType(), values.get(condition.getAttribute()))) {
        return false;
      }
    }
    return true;
  }

  boolean test(Condition condition, AttributeType type, Object actual) {
    if (actual == null || isUnknown(actual) || condition.getOperator() == null) {
      return false;
    }
    ConditionOperator operator = condition.getOperator();
    Object expected = condition.getValue();

    if (operator.isOrdering()) {
      BigDecimal left = toNumber(actual);
      BigDecimal right = toNumber(expected);
      if (left == null || right == null) {
        return false;
      }
      int cmp = left.compareTo(right);
      switch (operator) {
        case GREATER_THAN:
          return cmp > 0;
        case LESS_THAN:
          return cmp < 0;
        case GREATER_OR_EQUAL:
          return cmp >= 0;
        default:
          return cmp <= 0;
      }
    }

    switch (operator) {
      case EQUALS:
        return valueEquals(type, actual, expected);
      case NOT_EQUALS:
        return comparable(type, actual) && !valueEquals(type, actual, expected);
      case IN:
        return asList(expected).stream().anyMatch(e -> valueEquals(type, actual, e));
      case NOT_IN:
        return comparable(type, actual)
            && asList(expected).stream().noneMatch(e -> valueEquals(type, actual, e));
      default:
        return false;
    }
  }

  private boolean valueEquals(AttributeType type, Object actual, Object expected) {
    if (expected == null) {
      return false;
    }
    if (type == AttributeType.NUMERIC) {
      BigDecimal left = toNumber(actual);
      BigDecimal right = toNumber(expected);
      return left != null && right != null && left.compareTo(right) == 0;
    }
    if (type == AttributeType.BOOLEAN) {
      Boolean left = toBoolean(actual);
      Boolean right = toBoolean(expected);
      return left != null && left.equals(right);
    }
    return String.valueOf(actual).trim().equalsIgnoreCase(String.valueOf(expected).trim());
  }

  /** A value that cannot be coerced to the declared type fails every condition. */
  private boolean comparable(AttributeType type, Object actual) {
    if (type == AttributeType.NUMERIC) {
      return toNumber(actual) != null;
    }
    if (type == AttributeType.BOOLEAN) {
      return toBoolean(actual) != null;
    }
    return true;
  }

  private static boolean isUnknown(Object value) {
    return value instanceof String && UNKNOWN.equalsIgnoreCase(((String) value).trim());
  }

  private static List<Object> asList(Object value) {
    if (value instanceof Collection) {
      return new ArrayList<>((Collection<?>) value);
    }
    List<Object> single = new ArrayList<>();
    single.add(value);
    return single;
  }

  static BigDecimal toNumber(Object value) {
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
    }
    if (value instanceof Number) {
      try {
        return new BigDecimal(value.toString());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    if (value instanceof String) {
      try {
        return new BigDecimal(((String) value).trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      String s = ((String) value).trim().toLowerCase(Locale.ROOT);
      if (s.equals("true") || s.equals("yes")) {
        return Boolean.TRUE;
      }
      if (s.equals("false") || s.equals("no")) {
        return Boolean.FALSE;
      }
    }
    return null;
  }

  private static double clamp(double confidence) {
    return Math.max(0.0, Math.min(1.0, confidence));
  }

  private static String appendRationale(String rationale, String prefix, Rule rule) {
    String reason = rule.getAction().getRationale() != null ? rule.getAction().getRationale() : rule.getName();
    String note = prefix + " '" + rule.getName() + "': " + reason;
    return rationale == null || rationale.isBlank() ? note : rationale + "\n\n" + note;
  }
}
