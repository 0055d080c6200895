package com.catalai.classifier.fixtures;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.AttributeType;
import com.catalai.classifier.dto.matrix.Condition;
import com.catalai.classifier.dto.matrix.ConditionOperator;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.MatrixCreator;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.dto.matrix.RuleAction;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.process.CaseStatus;
import com.catalai.classifier.dto.process.Feedback;

/** Sample matrices, classifications and cases shared by the unit tests. */
public final class TestFixtures {

  public static final String DEFAULT_DESCRIPTION =
      "Invoices arrive by email, are keyed into the ERP by hand and approved by a manager.";

  private TestFixtures() {}

  // ========================================
  // CLASSIFICATION FIXTURES
  // ========================================

  public static Classification classification(TransformationCategory category, double confidence) {
    return Classification.builder()
        .category(category)
        .confidence(confidence)
        .rationale("Rule-based, high-volume data entry")
        .modelId("test-model")
        .timestamp(Instant.parse("2024-01-01T12:00:00Z"))
        .build();
  }

  public static ClarificationQuestion question(String text) {
    return ClarificationQuestion.builder().question(text).purpose("context").critical(false).build();
  }

  public static ClarificationQuestion criticalQuestion(String text) {
    return ClarificationQuestion.builder().question(text).purpose("context").critical(true).build();
  }

  // ========================================
  // MATRIX FIXTURES
  // ========================================

  public static Attribute categorical(String name, String... values) {
    return Attribute.builder()
        .name(name)
        .type(AttributeType.CATEGORICAL)
        .possibleValues(new ArrayList<>(Arrays.asList(values)))
        .weight(0.5)
        .build();
  }

  public static Attribute numeric(String name) {
    return Attribute.builder().name(name).type(AttributeType.NUMERIC).weight(0.5).build();
  }

  public static Condition condition(String attribute, ConditionOperator operator, Object value) {
    return Condition.builder().attribute(attribute).operator(operator).value(value).build();
  }

  public static Rule rule(String id, int priority, RuleAction action, Condition... conditions) {
    return Rule.builder()
        .ruleId(id)
        .name("Rule " + id)
        .priority(priority)
        .action(action)
        .conditions(new ArrayList<>(Arrays.asList(conditions)))
        .active(true)
        .build();
  }

  public static DecisionMatrix matrix(String version, List<Attribute> attributes, List<Rule> rules) {
    return DecisionMatrix.builder()
        .version(version)
        .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
        .createdBy(MatrixCreator.ADMIN)
        .description("Test matrix")
        .attributes(new ArrayList<>(attributes))
        .rules(new ArrayList<>(rules))
        .active(true)
        .build();
  }

  /** The standard attribute set with no rules. */
  public static DecisionMatrix baselineMatrix() {
    return matrix("1.0", standardAttributes(), new ArrayList<>());
  }

  public static List<Attribute> standardAttributes() {
    List<Attribute> attributes = new ArrayList<>();
    attributes.add(categorical("frequency", "hourly", "daily", "weekly", "monthly", "rare"));
    attributes.add(categorical("business_value", "low", "medium", "high", "critical"));
    attributes.add(categorical("complexity", "low", "medium", "high"));
    attributes.add(categorical("risk", "low", "medium", "high"));
    attributes.add(categorical("user_count", "1-10", "11-50", "51-200", "200+"));
    attributes.add(categorical("data_sensitivity", "public", "internal", "confidential", "restricted"));
    return attributes;
  }

  public static Map<String, Object> attributes(Object... keyValues) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      values.put((String) keyValues[i], keyValues[i + 1]);
    }
    return values;
  }

  // ========================================
  // CASE FIXTURES
  // ========================================

  public static ClassificationCase classifiedCase(
      String caseId, TransformationCategory category, double confidence) {
    Classification classification = classification(category, confidence);
    return ClassificationCase.builder()
        .caseId(caseId)
        .createdAt(Instant.parse("2024-03-01T10:00:00Z"))
        .updatedAt(Instant.parse("2024-03-01T10:05:00Z"))
        .subject("Finance")
        .description(DEFAULT_DESCRIPTION)
        .status(CaseStatus.CLASSIFIED)
        .llmClassification(classification)
        .classification(classification)
        .build();
  }

  public static ClassificationCase confirmedCase(String caseId, TransformationCategory category) {
    ClassificationCase c = classifiedCase(caseId, category, 0.9);
    c.setFeedback(Feedback.builder().confirmed(true).timestamp(Instant.now()).build());
    return c;
  }

  public static ClassificationCase correctedCase(
      String caseId, TransformationCategory predicted, TransformationCategory corrected, double confidence) {
    ClassificationCase c = classifiedCase(caseId, predicted, confidence);
    c.setFeedback(
        Feedback.builder()
            .confirmed(false)
            .correctedCategory(corrected)
            .comments("Wrong tier")
            .timestamp(Instant.now())
            .build());
    return c;
  }
}
