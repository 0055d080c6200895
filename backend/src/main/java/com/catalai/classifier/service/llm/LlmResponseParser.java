package com.catalai.classifier.service.llm;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

/**
 * Turns raw model replies into validated values. Replies may wrap the JSON in a markdown fence or
 * surrounding prose. Anything that does not validate becomes {@link LlmResult.Status#MALFORMED}.
 */
@Component
@RequiredArgsConstructor
public class LlmResponseParser {

  private final ObjectMapper objectMapper;

  public Optional<JsonNode> extractJson(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String text = raw.trim();
    if (text.startsWith("```")) {
      text = text.replaceAll("^```[a-zA-Z]*\\s*", "").replaceAll("```\\s*$", "").trim();
    }
    int objectStart = text.indexOf('{');
    int arrayStart = text.indexOf('[');
    int start;
    char close;
    if (objectStart < 0 && arrayStart < 0) {
      return Optional.empty();
    } else if (arrayStart < 0 || (objectStart >= 0 && objectStart < arrayStart)) {
      start = objectStart;
      close = '}';
    } else {
      start = arrayStart;
      close = ']';
    }
    int end = text.lastIndexOf(close);
    if (end <= start) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(text.substring(start, end + 1)));
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  public LlmResult<Classification> parseClassification(String raw, String modelId) {
    Optional<JsonNode> json = extractJson(raw);
    if (json.isEmpty() || !json.get().isObject()) {
      if (looksLikeQuestions(raw)) {
        return LlmResult.malformed("Model replied with questions instead of a classification");
      }
      return LlmResult.malformed("Classification reply contains no JSON object");
    }
    JsonNode node = json.get();
    Optional<TransformationCategory> category =
        TransformationCategory.find(node.path("category").asText(null));
    if (category.isEmpty()) {
      return LlmResult.malformed("Unknown category: " + node.path("category").asText(""));
    }
    JsonNode confidence = node.get("confidence");
    if (confidence == null || !(confidence.isNumber() || isNumericText(confidence))) {
      return LlmResult.malformed("Classification reply has no numeric confidence");
    }
    double value = Math.max(0.0, Math.min(1.0, confidence.asDouble()));

    return LlmResult.ok(
        Classification.builder()
            .category(category.get())
            .confidence(value)
            .rationale(node.path("rationale").asText(""))
            .categoryProgression(node.path("categoryProgression").asText(null))
            .futureOpportunities(node.path("futureOpportunities").asText(null))
            .modelId(modelId)
            .timestamp(Instant.now())
            .build());
  }

  /** An empty array is valid and means the model has nothing further to ask. */
  public LlmResult<List<ClarificationQuestion>> parseQuestions(String raw) {
    Optional<JsonNode> json = extractJson(raw);
    if (json.isEmpty()) {
      return LlmResult.malformed("Question reply contains no JSON");
    }
    JsonNode node = json.get();
    if (node.isObject() && node.has("questions")) {
      node = node.get("questions");
    }
    if (!node.isArray()) {
      return LlmResult.malformed("Question reply is not an array");
    }
    List<ClarificationQuestion> questions = new ArrayList<>();
    for (JsonNode item : node) {
      String text = item.isTextual() ? item.asText() : item.path("question").asText(null);
      if (text == null || text.isBlank()) {
        continue;
      }
      questions.add(
          ClarificationQuestion.builder()
              .question(text.trim())
              .purpose(item.path("purpose").asText("General clarification"))
              .critical(item.path("critical").asBoolean(false))
              .build());
    }
    if (questions.isEmpty() && node.size() > 0) {
      return LlmResult.malformed("Question reply has no usable questions");
    }
    return LlmResult.ok(questions);
  }

  /** Values may be scalars or {@code {"value": ..., "confidence": ...}} objects. */
  public LlmResult<Map<String, Object>> parseAttributes(String raw) {
    Optional<JsonNode> json = extractJson(raw);
    if (json.isEmpty() || !json.get().isObject()) {
      return LlmResult.malformed("Attribute reply contains no JSON object");
    }
    JsonNode node = json.get();
    if (node.has("attributes") && node.get("attributes").isObject()) {
      node = node.get("attributes");
    }
    Map<String, Object> values = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isObject() && value.has("value")) {
        value = value.get("value");
      }
      values.put(field.getKey(), toScalar(value));
    }
    return LlmResult.ok(values);
  }

  public LlmResult<List<JsonNode>> parseObjectArray(String raw, String field) {
    Optional<JsonNode> json = extractJson(raw);
    if (json.isEmpty()) {
      return LlmResult.malformed("Reply contains no JSON");
    }
    JsonNode node = json.get();
    if (node.isObject() && node.has(field)) {
      node = node.get(field);
    }
    if (!node.isArray()) {
      return LlmResult.malformed("Expected an array of " + field);
    }
    List<JsonNode> items = new ArrayList<>();
    node.forEach(items::add);
    return LlmResult.ok(items);
  }

  public LlmResult<List<String>> parsePatterns(String raw) {
    return parseObjectArray(raw, "patterns")
        .map(
            items -> {
              List<String> patterns = new ArrayList<>();
              for (JsonNode item : items) {
                String text = item.isTextual() ? item.asText() : item.path("pattern").asText("");
                if (!text.isBlank()) {
                  patterns.add(text.trim());
                }
              }
              return patterns;
            });
  }

  public LlmResult<JsonNode> parseObject(String raw) {
    Optional<JsonNode> json = extractJson(raw);
    if (json.isEmpty() || !json.get().isObject()) {
      return LlmResult.malformed("Reply contains no JSON object");
    }
    return LlmResult.ok(json.get());
  }

  private Object toScalar(JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.numberValue();
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isTextual()) {
      return value.asText().trim();
    }
    return value.toString();
  }

  private static boolean isNumericText(JsonNode node) {
    if (!node.isTextual()) {
      return false;
    }
    try {
      Double.parseDouble(node.asText().trim());
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean looksLikeQuestions(String raw) {
    if (raw == null) {
      return false;
    }
    long questionMarks = raw.chars().filter(c -> c == '?').count();
    return questionMarks >= 2 && !raw.toLowerCase(Locale.ROOT).contains("\"category\"");
  }
}
