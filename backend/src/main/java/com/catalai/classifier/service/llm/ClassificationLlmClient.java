package com.catalai.classifier.service.llm;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.classification.ClarificationExchange;
import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.matrix.Attribute;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The LLM operations the classifier depends on. Each call goes through {@link LlmCallExecutor}, so
 * callers always receive an {@link LlmResult} instead of an exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationLlmClient {

  private final LLMServiceSelector llmServiceSelector;
  private final PromptService promptService;
  private final LlmResponseParser parser;
  private final LlmCallExecutor executor;

  public LlmResult<Classification> classify(
      String description, List<ClarificationExchange> history) {
    String prompt =
        promptService.render(
            PromptService.CLASSIFICATION,
            Map.of("description", description, "history", formatHistory(history)));
    return call(
        "classification",
        PromptService.CLASSIFICATION,
        prompt,
        raw -> parser.parseClassification(raw, currentModelId()));
  }

  public LlmResult<List<ClarificationQuestion>> generateQuestions(
      String description,
      Classification classification,
      List<ClarificationExchange> history,
      int remainingBudget,
      int maxQuestions) {
    String prompt =
        promptService.render(
            PromptService.CLARIFICATION,
            Map.of(
                "description", description,
                "category", classification.getCategory().getDisplayName(),
                "confidence", String.format("%.2f", classification.getConfidence()),
                "rationale", nullToEmpty(classification.getRationale()),
                "history", formatHistory(history),
                "remainingBudget", String.valueOf(remainingBudget),
                "maxQuestions", String.valueOf(maxQuestions)));
    return call("question generation", PromptService.CLARIFICATION, prompt, parser::parseQuestions);
  }

  public LlmResult<Map<String, Object>> extractAttributes(
      String description, List<ClarificationExchange> history, List<Attribute> attributes) {
    String prompt =
        promptService.render(
            PromptService.ATTRIBUTE_EXTRACTION,
            Map.of(
                "description", description,
                "history", formatHistory(history),
                "attributes", formatAttributes(attributes)));
    return call(
        "attribute extraction", PromptService.ATTRIBUTE_EXTRACTION, prompt, parser::parseAttributes);
  }

  public LlmResult<List<JsonNode>> generateRuleSuggestions(String evidenceJson, String matrixJson) {
    String prompt =
        promptService.render(
            PromptService.LEARNING_SUGGESTIONS,
            Map.of("evidence", evidenceJson, "matrix", matrixJson));
    return call(
        "suggestion generation",
        PromptService.LEARNING_SUGGESTIONS,
        prompt,
        raw -> parser.parseObjectArray(raw, "suggestions"));
  }

  public LlmResult<List<String>> generatePatternSummaries(String evidenceJson) {
    String prompt =
        promptService.render(PromptService.LEARNING_PATTERNS, Map.of("evidence", evidenceJson));
    return call("pattern analysis", PromptService.LEARNING_PATTERNS, prompt, parser::parsePatterns);
  }

  public LlmResult<JsonNode> generateInitialMatrix() {
    String prompt = promptService.loadPromptTemplate(PromptService.MATRIX_GENERATION);
    return call("matrix generation", PromptService.MATRIX_GENERATION, prompt, parser::parseObject);
  }

  public String currentModelId() {
    try {
      return llmServiceSelector.getLLMService().getCurrentModelId();
    } catch (IllegalStateException e) {
      return null;
    }
  }

  public String currentProvider() {
    try {
      return llmServiceSelector.getLLMService().getProviderName();
    } catch (IllegalStateException e) {
      return null;
    }
  }

  private <T> LlmResult<T> call(
      String operation,
      String promptName,
      String userPrompt,
      Function<String, LlmResult<T>> parse) {
    String systemPrompt = promptService.loadPromptTemplate(promptName + "-system");
    return executor.execute(
        operation,
        () -> llmServiceSelector.getLLMService().chat(systemPrompt, userPrompt),
        parse);
  }

  static String formatHistory(List<ClarificationExchange> history) {
    if (history == null || history.isEmpty()) {
      return "(none)";
    }
    return history.stream()
        .map(e -> "Q: " + e.getQuestion() + "\nA: " + e.getAnswer())
        .collect(Collectors.joining("\n\n"));
  }

  static String formatAttributes(List<Attribute> attributes) {
    return attributes.stream()
        .map(
            a ->
                String.format(
                    "- %s (%s)%s: %s",
                    a.getName(),
                    a.getType() == null ? "categorical" : a.getType().getValue(),
                    a.getPossibleValues() == null || a.getPossibleValues().isEmpty()
                        ? ""
                        : " values " + a.getPossibleValues(),
                    nullToEmpty(a.getDescription())))
        .collect(Collectors.joining("\n"));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
