package com.catalai.classifier.service.llm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Loads prompt templates from {@code classpath:prompts/<name>.txt} and fills {@code
 * {{placeholder}}} markers.
 */
@Slf4j
@Service
public class PromptService {

  private static final String PROMPTS_PATH = "prompts/";

  public static final String CLASSIFICATION = "classification";
  public static final String CLARIFICATION = "clarification";
  public static final String ATTRIBUTE_EXTRACTION = "attribute-extraction";
  public static final String MATRIX_GENERATION = "matrix-generation";
  public static final String LEARNING_SUGGESTIONS = "learning-suggestions";
  public static final String LEARNING_PATTERNS = "learning-patterns";

  private final Map<String, String> templates = new ConcurrentHashMap<>();

  public String loadPromptTemplate(String name) {
    return templates.computeIfAbsent(name, this::readTemplate);
  }

  public String render(String name, Map<String, String> values) {
    String result = loadPromptTemplate(name);
    for (Map.Entry<String, String> entry : values.entrySet()) {
      result =
          result.replace(
              "{{" + entry.getKey() + "}}", entry.getValue() == null ? "" : entry.getValue());
    }
    return result;
  }

  private String readTemplate(String name) {
    ClassPathResource resource = new ClassPathResource(PROMPTS_PATH + name + ".txt");
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("Failed to load prompt template {}", name, e);
      throw new IllegalStateException("Prompt template not found: " + name, e);
    }
  }
}
