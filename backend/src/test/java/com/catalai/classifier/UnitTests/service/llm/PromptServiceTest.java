package com.catalai.classifier.service.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link PromptService}. */
@DisplayName("PromptService Unit Tests")
public class PromptServiceTest {

  private final PromptService promptService = new PromptService();

  @ParameterizedTest
  @ValueSource(
      strings = {
        PromptService.CLASSIFICATION,
        PromptService.CLARIFICATION,
        PromptService.ATTRIBUTE_EXTRACTION,
        PromptService.MATRIX_GENERATION,
        PromptService.LEARNING_SUGGESTIONS,
        PromptService.LEARNING_PATTERNS
      })
  @DisplayName("Should ship a user and a system template for every operation")
  void shouldLoadEveryTemplate(String name) {
    assertThat(promptService.loadPromptTemplate(name)).isNotBlank();
    assertThat(promptService.loadPromptTemplate(name + "-system")).isNotBlank();
  }

  @Test
  @DisplayName("Should fill placeholders and blank out null values")
  void shouldRenderPlaceholders() {
    // Given
    Map<String, String> values = new HashMap<>();
    values.put("description", "Monthly payroll run");
    values.put("history", null);

    // When
    String prompt = promptService.render(PromptService.CLASSIFICATION, values);

    // Then
    assertThat(prompt).contains("Monthly payroll run");
    assertThat(prompt).doesNotContain("{{description}}").doesNotContain("{{history}}");
  }

  @Test
  @DisplayName("Should fail for a missing template")
  void shouldFailForMissingTemplate() {
    assertThatThrownBy(() -> promptService.loadPromptTemplate("non-existent-template"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Prompt template not found: non-existent-template");
  }
}
