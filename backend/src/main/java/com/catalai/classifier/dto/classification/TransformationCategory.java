package com.catalai.classifier.dto.classification;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The six transformation tiers, ordered from least to most automated. */
public enum TransformationCategory {
  ELIMINATE("Eliminate"),
  SIMPLIFY("Simplify"),
  DIGITISE("Digitise"),
  RPA("RPA"),
  AI_AGENT("AI Agent"),
  AGENTIC_AI("Agentic AI");

  private final String displayName;

  TransformationCategory(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  /**
   * Resolves a category from its display name or enum constant, ignoring case and surrounding
   * whitespace.
   */
  public static Optional<TransformationCategory> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim();
    return Arrays.stream(values())
        .filter(
            c ->
                c.displayName.equalsIgnoreCase(normalized)
                    || c.name().equalsIgnoreCase(normalized.replace(' ', '_')))
        .findFirst();
  }

  @JsonCreator
  public static TransformationCategory fromValue(String value) {
    return find(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown transformation category: " + value));
  }

  @Override
  public String toString() {
    return displayName;
  }
}
