package com.catalai.classifier.dto.learning;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SuggestionType {
  NEW_RULE,
  MODIFY_RULE,
  ADJUST_WEIGHT,
  NEW_ATTRIBUTE,
  REMOVE_RULE;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<SuggestionType> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    return Arrays.stream(values()).filter(t -> t.name().equals(normalized)).findFirst();
  }

  @JsonCreator
  public static SuggestionType fromValue(String value) {
    return find(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown suggestion type: " + value));
  }
}
