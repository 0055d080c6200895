package com.catalai.classifier.dto.matrix;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
  OVERRIDE,
  ADJUST_CONFIDENCE,
  FLAG_REVIEW;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ActionType fromValue(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Action type is required");
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
