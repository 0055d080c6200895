package com.catalai.classifier.dto.learning;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisTrigger {
  AUTOMATIC,
  MANUAL;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AnalysisTrigger fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
