package com.catalai.classifier.dto.matrix;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MatrixCreator {
  AI,
  ADMIN;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static MatrixCreator fromValue(String value) {
    return value == null ? ADMIN : valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
