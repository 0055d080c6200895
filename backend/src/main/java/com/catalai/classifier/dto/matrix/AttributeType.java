package com.catalai.classifier.dto.matrix;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AttributeType {
  CATEGORICAL,
  NUMERIC,
  BOOLEAN;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static AttributeType fromValue(String value) {
    if (value == null) {
      return CATEGORICAL;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
