package com.catalai.classifier.dto.process;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessAction {
  CLARIFY,
  CLASSIFIED,
  MANUAL_REVIEW;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
