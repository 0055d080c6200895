package com.catalai.classifier.dto.matrix;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
  EQUALS("=="),
  NOT_EQUALS("!="),
  GREATER_THAN(">"),
  LESS_THAN("<"),
  GREATER_OR_EQUAL(">="),
  LESS_OR_EQUAL("<="),
  IN("in"),
  NOT_IN("not_in");

  private final String symbol;

  ConditionOperator(String symbol) {
    this.symbol = symbol;
  }

  @JsonValue
  public String getSymbol() {
    return symbol;
  }

  public boolean isOrdering() {
    return this == GREATER_THAN
        || this == LESS_THAN
        || this == GREATER_OR_EQUAL
        || this == LESS_OR_EQUAL;
  }

  @JsonCreator
  public static ConditionOperator fromSymbol(String symbol) {
    if (symbol != null) {
      String trimmed = symbol.trim();
      for (ConditionOperator operator : values()) {
        if (operator.symbol.equalsIgnoreCase(trimmed) || operator.name().equalsIgnoreCase(trimmed)) {
          return operator;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported condition operator: " + symbol);
  }
}
