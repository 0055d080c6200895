package com.catalai.classifier.dto.learning;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.catalai.classifier.exception.WorkflowViolationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Suggestion lifecycle. Every allowed move is listed in {@link #TRANSITIONS}. */
public enum SuggestionStatus {
  PENDING,
  APPROVED,
  REJECTED,
  APPLIED;

  private static final Map<SuggestionStatus, Set<SuggestionStatus>> TRANSITIONS =
      new EnumMap<>(SuggestionStatus.class);

  static {
    TRANSITIONS.put(PENDING, EnumSet.of(APPROVED, REJECTED));
    TRANSITIONS.put(APPROVED, EnumSet.of(APPLIED));
    TRANSITIONS.put(REJECTED, EnumSet.noneOf(SuggestionStatus.class));
    TRANSITIONS.put(APPLIED, EnumSet.noneOf(SuggestionStatus.class));
  }

  public boolean canTransitionTo(SuggestionStatus target) {
    return TRANSITIONS.get(this).contains(target);
  }

  public boolean isTerminal() {
    return TRANSITIONS.get(this).isEmpty();
  }

  /**
   * Returns {@code target} when the move is allowed.
   *
   * @throws WorkflowViolationException otherwise
   */
  public SuggestionStatus transitionTo(SuggestionStatus target) {
    if (!canTransitionTo(target)) {
      throw new WorkflowViolationException(
          String.format(
              "Suggestion cannot move from '%s' to '%s'", getValue(), target.getValue()));
    }
    return target;
  }

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static SuggestionStatus fromValue(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
