package com.catalai.classifier.dto.clarification;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import com.catalai.classifier.exception.WorkflowViolationException;

public enum ClarificationState {
  AWAITING_INITIAL,
  ASKING,
  WAITING_FOR_ANSWER,
  READY_TO_CLASSIFY,
  FORCE_STOPPED;

  private static final Map<ClarificationState, Set<ClarificationState>> TRANSITIONS =
      new EnumMap<>(ClarificationState.class);

  static {
    TRANSITIONS.put(AWAITING_INITIAL, EnumSet.of(ASKING, READY_TO_CLASSIFY, FORCE_STOPPED));
    TRANSITIONS.put(ASKING, EnumSet.of(WAITING_FOR_ANSWER, READY_TO_CLASSIFY, FORCE_STOPPED));
    TRANSITIONS.put(WAITING_FOR_ANSWER, EnumSet.of(ASKING, READY_TO_CLASSIFY, FORCE_STOPPED));
    TRANSITIONS.put(READY_TO_CLASSIFY, EnumSet.noneOf(ClarificationState.class));
    TRANSITIONS.put(FORCE_STOPPED, EnumSet.noneOf(ClarificationState.class));
  }

  public boolean isTerminal() {
    return TRANSITIONS.get(this).isEmpty();
  }

  public ClarificationState transitionTo(ClarificationState target) {
    if (!TRANSITIONS.get(this).contains(target)) {
      throw new WorkflowViolationException(
          String.format("Clarification cannot move from %s to %s", this, target));
    }
    return target;
  }
}
