package com.catalai.classifier.dto.clarification;

import java.util.ArrayList;
import java.util.List;

import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.exception.WorkflowViolationException;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Dialogue state for one case. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClarificationSession {

  @Builder.Default private ClarificationState state = ClarificationState.AWAITING_INITIAL;

  private int turnsTaken;

  /** Number of question rounds issued so far. */
  private int roundsIssued;

  @Builder.Default private List<String> askedQuestions = new ArrayList<>();

  @Builder.Default private List<String> answers = new ArrayList<>();

  /** Questions of the current round that still need an answer. */
  @Builder.Default private List<ClarificationQuestion> pendingQuestions = new ArrayList<>();

  private String lastAction;

  private boolean manualReviewRequired;

  private boolean interviewSkipped;

  private boolean softLimitWarning;

  private String stopReason;

  public void moveTo(ClarificationState target) {
    state = state.transitionTo(target);
  }

  public void requireState(ClarificationState expected) {
    if (state != expected) {
      throw new WorkflowViolationException(
          String.format("Expected clarification state %s but was %s", expected, state));
    }
  }

  /** Deep copy, so a failed turn can be discarded without touching the stored session. */
  public ClarificationSession copy() {
    List<ClarificationQuestion> pendingCopy = new ArrayList<>();
    for (ClarificationQuestion q : pendingQuestions) {
      pendingCopy.add(new ClarificationQuestion(q.getQuestion(), q.getPurpose(), q.isCritical()));
    }
    return ClarificationSession.builder()
        .state(state)
        .turnsTaken(turnsTaken)
        .roundsIssued(roundsIssued)
        .askedQuestions(new ArrayList<>(askedQuestions))
        .answers(new ArrayList<>(answers))
        .pendingQuestions(pendingCopy)
        .lastAction(lastAction)
        .manualReviewRequired(manualReviewRequired)
        .interviewSkipped(interviewSkipped)
        .softLimitWarning(softLimitWarning)
        .stopReason(stopReason)
        .build();
  }
}
