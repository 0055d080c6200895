package com.catalai.classifier.service.clarification;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.dto.clarification.ClarificationSession;
import com.catalai.classifier.dto.clarification.ClarificationState;
import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.exception.WorkflowViolationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, turn by turn, whether a case needs another clarification round.
 *
 * <p>The engine holds no state of its own and never calls the LLM: it mutates the {@link
 * ClarificationSession} it is given, and the caller decides whether to keep the result. Question
 * generation happens between {@link #evaluate} returning {@code ASKING} and {@link
 * #acceptQuestions}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ClarificationEngine {

  static final String REASON_LOW_CONFIDENCE = "low confidence";
  static final String REASON_REPETITION = "repetition detected";
  static final String REASON_DONT_KNOW = "user lacks information";
  static final String REASON_HARD_LIMIT = "question limit reached";
  static final String REASON_NO_QUESTIONS = "no further clarifying questions";

  /** Rounds from which only critical questions are asked. */
  static final int CRITICAL_ONLY_ROUND = 8;

  private final ApplicationProperties applicationProperties;

  /**
   * Routes a case after its first classification, or after an answered round when the session is
   * waiting for answers. Loop guards run before the confidence thresholds.
   */
  public ClarificationState evaluate(ClarificationSession session, Classification classification) {
    ApplicationProperties.Clarification config = applicationProperties.getClarification();
    if (session.getState().isTerminal()) {
      throw new WorkflowViolationException(
          "Clarification already finished with state " + session.getState());
    }
    if (session.getState() == ClarificationState.ASKING) {
      throw new WorkflowViolationException("Questions for this round have not been issued yet");
    }

    if (session.getState() == ClarificationState.WAITING_FOR_ANSWER) {
      Optional<String> guard = checkGuards(session);
      if (guard.isPresent()) {
        return stop(session, guard.get());
      }
    }

    double confidence = classification.getConfidence();
    if (confidence > config.getHighConfidenceThreshold()) {
      session.moveTo(ClarificationState.READY_TO_CLASSIFY);
      session.setLastAction("ready");
      log.debug("Confidence {} above threshold, ready to classify", confidence);
    } else if (confidence < config.getLowConfidenceThreshold()) {
      session.moveTo(ClarificationState.READY_TO_CLASSIFY);
      session.setManualReviewRequired(true);
      session.setStopReason(REASON_LOW_CONFIDENCE);
      session.setLastAction("ready");
      log.info("Confidence {} below threshold, routing to manual review", confidence);
    } else if (remainingBudget(session) <= 0) {
      return stop(session, REASON_HARD_LIMIT);
    } else {
      session.moveTo(ClarificationState.ASKING);
      session.setLastAction("asking");
    }
    return session.getState();
  }

  /** How many questions the next round may contain; zero when the hard limit is used up. */
  public int questionQuota(ClarificationSession session) {
    int round = session.getRoundsIssued();
    int scheduled;
    if (round == 0) {
      scheduled = 3;
    } else if (round <= 4) {
      scheduled = 2;
    } else {
      scheduled = 1;
    }
    return Math.max(0, Math.min(scheduled, remainingBudget(session)));
  }

  public boolean criticalOnly(ClarificationSession session) {
    return session.getRoundsIssued() >= CRITICAL_ONLY_ROUND;
  }

  public int remainingBudget(ClarificationSession session) {
    return applicationProperties.getClarification().getHardQuestionLimit()
        - session.getAskedQuestions().size();
  }

  /**
   * Filters generated questions against the ones already asked and issues what is left as the
   * next round.
   *
   * @return the questions issued; empty when the session stopped instead
   */
  public List<ClarificationQuestion> acceptQuestions(
      ClarificationSession session, List<ClarificationQuestion> generated) {
    session.requireState(ClarificationState.ASKING);
    double threshold = applicationProperties.getClarification().getDuplicateSimilarity();
    int quota = questionQuota(session);
    if (quota == 0) {
      stop(session, REASON_HARD_LIMIT);
      return List.of();
    }

    List<String> seen = new ArrayList<>(session.getAskedQuestions());
    List<ClarificationQuestion> accepted = new ArrayList<>();
    int duplicates = 0;
    for (ClarificationQuestion candidate : generated) {
      if (accepted.size() == quota) {
        break;
      }
      if (candidate.getQuestion() == null || candidate.getQuestion().isBlank()) {
        continue;
      }
      if (criticalOnly(session) && !candidate.isCritical()) {
        continue;
      }
      if (QuestionSimilarity.isDuplicate(candidate.getQuestion(), seen, threshold)) {
        duplicates++;
        log.debug("Dropping duplicate question: {}", candidate.getQuestion());
        continue;
      }
      accepted.add(candidate);
      seen.add(candidate.getQuestion());
    }

    if (accepted.isEmpty()) {
      if (criticalOnly(session)) {
        session.moveTo(ClarificationState.READY_TO_CLASSIFY);
        session.setLastAction("ready");
        log.info("No critical questions left after {} rounds, ready to classify", session.getRoundsIssued());
        return List.of();
      }
      stop(session, duplicates > 0 ? REASON_REPETITION : REASON_NO_QUESTIONS);
      return List.of();
    }

    session.getAskedQuestions()
        .addAll(accepted.stream().map(ClarificationQuestion::getQuestion).collect(Collectors.toList()));
    session.setPendingQuestions(new ArrayList<>(accepted));
    session.setRoundsIssued(session.getRoundsIssued() + 1);
    session.moveTo(ClarificationState.WAITING_FOR_ANSWER);
    session.setLastAction("asked");
    return accepted;
  }

  /**
   * Records answers to the pending round, in question order. Unanswered questions of the round
   * are dropped.
   */
  public void recordAnswers(ClarificationSession session, List<String> answers) {
    session.requireState(ClarificationState.WAITING_FOR_ANSWER);
    if (answers == null || answers.isEmpty()) {
      throw new IllegalArgumentException("At least one answer is required");
    }
    if (answers.size() > session.getPendingQuestions().size()) {
      throw new IllegalArgumentException(
          String.format(
              "Received %d answers for %d pending questions",
              answers.size(), session.getPendingQuestions().size()));
    }
    session.getAnswers().addAll(answers);
    session.setTurnsTaken(session.getTurnsTaken() + answers.size());
    session.setPendingQuestions(new ArrayList<>());
    session.setLastAction("answered");
    if (session.getTurnsTaken() >= applicationProperties.getClarification().getSoftQuestionLimit()
        && !session.isSoftLimitWarning()) {
      session.setSoftLimitWarning(true);
      log.info("Clarification passed the soft limit after {} answers", session.getTurnsTaken());
    }
  }

  /** Skips the rest of the interview. Allowed in any non-terminal state. */
  public void forceClassify(ClarificationSession session) {
    if (session.getState().isTerminal()) {
      throw new WorkflowViolationException(
          "Clarification already finished with state " + session.getState());
    }
    session.moveTo(ClarificationState.READY_TO_CLASSIFY);
    session.setInterviewSkipped(true);
    session.setPendingQuestions(new ArrayList<>());
    session.setLastAction("force_classify");
  }

  /** The first loop guard that fires, if any. */
  Optional<String> checkGuards(ClarificationSession session) {
    ApplicationProperties.Clarification config = applicationProperties.getClarification();

    List<String> asked = session.getAskedQuestions();
    if (asked.size() >= config.getRepetitionWindow()) {
      List<String> recent = asked.subList(asked.size() - config.getRepetitionWindow(), asked.size());
      long distinct =
          new HashSet<>(
                  recent.stream().map(QuestionSimilarity::normalize).collect(Collectors.toList()))
              .size();
      if (distinct < config.getRepetitionMinDistinct()) {
        return Optional.of(REASON_REPETITION);
      }
    }

    List<String> answers = session.getAnswers();
    if (answers.size() >= config.getDontKnowThreshold()) {
      int from = Math.max(0, answers.size() - config.getDontKnowWindow());
      long dontKnow =
          answers.subList(from, answers.size()).stream().filter(QuestionSimilarity::isDontKnow).count();
      if (dontKnow >= config.getDontKnowThreshold()) {
        return Optional.of(REASON_DONT_KNOW);
      }
    }

    if (session.getTurnsTaken() >= config.getHardQuestionLimit()) {
      return Optional.of(REASON_HARD_LIMIT);
    }
    return Optional.empty();
  }

  /** Ends the dialogue and routes the case to manual review. */
  public ClarificationState stop(ClarificationSession session, String reason) {
    session.moveTo(ClarificationState.FORCE_STOPPED);
    session.setManualReviewRequired(true);
    session.setStopReason(reason);
    session.setPendingQuestions(new ArrayList<>());
    session.setLastAction("force_stopped");
    log.info("Clarification stopped: {} (answers: {})", reason, session.getTurnsTaken());
    return session.getState();
  }
}
