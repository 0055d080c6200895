package com.catalai.classifier.service.clarification;

import static com.catalai.classifier.fixtures.TestFixtures.classification;
import static com.catalai.classifier.fixtures.TestFixtures.criticalQuestion;
import static com.catalai.classifier.fixtures.TestFixtures.question;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.dto.clarification.ClarificationSession;
import com.catalai.classifier.dto.clarification.ClarificationState;
import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.exception.WorkflowViolationException;

@DisplayName("ClarificationEngine Tests")
class ClarificationEngineTest {

  private ClarificationEngine engine;

  @BeforeEach
  void setUp() {
    engine = new ClarificationEngine(new ApplicationProperties());
  }

  private static ClarificationSession waitingSession(List<String> asked, List<String> answers) {
    return ClarificationSession.builder()
        .state(ClarificationState.WAITING_FOR_ANSWER)
        .askedQuestions(new ArrayList<>(asked))
        .answers(new ArrayList<>(answers))
        .turnsTaken(answers.size())
        .roundsIssued(1)
        .build();
  }

  /** Runs one full round: evaluate, issue the given questions, answer them. */
  private void playRound(ClarificationSession session, double confidence, List<String> questions) {
    assertThat(engine.evaluate(session, classification(TransformationCategory.RPA, confidence)))
        .isEqualTo(ClarificationState.ASKING);
    List<ClarificationQuestion> generated = new ArrayList<>();
    questions.forEach(q -> generated.add(question(q)));
    List<ClarificationQuestion> issued = engine.acceptQuestions(session, generated);
    List<String> answers = new ArrayList<>();
    issued.forEach(q -> answers.add("We do this for about forty suppliers"));
    engine.recordAnswers(session, answers);
  }

  @Nested
  @DisplayName("Confidence routing")
  class ConfidenceRoutingTests {

    @Test
    @DisplayName("Should be ready to classify above the high threshold")
    void shouldBeReadyAboveHighThreshold() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.9));

      // Then
      assertThat(state).isEqualTo(ClarificationState.READY_TO_CLASSIFY);
      assertThat(session.isManualReviewRequired()).isFalse();
    }

    @Test
    @DisplayName("Should ask questions inside the clarification band")
    void shouldAskInsideBand() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.85));

      // Then
      assertThat(state).isEqualTo(ClarificationState.ASKING);
    }

    @Test
    @DisplayName("Should route to manual review below the low threshold")
    void shouldRouteToManualReviewBelowLowThreshold() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.4));

      // Then
      assertThat(state).isEqualTo(ClarificationState.READY_TO_CLASSIFY);
      assertThat(session.isManualReviewRequired()).isTrue();
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_LOW_CONFIDENCE);
    }

    @Test
    @DisplayName("Should ask at exactly the low threshold")
    void shouldAskAtLowThreshold() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.6));

      // Then
      assertThat(state).isEqualTo(ClarificationState.ASKING);
    }

    @Test
    @DisplayName("Should reject evaluation of a finished session")
    void shouldRejectTerminalSession() {
      // Given
      ClarificationSession session =
          ClarificationSession.builder().state(ClarificationState.READY_TO_CLASSIFY).build();

      // When & Then
      assertThatThrownBy(
              () -> engine.evaluate(session, classification(TransformationCategory.RPA, 0.7)))
          .isInstanceOf(WorkflowViolationException.class);
    }
  }

  @Nested
  @DisplayName("Question rounds")
  class QuestionRoundTests {

    @Test
    @DisplayName("Should issue at most three questions in the first round")
    void shouldLimitFirstRound() {
      // Given
      ClarificationSession session = new ClarificationSession();
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // When
      List<ClarificationQuestion> issued =
          engine.acceptQuestions(
              session,
              Arrays.asList(
                  question("How often does the process run?"),
                  question("Which systems hold the invoice data?"),
                  question("Who approves exceptions?"),
                  question("What happens when a supplier is missing?")));

      // Then
      assertThat(issued).hasSize(3);
      assertThat(session.getState()).isEqualTo(ClarificationState.WAITING_FOR_ANSWER);
      assertThat(session.getPendingQuestions()).hasSize(3);
      assertThat(session.getRoundsIssued()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop questions already asked")
    void shouldDropDuplicates() {
      // Given
      ClarificationSession session =
          waitingSession(
              Collections.singletonList("How often does the process run?"),
              Collections.singletonList("Daily"));
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // When
      List<ClarificationQuestion> issued =
          engine.acceptQuestions(
              session,
              Arrays.asList(
                  question("How often does this process run?"),
                  question("Which teams are involved?")));

      // Then
      assertThat(issued).extracting(ClarificationQuestion::getQuestion)
          .containsExactly("Which teams are involved?");
    }

    @Test
    @DisplayName("Should stop when every generated question repeats an earlier one")
    void shouldStopWhenOnlyDuplicatesRemain() {
      // Given
      ClarificationSession session =
          waitingSession(
              Collections.singletonList("How often does the process run?"),
              Collections.singletonList("Daily"));
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // When
      List<ClarificationQuestion> issued =
          engine.acceptQuestions(
              session, Collections.singletonList(question("How often does the process run?")));

      // Then
      assertThat(issued).isEmpty();
      assertThat(session.getState()).isEqualTo(ClarificationState.FORCE_STOPPED);
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_REPETITION);
      assertThat(session.isManualReviewRequired()).isTrue();
    }

    @Test
    @DisplayName("Should stop when no questions are generated")
    void shouldStopWithoutQuestions() {
      // Given
      ClarificationSession session = new ClarificationSession();
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // When
      engine.acceptQuestions(session, Collections.emptyList());

      // Then
      assertThat(session.getState()).isEqualTo(ClarificationState.FORCE_STOPPED);
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_NO_QUESTIONS);
    }

    @Test
    @DisplayName("Should only accept critical questions from the eighth round")
    void shouldOnlyAcceptCriticalQuestionsLate() {
      // Given
      ClarificationSession session =
          ClarificationSession.builder()
              .state(ClarificationState.ASKING)
              .roundsIssued(ClarificationEngine.CRITICAL_ONLY_ROUND)
              .build();

      // When
      List<ClarificationQuestion> issued =
          engine.acceptQuestions(
              session,
              Arrays.asList(
                  question("Nice to know detail?"), criticalQuestion("Is a human signature legally required?")));

      // Then
      assertThat(issued).extracting(ClarificationQuestion::isCritical).containsExactly(true);
      assertThat(engine.questionQuota(session)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be ready to classify when no critical question remains late in the dialogue")
    void shouldBeReadyWithoutCriticalQuestions() {
      // Given
      ClarificationSession session =
          ClarificationSession.builder()
              .state(ClarificationState.ASKING)
              .roundsIssued(ClarificationEngine.CRITICAL_ONLY_ROUND)
              .build();

      // When
      engine.acceptQuestions(session, Collections.singletonList(question("Optional detail?")));

      // Then
      assertThat(session.getState()).isEqualTo(ClarificationState.READY_TO_CLASSIFY);
      assertThat(session.isManualReviewRequired()).isFalse();
    }

    @Test
    @DisplayName("Should follow the three, two, one question schedule")
    void shouldFollowQuestionSchedule() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When & Then
      assertThat(engine.questionQuota(session)).isEqualTo(3);
      session.setRoundsIssued(4);
      assertThat(engine.questionQuota(session)).isEqualTo(2);
      session.setRoundsIssued(5);
      assertThat(engine.questionQuota(session)).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Answers")
  class AnswerTests {

    @Test
    @DisplayName("Should reject more answers than pending questions")
    void shouldRejectTooManyAnswers() {
      // Given
      ClarificationSession session = new ClarificationSession();
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));
      engine.acceptQuestions(session, Collections.singletonList(question("How often?")));

      // When & Then
      assertThatThrownBy(() -> engine.recordAnswers(session, Arrays.asList("Daily", "Weekly")))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject answers when no questions are pending")
    void shouldRejectAnswersOutsideRound() {
      // Given
      ClarificationSession session = new ClarificationSession();

      // When & Then
      assertThatThrownBy(() -> engine.recordAnswers(session, Collections.singletonList("Daily")))
          .isInstanceOf(WorkflowViolationException.class);
    }

    @Test
    @DisplayName("Should raise the soft limit warning after eight answers")
    void shouldWarnAtSoftLimit() {
      // Given
      ClarificationSession session = new ClarificationSession();
      playRound(session, 0.7, Arrays.asList("Q one about volume?", "Q two about systems?", "Q three about people?"));
      playRound(session, 0.7, Arrays.asList("Q four about approvals?", "Q five about exceptions?"));
      playRound(session, 0.7, Arrays.asList("Q six about auditors?", "Q seven about suppliers?"));
      assertThat(session.isSoftLimitWarning()).isFalse();

      // When
      playRound(session, 0.7, Arrays.asList("Q eight about deadlines?", "Q nine about tooling?"));

      // Then
      assertThat(session.getTurnsTaken()).isEqualTo(9);
      assertThat(session.isSoftLimitWarning()).isTrue();
    }
  }

  @Nested
  @DisplayName("Loop guards")
  class LoopGuardTests {

    @Test
    @DisplayName("Should stop when the last five questions repeat")
    void shouldDetectRepetition() {
      // Given
      String same = "How many invoices per day?";
      ClarificationSession session =
          waitingSession(
              Arrays.asList(same, same, same, same, same),
              Arrays.asList("ten", "ten", "ten", "ten", "ten"));

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // Then
      assertThat(state).isEqualTo(ClarificationState.FORCE_STOPPED);
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_REPETITION);
      assertThat(session.isManualReviewRequired()).isTrue();
    }

    @Test
    @DisplayName("Should stop when the user keeps saying they do not know")
    void shouldDetectDontKnow() {
      // Given
      ClarificationSession session =
          waitingSession(
              Arrays.asList("How often?", "Which system?", "Who approves?"),
              Arrays.asList("Daily", "I don't know", "not sure"));

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));

      // Then
      assertThat(state).isEqualTo(ClarificationState.FORCE_STOPPED);
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_DONT_KNOW);
    }

    @Test
    @DisplayName("Should run loop guards before the confidence thresholds")
    void shouldCheckGuardsFirst() {
      // Given
      ClarificationSession session =
          waitingSession(
              Arrays.asList("How often?", "Which system?"), Arrays.asList("idk", "no idea"));

      // When
      ClarificationState state =
          engine.evaluate(session, classification(TransformationCategory.RPA, 0.95));

      // Then
      assertThat(state).isEqualTo(ClarificationState.FORCE_STOPPED);
    }

    @Test
    @DisplayName("Should never issue more than fifteen questions")
    void shouldEnforceHardLimit() {
      // Given
      ClarificationSession session = new ClarificationSession();
      int round = 0;

      // When
      while (!session.getState().isTerminal()) {
        if (engine.evaluate(session, classification(TransformationCategory.RPA, 0.7))
            != ClarificationState.ASKING) {
          break;
        }
        List<ClarificationQuestion> generated = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
          generated.add(criticalQuestion("Distinct topic " + round + " item " + i + " zebra" + round + "x" + i));
        }
        List<ClarificationQuestion> issued = engine.acceptQuestions(session, generated);
        if (issued.isEmpty()) {
          break;
        }
        List<String> answers = new ArrayList<>();
        issued.forEach(q -> answers.add("Answer for " + q.getQuestion()));
        engine.recordAnswers(session, answers);
        round++;
      }

      // Then
      assertThat(session.getAskedQuestions()).hasSize(15);
      assertThat(session.getState()).isEqualTo(ClarificationState.FORCE_STOPPED);
      assertThat(session.getStopReason()).isEqualTo(ClarificationEngine.REASON_HARD_LIMIT);
    }
  }

  @Nested
  @DisplayName("Force classify")
  class ForceClassifyTests {

    @Test
    @DisplayName("Should skip the interview from any open state")
    void shouldSkipInterview() {
      // Given
      ClarificationSession session = new ClarificationSession();
      engine.evaluate(session, classification(TransformationCategory.RPA, 0.7));
      engine.acceptQuestions(session, Collections.singletonList(question("How often?")));

      // When
      engine.forceClassify(session);

      // Then
      assertThat(session.getState()).isEqualTo(ClarificationState.READY_TO_CLASSIFY);
      assertThat(session.isInterviewSkipped()).isTrue();
      assertThat(session.getPendingQuestions()).isEmpty();
    }

    @Test
    @DisplayName("Should reject force classify once finished")
    void shouldRejectAfterFinish() {
      // Given
      ClarificationSession session =
          ClarificationSession.builder().state(ClarificationState.FORCE_STOPPED).build();

      // When & Then
      assertThatThrownBy(() -> engine.forceClassify(session))
          .isInstanceOf(WorkflowViolationException.class);
    }
  }
}
