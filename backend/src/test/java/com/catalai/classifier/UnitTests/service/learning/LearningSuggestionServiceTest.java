package com.catalai.classifier.service.learning;

import static com.catalai.classifier.fixtures.TestFixtures.baselineMatrix;
import static com.catalai.classifier.fixtures.TestFixtures.condition;
import static com.catalai.classifier.fixtures.TestFixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.catalai.classifier.config.CoreConfig;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.ProposedChange;
import com.catalai.classifier.dto.learning.ReviewRequest;
import com.catalai.classifier.dto.learning.SuggestionStatus;
import com.catalai.classifier.dto.learning.SuggestionType;
import com.catalai.classifier.dto.matrix.ActionType;
import com.catalai.classifier.dto.matrix.ConditionOperator;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.RuleAction;
import com.catalai.classifier.exception.StorageException;
import com.catalai.classifier.exception.WorkflowViolationException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.llm.ClassificationLlmClient;
import com.catalai.classifier.service.llm.LlmResult;
import com.catalai.classifier.service.matrix.DecisionMatrixParser;
import com.catalai.classifier.service.matrix.DecisionMatrixService;
import com.catalai.classifier.service.storage.LearningRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
@DisplayName("LearningSuggestionService Tests")
class LearningSuggestionServiceTest {

  @Mock private LearningRepository learningRepository;
  @Mock private DecisionMatrixService decisionMatrixService;
  @Mock private ClassificationLlmClient llmClient;
  @Mock private AuditLogService auditLogService;

  private final ObjectMapper objectMapper = new CoreConfig().objectMapper();
  private LearningSuggestionService service;
  private DecisionMatrix activeMatrix;

  @BeforeEach
  void setUp() {
    service =
        new LearningSuggestionService(
            learningRepository,
            decisionMatrixService,
            new DecisionMatrixParser(objectMapper),
            new SuggestionApplier(),
            llmClient,
            auditLogService,
            objectMapper);
    activeMatrix = baselineMatrix();
    activeMatrix.getRules()
        .add(
            rule(
                "daily-rpa",
                60,
                RuleAction.override(TransformationCategory.RPA, "daily work"),
                condition("frequency", ConditionOperator.EQUALS, "daily")));
  }

  private JsonNode json(String text) throws Exception {
    return objectMapper.readTree(text);
  }

  private LearningSuggestion pendingNewRule() {
    return LearningSuggestion.builder()
        .id("s-1")
        .type(SuggestionType.NEW_RULE)
        .status(SuggestionStatus.PENDING)
        .proposedChange(
            ProposedChange.builder()
                .rule(
                    rule(
                        "rare-simplify",
                        40,
                        RuleAction.override(TransformationCategory.SIMPLIFY, "rare"),
                        condition("frequency", ConditionOperator.EQUALS, "rare")))
                .build())
        .build();
  }

  @Nested
  @DisplayName("Normalizing generated suggestions")
  class NormalizeTests {

    @Test
    @DisplayName("Should keep a new rule and give it a fresh id")
    void shouldKeepNewRule() throws Exception {
      // Given
      JsonNode item =
          json(
              "{\"type\":\"new_rule\",\"rationale\":\"Weekly work is rarely automated\","
                  + "\"impact\":{\"affectedCases\":4,\"expectedImprovementPercent\":12.5},"
                  + "\"change\":{\"rule\":{\"ruleId\":\"llm-id\",\"name\":\"Weekly\",\"priority\":70,"
                  + "\"conditions\":[{\"attribute\":\"frequency\",\"operator\":\"==\",\"value\":\"weekly\"}],"
                  + "\"action\":{\"type\":\"override\",\"targetCategory\":\"Digitise\"}}}}");

      // When
      Optional<LearningSuggestion> suggestion = service.normalize(item, activeMatrix, "a-1");

      // Then
      assertThat(suggestion).isPresent();
      assertThat(suggestion.get().getStatus()).isEqualTo(SuggestionStatus.PENDING);
      assertThat(suggestion.get().getAnalysisId()).isEqualTo("a-1");
      assertThat(suggestion.get().getImpact().getAffectedCases()).isEqualTo(4);
      assertThat(suggestion.get().getProposedChange().getRule().getRuleId()).isNotEqualTo("llm-id");
      assertThat(suggestion.get().getProposedChange().getRule().getAction().getTargetCategory())
          .isEqualTo(TransformationCategory.DIGITISE);
    }

    @Test
    @DisplayName("Should fall back to a small confidence boost for an invalid override target")
    void shouldFallBackForInvalidTarget() throws Exception {
      JsonNode item =
          json(
              "{\"type\":\"new_rule\",\"change\":{\"name\":\"Odd\","
                  + "\"conditions\":[{\"attribute\":\"risk\",\"operator\":\"==\",\"value\":\"high\"}],"
                  + "\"action\":{\"type\":\"override\",\"targetCategory\":\"Quantum\"}}}");

      RuleAction action = service.normalize(item, activeMatrix, "a-1").get().getProposedChange().getRule().getAction();

      assertThat(action.getType()).isEqualTo(ActionType.ADJUST_CONFIDENCE);
      assertThat(action.getConfidenceAdjustment()).isEqualTo(LearningSuggestionService.FALLBACK_ADJUSTMENT);
    }

    @Test
    @DisplayName("Should clamp suggested weights")
    void shouldClampWeights() throws Exception {
      JsonNode item = json("{\"type\":\"adjust_weight\",\"change\":{\"attributeName\":\"risk\",\"weight\":1.4}}");

      ProposedChange change = service.normalize(item, activeMatrix, "a-1").get().getProposedChange();

      assertThat(change.getAttributeName()).isEqualTo("risk");
      assertThat(change.getWeight()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should drop suggestions that do not fit the active matrix")
    void shouldDropUnusableSuggestions() throws Exception {
      assertThat(service.normalize(json("{\"type\":\"merge_rules\",\"change\":{}}"), activeMatrix, "a-1")).isEmpty();
      assertThat(service.normalize(json("{\"type\":\"remove_rule\",\"change\":{\"ruleId\":\"ghost\"}}"), activeMatrix, "a-1"))
          .isEmpty();
      assertThat(
              service.normalize(
                  json("{\"type\":\"adjust_weight\",\"change\":{\"attributeName\":\"budget\",\"weight\":0.4}}"),
                  activeMatrix,
                  "a-1"))
          .isEmpty();
      assertThat(
              service.normalize(
                  json("{\"type\":\"new_attribute\",\"change\":{\"attribute\":{\"name\":\"risk\",\"type\":\"categorical\"}}}"),
                  activeMatrix,
                  "a-1"))
          .isEmpty();
    }

    @Test
    @DisplayName("Should accept removal of an existing rule")
    void shouldAcceptRemoval() throws Exception {
      Optional<LearningSuggestion> suggestion =
          service.normalize(json("{\"type\":\"remove_rule\",\"change\":{\"ruleId\":\"daily-rpa\"}}"), activeMatrix, "a-1");

      assertThat(suggestion).isPresent();
      assertThat(suggestion.get().getProposedChange().getRuleId()).isEqualTo("daily-rpa");
    }
  }

  @Nested
  @DisplayName("Generation")
  class GenerationTests {

    @Test
    @DisplayName("Should store only the usable suggestions")
    void shouldStoreUsableSuggestions() throws Exception {
      // Given
      when(decisionMatrixService.getActiveMatrix()).thenReturn(activeMatrix);
      List<JsonNode> items =
          Arrays.asList(
              json("{\"type\":\"remove_rule\",\"change\":{\"ruleId\":\"daily-rpa\"}}"),
              json("{\"type\":\"remove_rule\",\"change\":{\"ruleId\":\"ghost\"}}"));
      when(llmClient.generateRuleSuggestions(anyString(), anyString())).thenReturn(LlmResult.ok(items));

      // When
      List<LearningSuggestion> suggestions = service.generate("a-1", "{}");

      // Then
      assertThat(suggestions).hasSize(1);
      verify(learningRepository, times(1)).saveSuggestion(any());
    }

    @Test
    @DisplayName("Should fail when the LLM reply is unusable")
    void shouldFailOnUnusableReply() {
      when(decisionMatrixService.getActiveMatrix()).thenReturn(activeMatrix);
      when(llmClient.generateRuleSuggestions(anyString(), anyString())).thenReturn(LlmResult.malformed("no JSON"));

      assertThatThrownBy(() -> service.generate("a-1", "{}"))
          .isInstanceOf(SuggestionGenerationException.class)
          .hasMessageContaining("no JSON");
      verify(learningRepository, never()).saveSuggestion(any());
    }
  }

  @Nested
  @DisplayName("Review workflow")
  class ReviewTests {

    @Test
    @DisplayName("Should publish a new matrix version when a suggestion is approved")
    void shouldApplyOnApproval() {
      // Given
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(pendingNewRule()));
      when(decisionMatrixService.getActiveMatrix()).thenReturn(activeMatrix);
      when(decisionMatrixService.publish(any(), eq("reviewer"), anyString()))
          .thenAnswer(invocation -> ((DecisionMatrix) invocation.getArgument(0)).toBuilder().version("1.1").build());

      // When
      LearningSuggestion result = service.approve("s-1", new ReviewRequest("reviewer", "Looks right"));

      // Then
      assertThat(result.getStatus()).isEqualTo(SuggestionStatus.APPLIED);
      assertThat(result.getAppliedVersion()).isEqualTo("1.1");
      assertThat(result.getReviewedBy()).isEqualTo("reviewer");

      ArgumentCaptor<DecisionMatrix> draft = ArgumentCaptor.forClass(DecisionMatrix.class);
      verify(decisionMatrixService).publish(draft.capture(), eq("reviewer"), eq("Applied suggestion s-1"));
      assertThat(draft.getValue().getRules()).hasSize(2);
      assertThat(draft.getValue().getBasedOnVersion()).isEqualTo("1.0");
      assertThat(activeMatrix.getRules()).hasSize(1);
    }

    @Test
    @DisplayName("Should leave an approved suggestion approved when publishing fails")
    void shouldStayApprovedWhenApplyFails() {
      // Given
      LearningSuggestion suggestion = pendingNewRule();
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(suggestion));
      when(decisionMatrixService.getActiveMatrix()).thenReturn(activeMatrix);
      when(decisionMatrixService.publish(any(), anyString(), anyString()))
          .thenThrow(new StorageException("disk full", null));

      // When / Then
      assertThatThrownBy(() -> service.approve("s-1", new ReviewRequest("reviewer", null)))
          .isInstanceOf(StorageException.class);
      assertThat(suggestion.getStatus()).isEqualTo(SuggestionStatus.APPROVED);
      assertThat(suggestion.getAppliedVersion()).isNull();
    }

    @Test
    @DisplayName("Should not approve a rejected suggestion")
    void shouldNotApproveRejectedSuggestion() {
      // Given
      LearningSuggestion suggestion = pendingNewRule();
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(suggestion));
      service.reject("s-1", new ReviewRequest("reviewer", "Too broad"));

      // When / Then
      assertThat(suggestion.getStatus()).isEqualTo(SuggestionStatus.REJECTED);
      assertThatThrownBy(() -> service.approve("s-1", new ReviewRequest("reviewer", null)))
          .isInstanceOf(WorkflowViolationException.class);
      verify(decisionMatrixService, never()).publish(any(), anyString(), anyString());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    @DisplayName("Should refuse to review a suggestion that was already applied")
    void shouldNotReviewAppliedSuggestion(boolean approve) {
      // Given
      LearningSuggestion applied =
          pendingNewRule().toBuilder().status(SuggestionStatus.APPLIED).appliedVersion("1.1").build();
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(applied));
      ReviewRequest review = new ReviewRequest("reviewer", "again");

      // When / Then
      assertThatThrownBy(() -> {
            if (approve) {
              service.approve("s-1", review);
            } else {
              service.reject("s-1", review);
            }
          })
          .isInstanceOf(WorkflowViolationException.class);
      assertThat(applied.getStatus()).isEqualTo(SuggestionStatus.APPLIED);
      verify(learningRepository, never()).saveSuggestion(any());
      verify(decisionMatrixService, never()).publish(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("Should apply a suggestion once when two reviewers approve it at the same time")
    void shouldApplyOnceUnderConcurrentApproval() throws Exception {
      // Given
      LearningSuggestion suggestion = pendingNewRule();
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(suggestion));
      when(decisionMatrixService.getActiveMatrix()).thenReturn(activeMatrix);
      when(decisionMatrixService.publish(any(), anyString(), anyString()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(100);
                return ((DecisionMatrix) invocation.getArgument(0)).toBuilder().version("1.1").build();
              });
      CountDownLatch start = new CountDownLatch(1);
      Callable<LearningSuggestion> approval =
          () -> {
            start.await();
            return service.approve("s-1", new ReviewRequest("reviewer", null));
          };
      ExecutorService pool = Executors.newFixedThreadPool(2);

      // When
      List<Future<LearningSuggestion>> futures = new ArrayList<>();
      futures.add(pool.submit(approval));
      futures.add(pool.submit(approval));
      start.countDown();
      int succeeded = 0;
      int refused = 0;
      for (Future<LearningSuggestion> future : futures) {
        try {
          future.get(5, TimeUnit.SECONDS);
          succeeded++;
        } catch (ExecutionException e) {
          assertThat(e.getCause()).isInstanceOf(WorkflowViolationException.class);
          refused++;
        }
      }
      pool.shutdown();

      // Then
      assertThat(succeeded).isEqualTo(1);
      assertThat(refused).isEqualTo(1);
      assertThat(suggestion.getStatus()).isEqualTo(SuggestionStatus.APPLIED);
      verify(decisionMatrixService, times(1)).publish(any(), anyString(), anyString());
    }

    @Test
    @DisplayName("Should refuse to apply a suggestion that was never approved")
    void shouldNotApplyPendingSuggestion() {
      when(learningRepository.findSuggestion("s-1")).thenReturn(Optional.of(pendingNewRule()));

      assertThatThrownBy(() -> service.apply("s-1", "admin")).isInstanceOf(WorkflowViolationException.class);
    }

    @Test
    @DisplayName("Should filter suggestions by status")
    void shouldFilterByStatus() {
      // Given
      LearningSuggestion rejected = pendingNewRule().toBuilder().id("s-2").status(SuggestionStatus.REJECTED).build();
      when(learningRepository.findAllSuggestions())
          .thenReturn(new ArrayList<>(Arrays.asList(pendingNewRule(), rejected)));

      // When / Then
      assertThat(service.list(SuggestionStatus.REJECTED)).extracting(LearningSuggestion::getId).containsExactly("s-2");
      assertThat(service.list(null)).hasSize(2);
    }
  }
}
