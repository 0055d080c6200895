package com.catalai.classifier.service.classification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.clarification.ClarificationSession;
import com.catalai.classifier.dto.clarification.ClarificationState;
import com.catalai.classifier.dto.classification.ClarificationExchange;
import com.catalai.classifier.dto.classification.ClarificationQuestion;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.matrix.ActionType;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
import com.catalai.classifier.dto.matrix.TriggeredRule;
import com.catalai.classifier.dto.process.CaseStatus;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.process.ProcessAction;
import com.catalai.classifier.dto.process.ProcessResponse;
import com.catalai.classifier.dto.process.SubmitProcessRequest;
import com.catalai.classifier.exception.CollaboratorFailureException;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.exception.WorkflowViolationException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.clarification.ClarificationEngine;
import com.catalai.classifier.service.llm.ClassificationLlmClient;
import com.catalai.classifier.service.llm.LlmResult;
import com.catalai.classifier.service.matrix.DecisionMatrixEvaluator;
import com.catalai.classifier.service.matrix.DecisionMatrixService;
import com.catalai.classifier.service.storage.CaseRepository;
import com.google.common.util.concurrent.Striped;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a case from submission to a final classification: initial LLM classification, the
 * clarification dialogue, attribute extraction and rule evaluation.
 *
 * <p>Turns of one case are serialized. Each turn works on copies of the clarification session
 * and the exchanges and writes them back only when the turn completes, so a failed LLM call
 * leaves the stored case exactly as it was and the caller can resubmit the same turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationOrchestrator {

  static final String STAGE_CLASSIFICATION = "classification";
  static final String STAGE_QUESTIONS = "question_generation";
  static final String STAGE_ATTRIBUTES = "attribute_extraction";
  static final String STAGE_MATRIX = "matrix";

  static final String REASON_CLASSIFICATION_UNAVAILABLE = "classification unavailable";
  static final String REASON_QUESTIONS_UNAVAILABLE = "clarifying questions unavailable";

  private final ClassificationLlmClient llmClient;
  private final ClarificationEngine clarificationEngine;
  private final DecisionMatrixService decisionMatrixService;
  private final AttributeHeuristics attributeHeuristics;
  private final CaseRepository caseRepository;
  private final AuditLogService auditLogService;

  private final Striped<Lock> caseLocks = Striped.lock(64);

  /** Holds the working copies of one turn. */
  private static final class Turn {
    private final ClassificationCase classificationCase;
    private final ClarificationSession session;
    private final List<ClarificationExchange> exchanges;
    private boolean fallback;

    private Turn(ClassificationCase classificationCase) {
      this.classificationCase = classificationCase;
      this.session = classificationCase.getClarification().copy();
      this.exchanges = new ArrayList<>(classificationCase.getExchanges());
    }

    private String caseId() {
      return classificationCase.getCaseId();
    }
  }

  public ProcessResponse submit(SubmitProcessRequest request) {
    Instant now = Instant.now();
    ClassificationCase classificationCase =
        ClassificationCase.builder()
            .caseId(UUID.randomUUID().toString())
            .createdAt(now)
            .updatedAt(now)
            .userId(request.getUserId())
            .subject(request.getSubject())
            .description(request.getDescription().trim())
            .build();
    return withCaseLock(
        classificationCase.getCaseId(),
        () -> {
          Map<String, Object> data = new LinkedHashMap<>();
          data.put("descriptionLength", classificationCase.getDescription().length());
          data.put("subject", classificationCase.getSubject());
          audit(classificationCase.getCaseId(), AuditEventType.INPUT, classificationCase.getUserId(), data);

          Turn turn = new Turn(classificationCase);
          Classification classification = classify(turn);
          if (classification == null) {
            clarificationEngine.stop(turn.session, REASON_CLASSIFICATION_UNAVAILABLE);
            return commitWithoutClassification(turn);
          }
          classificationCase.setLlmClassification(classification);
          clarificationEngine.evaluate(turn.session, classification);
          return advance(turn, classification);
        });
  }

  public ProcessResponse answer(String caseId, List<String> answers) {
    return withCaseLock(
        caseId,
        () -> {
          ClassificationCase classificationCase = requireActive(caseId);
          Turn turn = new Turn(classificationCase);

          List<ClarificationQuestion> pending = new ArrayList<>(turn.session.getPendingQuestions());
          clarificationEngine.recordAnswers(turn.session, answers);
          for (int i = 0; i < answers.size(); i++) {
            turn.exchanges.add(new ClarificationExchange(pending.get(i).getQuestion(), answers.get(i)));
          }

          Classification classification = classify(turn);
          if (classification == null) {
            clarificationEngine.stop(turn.session, REASON_CLASSIFICATION_UNAVAILABLE);
            return complete(turn, classificationCase.getLlmClassification());
          }
          clarificationEngine.evaluate(turn.session, classification);
          return advance(turn, classification);
        });
  }

  /** Stops the interview and classifies with what is known so far. */
  public ProcessResponse forceClassify(String caseId) {
    return withCaseLock(
        caseId,
        () -> {
          ClassificationCase classificationCase = requireActive(caseId);
          Turn turn = new Turn(classificationCase);
          clarificationEngine.forceClassify(turn.session);
          log.info("Case {} force-classified after {} answers", caseId, turn.session.getTurnsTaken());
          return complete(turn, classificationCase.getLlmClassification());
        });
  }

  public ClassificationCase getCase(String caseId) {
    return caseRepository
        .findById(caseId)
        .orElseThrow(() -> ResourceNotFoundException.of("Case", caseId));
  }

  private ProcessResponse advance(Turn turn, Classification classification) {
    turn.classificationCase.setLlmClassification(classification);
    if (turn.session.getState() != ClarificationState.ASKING) {
      return complete(turn, classification);
    }

    ClarificationSession session = turn.session;
    LlmResult<List<ClarificationQuestion>> generated =
        llmClient.generateQuestions(
            turn.classificationCase.getDescription(),
            classification,
            turn.exchanges,
            clarificationEngine.remainingBudget(session),
            clarificationEngine.questionQuota(session));
    if (generated.getStatus() == LlmResult.Status.FAILED) {
      throw failure(turn, STAGE_QUESTIONS, generated);
    }
    if (generated.getStatus() == LlmResult.Status.MALFORMED) {
      recordFallback(turn, STAGE_QUESTIONS, generated);
      clarificationEngine.stop(session, REASON_QUESTIONS_UNAVAILABLE);
      return complete(turn, classification);
    }

    List<ClarificationQuestion> issued = clarificationEngine.acceptQuestions(session, generated.getValue());
    if (issued.isEmpty()) {
      return complete(turn, classification);
    }

    commit(turn, CaseStatus.ACTIVE);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("round", session.getRoundsIssued());
    data.put("questions", issued.stream().map(ClarificationQuestion::getQuestion).collect(Collectors.toList()));
    data.put("confidence", classification.getConfidence());
    audit(turn.caseId(), AuditEventType.CLARIFICATION, turn.classificationCase.getUserId(), data);

    return ProcessResponse.builder()
        .caseId(turn.caseId())
        .action(ProcessAction.CLARIFY)
        .questions(issued)
        .classification(classification)
        .softLimitWarning(session.isSoftLimitWarning())
        .turnsTaken(session.getTurnsTaken())
        .fallback(turn.fallback)
        .build();
  }

  /** Extracts attributes, applies the active matrix and stores the final result. */
  private ProcessResponse complete(Turn turn, Classification classification) {
    if (classification == null) {
      return commitWithoutClassification(turn);
    }
    ClassificationCase classificationCase = turn.classificationCase;
    DecisionMatrix matrix;
    try {
      matrix = decisionMatrixService.getActiveMatrix();
    } catch (CollaboratorFailureException e) {
      throw new CollaboratorFailureException(turn.caseId(), STAGE_MATRIX, e.getMessage(), e);
    }

    Map<String, Object> attributes = extractAttributes(turn, matrix.getAttributes());
    DecisionMatrixEvaluation evaluation = decisionMatrixService.evaluate(matrix, attributes, classification);
    Classification finalClassification = evaluation.getFinalClassification();

    ClarificationSession session = turn.session;
    boolean manualReview = session.isManualReviewRequired() || evaluation.isReviewFlagged();
    String reason = reviewReason(session, evaluation);

    classificationCase.setClassification(finalClassification);
    classificationCase.setEvaluation(evaluation);
    classificationCase.setManualReviewReason(manualReview ? reason : null);
    commit(turn, manualReview ? CaseStatus.MANUAL_REVIEW : CaseStatus.CLASSIFIED);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("category", finalClassification.getCategory().getDisplayName());
    data.put("confidence", finalClassification.getConfidence());
    data.put("llmCategory", classification.getCategory().getDisplayName());
    data.put("overridden", evaluation.isOverridden());
    data.put(
        "triggeredRules",
        evaluation.getTriggeredRules().stream().map(TriggeredRule::getRuleId).collect(Collectors.toList()));
    data.put("manualReview", manualReview);
    data.put("reason", reason);
    data.put("turnsTaken", session.getTurnsTaken());
    data.put("interviewSkipped", session.isInterviewSkipped());
    auditLogService.record(
        AuditEvent.builder()
            .caseId(turn.caseId())
            .eventType(AuditEventType.CLASSIFICATION)
            .userId(classificationCase.getUserId())
            .modelId(classification.getModelId())
            .provider(llmClient.currentProvider())
            .matrixVersion(evaluation.getMatrixVersion())
            .data(data)
            .build());
    log.info(
        "Case {} classified as {} ({}) with matrix {}{}",
        turn.caseId(),
        finalClassification.getCategory(),
        String.format("%.2f", finalClassification.getConfidence()),
        evaluation.getMatrixVersion(),
        manualReview ? ", manual review: " + reason : "");

    return ProcessResponse.builder()
        .caseId(turn.caseId())
        .action(manualReview ? ProcessAction.MANUAL_REVIEW : ProcessAction.CLASSIFIED)
        .classification(finalClassification)
        .evaluation(evaluation)
        .manualReview(manualReview)
        .reason(reason)
        .softLimitWarning(session.isSoftLimitWarning())
        .interviewSkipped(session.isInterviewSkipped())
        .fallback(turn.fallback)
        .turnsTaken(session.getTurnsTaken())
        .build();
  }

  /** No usable classification exists; the case goes to manual review as is. */
  private ProcessResponse commitWithoutClassification(Turn turn) {
    turn.classificationCase.setManualReviewReason(turn.session.getStopReason());
    commit(turn, CaseStatus.MANUAL_REVIEW);
    return ProcessResponse.builder()
        .caseId(turn.caseId())
        .action(ProcessAction.MANUAL_REVIEW)
        .manualReview(true)
        .reason(turn.session.getStopReason())
        .fallback(true)
        .turnsTaken(turn.session.getTurnsTaken())
        .build();
  }

  /** Runs the LLM classification; null means the reply was unusable after all retries. */
  private Classification classify(Turn turn) {
    LlmResult<Classification> result =
        llmClient.classify(turn.classificationCase.getDescription(), turn.exchanges);
    switch (result.getStatus()) {
      case OK:
        return result.getValue();
      case MALFORMED:
        recordFallback(turn, STAGE_CLASSIFICATION, result);
        return null;
      default:
        throw failure(turn, STAGE_CLASSIFICATION, result);
    }
  }

  /** Every declared attribute gets a value; anything missing is {@code unknown}. */
  private Map<String, Object> extractAttributes(Turn turn, List<Attribute> declared) {
    LlmResult<Map<String, Object>> result =
        llmClient.extractAttributes(turn.classificationCase.getDescription(), turn.exchanges, declared);
    if (result.getStatus() == LlmResult.Status.FAILED) {
      throw failure(turn, STAGE_ATTRIBUTES, result);
    }
    if (result.getStatus() == LlmResult.Status.MALFORMED) {
      recordFallback(turn, STAGE_ATTRIBUTES, result);
      return attributeHeuristics.extract(turn.classificationCase.getDescription(), turn.exchanges, declared);
    }

    Map<String, Object> values = new LinkedHashMap<>();
    for (Attribute attribute : declared) {
      Object value = result.getValue().get(attribute.getName());
      values.put(attribute.getName(), value == null ? DecisionMatrixEvaluator.UNKNOWN : value);
    }
    return values;
  }

  private static String reviewReason(ClarificationSession session, DecisionMatrixEvaluation evaluation) {
    List<String> reasons = new ArrayList<>();
    if (session.getStopReason() != null) {
      reasons.add(session.getStopReason());
    }
    if (evaluation.isReviewFlagged()) {
      evaluation.getTriggeredRules().stream()
          .filter(r -> r.getAction() != null && r.getAction().getType() == ActionType.FLAG_REVIEW)
          .map(r -> "flagged by rule '" + r.getRuleName() + "'")
          .forEach(reasons::add);
    }
    return reasons.isEmpty() ? null : String.join("; ", reasons);
  }

  private void commit(Turn turn, CaseStatus status) {
    ClassificationCase classificationCase = turn.classificationCase;
    classificationCase.setClarification(turn.session);
    classificationCase.setExchanges(turn.exchanges);
    classificationCase.setStatus(status);
    classificationCase.setFallbackUsed(classificationCase.isFallbackUsed() || turn.fallback);
    caseRepository.save(classificationCase);
  }

  private ClassificationCase requireActive(String caseId) {
    ClassificationCase classificationCase = getCase(caseId);
    if (classificationCase.getStatus() != CaseStatus.ACTIVE) {
      throw new WorkflowViolationException(
          "Case " + caseId + " is already " + classificationCase.getStatus());
    }
    return classificationCase;
  }

  private void recordFallback(Turn turn, String stage, LlmResult<?> result) {
    turn.fallback = true;
    log.warn("Case {}: {} unusable after retries, falling back ({})", turn.caseId(), stage, result.getError());
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("stage", stage);
    data.put("error", result.getError());
    audit(turn.caseId(), AuditEventType.FALLBACK, turn.classificationCase.getUserId(), data);
  }

  private CollaboratorFailureException failure(Turn turn, String stage, LlmResult<?> result) {
    log.error("Case {}: {} failed after retries: {}", turn.caseId(), stage, result.getError());
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("stage", stage);
    data.put("error", result.getError());
    data.put("retryable", true);
    audit(turn.caseId(), AuditEventType.ERROR, turn.classificationCase.getUserId(), data);
    return new CollaboratorFailureException(turn.caseId(), stage, result.getError(), result.getCause());
  }

  private void audit(String caseId, AuditEventType type, String userId, Map<String, Object> data) {
    auditLogService.record(
        AuditEvent.builder().caseId(caseId).eventType(type).userId(userId).data(data).build());
  }

  private <T> T withCaseLock(String caseId, Supplier<T> work) {
    Lock lock = caseLocks.get(caseId);
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
