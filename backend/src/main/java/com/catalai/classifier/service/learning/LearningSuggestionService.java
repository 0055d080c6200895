package com.catalai.classifier.service.learning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.learning.ImpactEstimate;
import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.ProposedChange;
import com.catalai.classifier.dto.learning.ReviewRequest;
import com.catalai.classifier.dto.learning.SuggestionStatus;
import com.catalai.classifier.dto.learning.SuggestionType;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.exception.CollaboratorFailureException;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.llm.ClassificationLlmClient;
import com.catalai.classifier.service.llm.LlmResult;
import com.catalai.classifier.service.matrix.DecisionMatrixParser;
import com.catalai.classifier.service.matrix.DecisionMatrixService;
import com.catalai.classifier.service.storage.LearningRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Striped;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Generates rule suggestions from analysis evidence and runs their review workflow. Approving a
 * suggestion applies it, publishing a new matrix version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LearningSuggestionService {

  /** Delta used when a suggested override names no valid category. */
  static final double FALLBACK_ADJUSTMENT = 0.1;

  private final LearningRepository learningRepository;
  private final DecisionMatrixService decisionMatrixService;
  private final DecisionMatrixParser matrixParser;
  private final SuggestionApplier suggestionApplier;
  private final ClassificationLlmClient llmClient;
  private final AuditLogService auditLogService;
  private final ObjectMapper objectMapper;

  private final Striped<Lock> suggestionLocks = Striped.lock(32);

  /**
   * Asks the LLM for suggestions and stores the usable ones as pending.
   *
   * @throws SuggestionGenerationException when the LLM reply is unusable or no matrix exists
   */
  public List<LearningSuggestion> generate(String analysisId, String evidenceJson) {
    DecisionMatrix matrix;
    String matrixJson;
    try {
      matrix = decisionMatrixService.getActiveMatrix();
      matrixJson = objectMapper.writeValueAsString(matrix);
    } catch (CollaboratorFailureException | JsonProcessingException e) {
      throw new SuggestionGenerationException("active matrix unavailable", e);
    }

    LlmResult<List<JsonNode>> result = llmClient.generateRuleSuggestions(evidenceJson, matrixJson);
    if (!result.isOk()) {
      throw new SuggestionGenerationException(result.getError(), result.getCause());
    }

    List<LearningSuggestion> suggestions = new ArrayList<>();
    for (JsonNode item : result.getValue()) {
      normalize(item, matrix, analysisId).ifPresent(suggestions::add);
    }
    suggestions.forEach(learningRepository::saveSuggestion);
    log.info(
        "Analysis {}: kept {} of {} generated suggestions",
        analysisId,
        suggestions.size(),
        result.getValue().size());
    return suggestions;
  }

  /** Validates one generated suggestion against the matrix it would change. */
  Optional<LearningSuggestion> normalize(JsonNode item, DecisionMatrix matrix, String analysisId) {
    Optional<SuggestionType> type = SuggestionType.find(item.path("type").asText(null));
    if (type.isEmpty()) {
      log.warn("Dropping suggestion with unknown type '{}'", item.path("type").asText());
      return Optional.empty();
    }
    JsonNode change = item.has("change") ? item.get("change") : item.path("proposedChange");

    Optional<ProposedChange> proposed;
    switch (type.get()) {
      case NEW_RULE:
        proposed =
            parseRule(change, matrix)
                .map(r -> ProposedChange.builder().rule(r.toBuilder().ruleId(UUID.randomUUID().toString()).build()).build());
        break;
      case MODIFY_RULE:
        String modifiedId = ruleId(change);
        proposed =
            matrix.findRule(modifiedId).isEmpty()
                ? Optional.empty()
                : parseRule(change, matrix)
                    .map(r -> ProposedChange.builder().ruleId(modifiedId).rule(r.toBuilder().ruleId(modifiedId).build()).build());
        break;
      case REMOVE_RULE:
        String removedId = ruleId(change);
        proposed =
            matrix.findRule(removedId).map(r -> ProposedChange.builder().ruleId(removedId).build());
        break;
      case ADJUST_WEIGHT:
        String attributeName = change.path("attributeName").asText(null);
        proposed =
            matrix.findAttribute(attributeName).isEmpty() || !change.path("weight").isNumber()
                ? Optional.empty()
                : Optional.of(
                    ProposedChange.builder()
                        .attributeName(attributeName)
                        .weight(DecisionMatrixParser.clamp(change.path("weight").asDouble(), 0.0, 1.0))
                        .build());
        break;
      case NEW_ATTRIBUTE:
        JsonNode attributeNode = change.has("attribute") ? change.get("attribute") : change;
        proposed =
            matrixParser
                .parseAttribute(attributeNode)
                .filter(a -> matrix.findAttribute(a.getName()).isEmpty())
                .map(a -> ProposedChange.builder().attribute(a).build());
        break;
      default:
        proposed = Optional.empty();
    }
    if (proposed.isEmpty()) {
      log.warn("Dropping {} suggestion with an unusable change: {}", type.get().getValue(), change);
      return Optional.empty();
    }

    JsonNode impact = item.path("impact");
    return Optional.of(
        LearningSuggestion.builder()
            .id(UUID.randomUUID().toString())
            .analysisId(analysisId)
            .type(type.get())
            .status(SuggestionStatus.PENDING)
            .rationale(item.path("rationale").asText(""))
            .impact(
                ImpactEstimate.builder()
                    .affectedCases(Math.max(0, impact.path("affectedCases").asInt(0)))
                    .expectedImprovementPercent(impact.path("expectedImprovementPercent").asDouble(0.0))
                    .notes(impact.path("notes").asText(null))
                    .build())
            .proposedChange(proposed.get())
            .createdAt(Instant.now())
            .build());
  }

  /** Suggestions, most recent first, optionally filtered by status. */
  public List<LearningSuggestion> list(SuggestionStatus status) {
    return learningRepository.findAllSuggestions().stream()
        .filter(s -> status == null || s.getStatus() == status)
        .collect(Collectors.toList());
  }

  public LearningSuggestion get(String id) {
    return learningRepository
        .findSuggestion(id)
        .orElseThrow(() -> ResourceNotFoundException.of("Suggestion", id));
  }

  /** Approves a pending suggestion and applies it to the active matrix. */
  public LearningSuggestion approve(String id, ReviewRequest review) {
    return withSuggestionLock(
        id,
        () -> {
          LearningSuggestion suggestion = get(id);
          suggestion.setStatus(suggestion.getStatus().transitionTo(SuggestionStatus.APPROVED));
          suggestion.setReviewedBy(review.getReviewedBy());
          suggestion.setReviewedAt(Instant.now());
          suggestion.setReviewNotes(review.getReviewNotes());
          learningRepository.saveSuggestion(suggestion);
          auditReview(suggestion);
          return apply(suggestion, review.getReviewedBy());
        });
  }

  public LearningSuggestion reject(String id, ReviewRequest review) {
    return withSuggestionLock(
        id,
        () -> {
          LearningSuggestion suggestion = get(id);
          suggestion.setStatus(suggestion.getStatus().transitionTo(SuggestionStatus.REJECTED));
          suggestion.setReviewedBy(review.getReviewedBy());
          suggestion.setReviewedAt(Instant.now());
          suggestion.setReviewNotes(review.getReviewNotes());
          learningRepository.saveSuggestion(suggestion);
          auditReview(suggestion);
          return suggestion;
        });
  }

  /** Retries applying an approved suggestion whose earlier application failed. */
  public LearningSuggestion apply(String id, String userId) {
    return withSuggestionLock(id, () -> apply(get(id), userId));
  }

  private LearningSuggestion apply(LearningSuggestion suggestion, String userId) {
    SuggestionStatus applied = suggestion.getStatus().transitionTo(SuggestionStatus.APPLIED);
    DecisionMatrix active = decisionMatrixService.getActiveMatrix();
    DecisionMatrix draft = suggestionApplier.apply(active, suggestion);
    DecisionMatrix published =
        decisionMatrixService.publish(draft, userId, "Applied suggestion " + suggestion.getId());

    suggestion.setStatus(applied);
    suggestion.setAppliedVersion(published.getVersion());
    learningRepository.saveSuggestion(suggestion);
    log.info(
        "Suggestion {} ({}) applied as matrix version {}",
        suggestion.getId(),
        suggestion.getType().getValue(),
        published.getVersion());
    auditReview(suggestion);
    return suggestion;
  }

  private Optional<Rule> parseRule(JsonNode change, DecisionMatrix matrix) {
    JsonNode ruleNode = change.has("rule") ? change.get("rule") : change;
    List<Attribute> declared = matrix.getAttributes();
    return matrixParser.parseRule(ruleNode, declared, false, FALLBACK_ADJUSTMENT);
  }

  private static String ruleId(JsonNode change) {
    String ruleId = change.path("ruleId").asText(null);
    return ruleId != null ? ruleId : change.path("rule").path("ruleId").asText(null);
  }

  /** Reviews of one suggestion run one at a time, each re-reading the stored status. */
  private <T> T withSuggestionLock(String id, Supplier<T> work) {
    Lock lock = suggestionLocks.get(id);
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }

  private void auditReview(LearningSuggestion suggestion) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("suggestionId", suggestion.getId());
    data.put("type", suggestion.getType().getValue());
    data.put("status", suggestion.getStatus().getValue());
    data.put("reviewNotes", suggestion.getReviewNotes());
    auditLogService.record(
        AuditEvent.builder()
            .eventType(AuditEventType.SUGGESTION_REVIEWED)
            .userId(suggestion.getReviewedBy())
            .matrixVersion(suggestion.getAppliedVersion())
            .data(data)
            .build());
  }
}
