package com.catalai.classifier.service.matrix;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.matrix.ActionType;
import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.Condition;
import com.catalai.classifier.dto.matrix.DecisionMatrix;
import com.catalai.classifier.dto.matrix.DecisionMatrixEvaluation;
import com.catalai.classifier.dto.matrix.EvaluateMatrixRequest;
import com.catalai.classifier.dto.matrix.MatrixCreator;
import com.catalai.classifier.dto.matrix.MatrixExport;
import com.catalai.classifier.dto.matrix.Rule;
import com.catalai.classifier.dto.matrix.SaveMatrixRequest;
import com.catalai.classifier.exception.CollaboratorFailureException;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.llm.ClassificationLlmClient;
import com.catalai.classifier.service.llm.LlmResult;
import com.catalai.classifier.service.storage.DecisionMatrixRepository;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Reads, publishes and evaluates decision matrix versions. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DecisionMatrixService {

  static final String EXPORT_FORMAT_VERSION = "1.0";
  static final String STAGE_GENERATION = "matrix_generation";

  private final DecisionMatrixRepository repository;
  private final DecisionMatrixEvaluator evaluator;
  private final DecisionMatrixParser parser;
  private final ClassificationLlmClient llmClient;
  private final AuditLogService auditLogService;

  /** The active matrix, generating version 1.0 when none exists yet. */
  public DecisionMatrix getActiveMatrix() {
    return repository.getActiveMatrix().orElseGet(this::generateInitial);
  }

  /**
   * Asks the LLM for a baseline matrix and publishes it as the first version. Concurrent callers
   * wait for the first generation instead of generating twice.
   */
  public synchronized DecisionMatrix generateInitial() {
    Optional<DecisionMatrix> existing = repository.getActiveMatrix();
    if (existing.isPresent()) {
      return existing.get();
    }
    log.info("No decision matrix found, generating the initial version");
    long start = System.currentTimeMillis();
    LlmResult<JsonNode> result = llmClient.generateInitialMatrix();
    if (!result.isOk()) {
      throw new CollaboratorFailureException(
          AuditEvent.SYSTEM_CASE_ID,
          STAGE_GENERATION,
          "Initial decision matrix could not be generated: " + result.getError(),
          result.getCause());
    }
    DecisionMatrix draft = parser.parseGenerated(result.getValue());
    if (draft.getAttributes().isEmpty()) {
      throw new CollaboratorFailureException(
          AuditEvent.SYSTEM_CASE_ID,
          STAGE_GENERATION,
          "Generated decision matrix declared no attributes",
          null);
    }
    DecisionMatrix published = repository.saveNewMatrixVersion(draft, false);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("attributes", published.getAttributes().size());
    data.put("rules", published.getRules().size());
    auditLogService.record(
        AuditEvent.builder()
            .eventType(AuditEventType.MATRIX_GENERATED)
            .matrixVersion(published.getVersion())
            .modelId(llmClient.currentModelId())
            .provider(llmClient.currentProvider())
            .latencyMs(System.currentTimeMillis() - start)
            .data(data)
            .build());
    return published;
  }

  public DecisionMatrix getVersion(String version) {
    return repository
        .getMatrixVersion(version)
        .orElseThrow(() -> ResourceNotFoundException.of("Decision matrix version", version));
  }

  public List<String> listVersions() {
    return repository.listMatrixVersions();
  }

  public String getActiveVersion() {
    return repository.getActiveVersion().orElse(null);
  }

  /**
   * Publishes an edited matrix as a new version. A draft based on a version that is no longer
   * active is still published; the conflict is logged and audited.
   */
  public DecisionMatrix save(SaveMatrixRequest request, String userId) {
    List<String> warnings = validate(request.getAttributes(), request.getRules());
    String active = getActiveVersion();
    boolean conflict = request.getBasedOnVersion() != null && !request.getBasedOnVersion().equals(active);
    if (conflict) {
      log.warn(
          "Matrix edit based on {} saved while {} is active; publishing anyway",
          request.getBasedOnVersion(),
          active);
    }

    DecisionMatrix draft =
        DecisionMatrix.builder()
            .createdBy(MatrixCreator.ADMIN)
            .description(request.getDescription())
            .attributes(new ArrayList<>(request.getAttributes()))
            .rules(withRuleIds(request.getRules()))
            .basedOnVersion(request.getBasedOnVersion() != null ? request.getBasedOnVersion() : active)
            .build();
    DecisionMatrix published = repository.saveNewMatrixVersion(draft, request.isMajorBump());

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("basedOnVersion", draft.getBasedOnVersion());
    data.put("previousVersion", published.getPreviousVersion());
    data.put("conflict", conflict);
    data.put("rules", published.getRules().size());
    if (!warnings.isEmpty()) {
      data.put("warnings", warnings);
    }
    auditLogService.record(
        AuditEvent.builder()
            .eventType(AuditEventType.MATRIX_SAVED)
            .userId(userId)
            .matrixVersion(published.getVersion())
            .data(data)
            .build());
    return published;
  }

  /** Publishes the result of an approved suggestion. */
  public DecisionMatrix publish(DecisionMatrix draft, String userId, String reason) {
    DecisionMatrix published =
        repository.saveNewMatrixVersion(
            draft.toBuilder()
                .createdBy(MatrixCreator.ADMIN)
                .createdAt(null)
                .rules(withRuleIds(draft.getRules()))
                .build(),
            false);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("basedOnVersion", draft.getBasedOnVersion());
    data.put("reason", reason);
    auditLogService.record(
        AuditEvent.builder()
            .eventType(AuditEventType.MATRIX_SAVED)
            .userId(userId)
            .matrixVersion(published.getVersion())
            .data(data)
            .build());
    return published;
  }

  public DecisionMatrixEvaluation evaluate(EvaluateMatrixRequest request) {
    DecisionMatrix matrix =
        request.getMatrixVersion() != null
            ? getVersion(request.getMatrixVersion())
            : getActiveMatrix();
    return evaluate(matrix, request.getAttributes(), request.getClassification());
  }

  public DecisionMatrixEvaluation evaluate(
      DecisionMatrix matrix, Map<String, Object> attributes, Classification classification) {
    DecisionMatrixEvaluation evaluation = evaluator.evaluate(matrix, attributes, classification);
    if (!evaluation.getWarnings().isEmpty()) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("warnings", evaluation.getWarnings());
      auditLogService.record(
          AuditEvent.builder()
              .eventType(AuditEventType.RULE_WARNING)
              .matrixVersion(matrix.getVersion())
              .data(data)
              .build());
    }
    return evaluation;
  }

  public MatrixExport export(String userId) {
    return MatrixExport.builder()
        .exportedAt(Instant.now())
        .exportedBy(userId)
        .formatVersion(EXPORT_FORMAT_VERSION)
        .matrix(getActiveMatrix())
        .build();
  }

  /** Publishes an exported matrix as a new version. */
  public DecisionMatrix importMatrix(MatrixExport export, String userId) {
    DecisionMatrix source = export.getMatrix();
    if (source == null) {
      throw new IllegalArgumentException("Import does not contain a matrix");
    }
    String description = source.getDescription() == null ? "" : source.getDescription().trim();
    SaveMatrixRequest request =
        SaveMatrixRequest.builder()
            .basedOnVersion(getActiveVersion())
            .description((description + " (Imported from v" + source.getVersion() + ")").trim())
            .attributes(source.getAttributes() != null ? source.getAttributes() : new ArrayList<>())
            .rules(source.getRules() != null ? source.getRules() : new ArrayList<>())
            .build();
    log.info("Importing decision matrix exported from version {}", source.getVersion());
    return save(request, userId);
  }

  /**
   * Rejects structurally invalid content.
   *
   * @return warnings for conditions on undeclared attributes, which are kept
   */
  List<String> validate(List<Attribute> attributes, List<Rule> rules) {
    Set<String> names = new HashSet<>();
    for (Attribute attribute : attributes) {
      if (attribute.getName() == null || attribute.getName().isBlank()) {
        throw new IllegalArgumentException("Attribute name is required");
      }
      if (!names.add(attribute.getName())) {
        throw new IllegalArgumentException("Duplicate attribute name: " + attribute.getName());
      }
      if (attribute.getWeight() < 0 || attribute.getWeight() > 1) {
        throw new IllegalArgumentException(
            "Weight of attribute " + attribute.getName() + " must be between 0 and 1");
      }
    }

    List<String> warnings = new ArrayList<>();
    Set<String> ruleIds = new HashSet<>();
    for (Rule rule : rules) {
      String label = rule.getName() != null ? rule.getName() : rule.getRuleId();
      if (rule.getRuleId() != null && !ruleIds.add(rule.getRuleId())) {
        throw new IllegalArgumentException("Duplicate rule id: " + rule.getRuleId());
      }
      if (rule.getAction() == null || rule.getAction().getType() == null) {
        throw new IllegalArgumentException("Rule " + label + " has no action");
      }
      if (rule.getAction().getType() == ActionType.OVERRIDE
          && rule.getAction().getTargetCategory() == null) {
        throw new IllegalArgumentException("Override rule " + label + " needs a target category");
      }
      if (rule.getAction().getType() == ActionType.ADJUST_CONFIDENCE) {
        Double delta = rule.getAction().getConfidenceAdjustment();
        if (delta == null || delta < -1 || delta > 1) {
          throw new IllegalArgumentException(
              "Rule " + label + " needs a confidence adjustment between -1 and 1");
        }
      }
      if (rule.getConditions() == null) {
        throw new IllegalArgumentException("Rule " + label + " has no conditions list");
      }
      for (Condition condition : rule.getConditions()) {
        if (condition == null || condition.getOperator() == null) {
          throw new IllegalArgumentException("Rule " + label + " has a condition without operator");
        }
        if (!names.contains(condition.getAttribute())) {
          String warning =
              String.format("Rule '%s' references undeclared attribute '%s'", label, condition.getAttribute());
          log.warn("{}; the condition will never match", warning);
          warnings.add(warning);
        }
      }
    }
    return warnings;
  }

  private static List<Rule> withRuleIds(List<Rule> rules) {
    List<Rule> result = new ArrayList<>();
    for (Rule rule : rules) {
      result.add(
          rule.getRuleId() == null || rule.getRuleId().isBlank()
              ? rule.toBuilder().ruleId(UUID.randomUUID().toString()).build()
              : rule);
    }
    return result;
  }
}
