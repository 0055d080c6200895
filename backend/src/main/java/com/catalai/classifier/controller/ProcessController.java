package com.catalai.classifier.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.process.AnswersRequest;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.process.ProcessResponse;
import com.catalai.classifier.dto.process.SubmitProcessRequest;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.classification.ClassificationOrchestrator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/process")
@RequiredArgsConstructor
@Tag(name = "Process Classification", description = "Submit processes and answer clarifying questions")
public class ProcessController {

  private final ClassificationOrchestrator orchestrator;
  private final AuditLogService auditLogService;

  @PostMapping("/submit")
  @Operation(
      summary = "Submit a process description",
      description =
          "Classifies the description or returns the first clarifying questions when confidence is"
              + " in the clarification band")
  @ApiResponse(responseCode = "200", description = "Questions or a final classification")
  @ApiResponse(responseCode = "503", description = "The LLM was unavailable; resubmit")
  public ResponseEntity<ProcessResponse> submit(@Valid @RequestBody SubmitProcessRequest request) {
    log.info("Process submitted by {}", request.getUserId());
    return ResponseEntity.ok(orchestrator.submit(request));
  }

  @PostMapping("/{caseId}/answers")
  @Operation(
      summary = "Answer the pending questions",
      description = "Answers are matched to the pending questions in order")
  @ApiResponse(responseCode = "409", description = "The case is not waiting for answers")
  public ResponseEntity<ProcessResponse> answer(
      @Parameter(description = "Case identifier") @PathVariable String caseId,
      @Valid @RequestBody AnswersRequest request) {
    return ResponseEntity.ok(orchestrator.answer(caseId, request.getAnswers()));
  }

  @PostMapping("/{caseId}/force-classify")
  @Operation(
      summary = "Skip the remaining questions",
      description = "Classifies with the information gathered so far")
  public ResponseEntity<ProcessResponse> forceClassify(@PathVariable String caseId) {
    log.info("Interview skipped for case {}", caseId);
    return ResponseEntity.ok(orchestrator.forceClassify(caseId));
  }

  @GetMapping("/{caseId}")
  @Operation(summary = "Get a case")
  public ResponseEntity<ClassificationCase> getCase(@PathVariable String caseId) {
    return ResponseEntity.ok(orchestrator.getCase(caseId));
  }

  @GetMapping("/{caseId}/audit")
  @Operation(summary = "Get the audit trail of a case", description = "Events in recording order")
  public ResponseEntity<List<AuditEvent>> getAuditTrail(@PathVariable String caseId) {
    orchestrator.getCase(caseId);
    return ResponseEntity.ok(auditLogService.findByCase(caseId));
  }
}
