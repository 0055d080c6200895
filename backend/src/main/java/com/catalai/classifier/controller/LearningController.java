package com.catalai.classifier.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.catalai.classifier.dto.learning.AnalysisTrigger;
import com.catalai.classifier.dto.learning.AnalyzeRequest;
import com.catalai.classifier.dto.learning.LearningAnalysis;
import com.catalai.classifier.dto.learning.LearningSuggestion;
import com.catalai.classifier.dto.learning.ReviewRequest;
import com.catalai.classifier.dto.learning.SuggestionStatus;
import com.catalai.classifier.dto.learning.ThresholdCheck;
import com.catalai.classifier.dto.learning.ValidationRequest;
import com.catalai.classifier.dto.learning.ValidationResult;
import com.catalai.classifier.service.learning.LearningAnalysisService;
import com.catalai.classifier.service.learning.LearningSuggestionService;
import com.catalai.classifier.service.learning.ValidationTestService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
@Tag(name = "Learning", description = "Misclassification analysis and rule suggestions")
public class LearningController {

  private final LearningAnalysisService analysisService;
  private final LearningSuggestionService suggestionService;
  private final ValidationTestService validationTestService;

  @GetMapping("/suggestions")
  @Operation(summary = "List suggestions", description = "Most recent first")
  public ResponseEntity<List<LearningSuggestion>> listSuggestions(
      @Parameter(description = "pending, approved, rejected or applied")
          @RequestParam(required = false)
          String status) {
    SuggestionStatus filter = status == null ? null : SuggestionStatus.fromValue(status);
    return ResponseEntity.ok(suggestionService.list(filter));
  }

  @GetMapping("/suggestions/{id}")
  @Operation(summary = "Get a suggestion")
  public ResponseEntity<LearningSuggestion> getSuggestion(@PathVariable String id) {
    return ResponseEntity.ok(suggestionService.get(id));
  }

  @PostMapping("/suggestions/{id}/approve")
  @Operation(
      summary = "Approve a suggestion",
      description = "Applies the change, publishing a new matrix version")
  public ResponseEntity<LearningSuggestion> approve(
      @PathVariable String id, @Valid @RequestBody ReviewRequest review) {
    return ResponseEntity.ok(suggestionService.approve(id, review));
  }

  @PostMapping("/suggestions/{id}/reject")
  @Operation(summary = "Reject a suggestion")
  public ResponseEntity<LearningSuggestion> reject(
      @PathVariable String id, @Valid @RequestBody ReviewRequest review) {
    return ResponseEntity.ok(suggestionService.reject(id, review));
  }

  @PostMapping("/suggestions/{id}/apply")
  @Operation(
      summary = "Apply an approved suggestion",
      description = "Retries an application that failed after approval")
  public ResponseEntity<LearningSuggestion> apply(
      @PathVariable String id,
      @RequestHeader(value = DecisionMatrixController.USERNAME_HEADER, required = false)
          String username) {
    return ResponseEntity.ok(
        suggestionService.apply(id, username == null || username.isBlank() ? "anonymous" : username));
  }

  @PostMapping("/analyze")
  @Operation(summary = "Run a learning analysis over a date range")
  public ResponseEntity<LearningAnalysis> analyze(@RequestBody(required = false) AnalyzeRequest request) {
    AnalyzeRequest effective = request != null ? request : new AnalyzeRequest();
    log.info(
        "Manual analysis requested for {} to {}", effective.getStartDate(), effective.getEndDate());
    return ResponseEntity.ok(analysisService.analyze(effective, AnalysisTrigger.MANUAL));
  }

  @GetMapping("/analyses")
  @Operation(summary = "List analyses", description = "Most recent first")
  public ResponseEntity<List<LearningAnalysis>> listAnalyses() {
    return ResponseEntity.ok(analysisService.listAnalyses());
  }

  @GetMapping("/analyses/{id}")
  @Operation(summary = "Get an analysis")
  public ResponseEntity<LearningAnalysis> getAnalysis(@PathVariable String id) {
    return ResponseEntity.ok(analysisService.getAnalysis(id));
  }

  @GetMapping("/check-threshold")
  @Operation(
      summary = "Check agreement rates",
      description = "Reports the categories whose agreement rate is below the threshold")
  public ResponseEntity<ThresholdCheck> checkThreshold() {
    return ResponseEntity.ok(analysisService.checkThreshold());
  }

  @PostMapping("/validate")
  @Operation(
      summary = "Validate the active matrix",
      description = "Replays a sample of misclassified cases without calling the LLM")
  public ResponseEntity<ValidationResult> validate(
      @RequestBody(required = false) ValidationRequest request) {
    ValidationRequest effective = request != null ? request : new ValidationRequest();
    return ResponseEntity.ok(
        validationTestService.validate(effective.getStartDate(), effective.getEndDate()));
  }

  @GetMapping("/validations/{testId}")
  @Operation(summary = "Get a validation result")
  public ResponseEntity<ValidationResult> getValidation(@PathVariable String testId) {
    return ResponseEntity.ok(validationTestService.getValidation(testId));
  }
}
