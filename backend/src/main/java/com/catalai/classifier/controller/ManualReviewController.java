package com.catalai.classifier.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.review.ManualReviewQueue;
import com.catalai.classifier.dto.review.ManualReviewRequest;
import com.catalai.classifier.dto.review.ManualReviewStats;
import com.catalai.classifier.service.review.ManualReviewService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/review")
@RequiredArgsConstructor
@Tag(name = "Manual Review", description = "Resolve cases routed to a human reviewer")
public class ManualReviewController {

  private final ManualReviewService manualReviewService;

  @GetMapping("/pending")
  @Operation(summary = "List cases awaiting review", description = "Oldest first, paginated")
  public ResponseEntity<ManualReviewQueue> pending(
      @RequestParam(defaultValue = "1") int page, @RequestParam(defaultValue = "20") int limit) {
    return ResponseEntity.ok(manualReviewService.pending(page, limit));
  }

  @PostMapping("/{caseId}")
  @Operation(
      summary = "Resolve a case",
      description = "Approves the classification or sets the correct category, closing the case")
  public ResponseEntity<ClassificationCase> resolve(
      @PathVariable String caseId, @Valid @RequestBody ManualReviewRequest request) {
    return ResponseEntity.ok(manualReviewService.resolve(caseId, request));
  }

  @GetMapping("/stats")
  @Operation(summary = "Review statistics")
  public ResponseEntity<ManualReviewStats> stats() {
    return ResponseEntity.ok(manualReviewService.stats());
  }
}
