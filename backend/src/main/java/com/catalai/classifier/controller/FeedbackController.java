package com.catalai.classifier.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.process.FeedbackRequest;
import com.catalai.classifier.service.feedback.FeedbackService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/feedback")
@RequiredArgsConstructor
@Tag(name = "Feedback", description = "Confirm or correct classifications")
public class FeedbackController {

  private final FeedbackService feedbackService;

  @PostMapping("/classification")
  @Operation(
      summary = "Submit classification feedback",
      description =
          "Confirms a classification or records the correct category. A correction may trigger an"
              + " automatic learning analysis")
  public ResponseEntity<ClassificationCase> submitFeedback(
      @Valid @RequestBody FeedbackRequest request) {
    return ResponseEntity.ok(feedbackService.record(request));
  }
}
