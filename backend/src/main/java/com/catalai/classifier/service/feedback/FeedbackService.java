package com.catalai.classifier.service.feedback;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.process.Feedback;
import com.catalai.classifier.dto.process.FeedbackRequest;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.exception.WorkflowViolationException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.learning.LearningAnalysisService;
import com.catalai.classifier.service.storage.CaseRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Records whether users agree with a classification and feeds the learning loop. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

  private final CaseRepository caseRepository;
  private final LearningAnalysisService learningAnalysisService;
  private final AuditLogService auditLogService;

  public ClassificationCase record(FeedbackRequest request) {
    ClassificationCase classificationCase =
        caseRepository
            .findById(request.getCaseId())
            .orElseThrow(() -> ResourceNotFoundException.of("Case", request.getCaseId()));
    if (classificationCase.getClassification() == null) {
      throw new WorkflowViolationException(
          "Case " + request.getCaseId() + " has no classification to give feedback on");
    }

    boolean confirmed = Boolean.TRUE.equals(request.getConfirmed());
    if (!confirmed) {
      if (request.getCorrectedCategory() == null) {
        throw new IllegalArgumentException("correctedCategory is required when the classification is not confirmed");
      }
      if (request.getCorrectedCategory() == classificationCase.getClassification().getCategory()) {
        throw new IllegalArgumentException("correctedCategory must differ from the classified category");
      }
    }
    if (classificationCase.getFeedback() != null) {
      log.info("Replacing earlier feedback on case {}", classificationCase.getCaseId());
    }

    classificationCase.setFeedback(
        Feedback.builder()
            .confirmed(confirmed)
            .correctedCategory(confirmed ? null : request.getCorrectedCategory())
            .comments(request.getComments())
            .userId(request.getUserId())
            .timestamp(Instant.now())
            .build());
    caseRepository.save(classificationCase);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("confirmed", confirmed);
    data.put("classifiedCategory", classificationCase.getClassification().getCategory().getDisplayName());
    if (!confirmed) {
      data.put("correctedCategory", request.getCorrectedCategory().getDisplayName());
    }
    auditLogService.record(classificationCase.getCaseId(), AuditEventType.FEEDBACK, data);

    try {
      learningAnalysisService.onFeedbackRecorded();
    } catch (RuntimeException e) {
      log.error("Automatic learning analysis check failed after feedback on case {}", classificationCase.getCaseId(), e);
    }
    return classificationCase;
  }
}
