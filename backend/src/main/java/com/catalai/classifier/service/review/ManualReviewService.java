package com.catalai.classifier.service.review;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.dto.classification.Classification;
import com.catalai.classifier.dto.classification.TransformationCategory;
import com.catalai.classifier.dto.process.CaseStatus;
import com.catalai.classifier.dto.process.ClassificationCase;
import com.catalai.classifier.dto.review.ManualReview;
import com.catalai.classifier.dto.review.ManualReviewQueue;
import com.catalai.classifier.dto.review.ManualReviewRequest;
import com.catalai.classifier.dto.review.ManualReviewStats;
import com.catalai.classifier.exception.ResourceNotFoundException;
import com.catalai.classifier.exception.WorkflowViolationException;
import com.catalai.classifier.service.audit.AuditLogService;
import com.catalai.classifier.service.storage.CaseRepository;
import com.google.common.util.concurrent.Striped;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Queue of cases routed to manual review. A reviewer either approves the classification as it
 * stands or sets the correct category; both close the case as classified.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualReviewService {

  static final int MAX_PAGE_SIZE = 100;

  private final CaseRepository caseRepository;
  private final AuditLogService auditLogService;

  private final Striped<Lock> caseLocks = Striped.lock(32);

  /** Pending cases, oldest first. {@code page} is 1-based. */
  public ManualReviewQueue pending(int page, int limit) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1");
    }
    if (limit < 1 || limit > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    List<ClassificationCase> pending =
        caseRepository.findAll().stream()
            .filter(ManualReviewService::isPending)
            .sorted(
                Comparator.comparing(
                    ClassificationCase::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .collect(Collectors.toList());
    int from = (int) Math.min((long) (page - 1) * limit, pending.size());
    int to = Math.min(from + limit, pending.size());
    return ManualReviewQueue.builder()
        .cases(new ArrayList<>(pending.subList(from, to)))
        .total(pending.size())
        .page(page)
        .limit(limit)
        .totalPages((pending.size() + limit - 1) / limit)
        .build();
  }

  public ClassificationCase resolve(String caseId, ManualReviewRequest request) {
    boolean approved = Boolean.TRUE.equals(request.getApproved());
    if (!approved && request.getCorrectedCategory() == null) {
      throw new IllegalArgumentException("correctedCategory is required when the classification is not approved");
    }
    return withCaseLock(
        caseId,
        () -> {
          ClassificationCase classificationCase =
              caseRepository.findById(caseId).orElseThrow(() -> ResourceNotFoundException.of("Case", caseId));
          if (!isPending(classificationCase)) {
            throw new WorkflowViolationException("Case " + caseId + " is not pending manual review");
          }
          Classification current = classificationCase.getClassification();
          TransformationCategory original = current == null ? null : current.getCategory();
          if (approved && current == null) {
            throw new WorkflowViolationException(
                "Case " + caseId + " has no classification to approve; a corrected category is required");
          }
          if (!approved && request.getCorrectedCategory() == original) {
            throw new IllegalArgumentException("correctedCategory must differ from the classified category");
          }

          Instant now = Instant.now();
          if (!approved) {
            classificationCase.setClassification(corrected(current, request, now));
          }
          classificationCase.setManualReview(
              ManualReview.builder()
                  .approved(approved)
                  .reviewedBy(request.getReviewedBy())
                  .reviewedAt(now)
                  .originalCategory(original)
                  .correctedCategory(approved ? null : request.getCorrectedCategory())
                  .reviewNotes(request.getReviewNotes())
                  .build());
          classificationCase.setStatus(CaseStatus.CLASSIFIED);
          caseRepository.save(classificationCase);

          Map<String, Object> data = new LinkedHashMap<>();
          data.put("approved", approved);
          data.put("originalCategory", original == null ? null : original.getDisplayName());
          data.put(
              "finalCategory", classificationCase.getClassification().getCategory().getDisplayName());
          data.put("reason", classificationCase.getManualReviewReason());
          data.put("reviewNotes", request.getReviewNotes());
          auditLogService.record(
              AuditEvent.builder()
                  .caseId(caseId)
                  .eventType(AuditEventType.MANUAL_REVIEW)
                  .userId(request.getReviewedBy())
                  .data(data)
                  .build());
          log.info(
              "Case {} {} by {} as {}",
              caseId,
              approved ? "approved" : "corrected",
              request.getReviewedBy(),
              classificationCase.getClassification().getCategory());
          return classificationCase;
        });
  }

  public ManualReviewStats stats() {
    List<ClassificationCase> cases = caseRepository.findAll();
    int pending = (int) cases.stream().filter(ManualReviewService::isPending).count();
    List<ManualReview> reviews =
        cases.stream()
            .map(ClassificationCase::getManualReview)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    int approved = (int) reviews.stream().filter(ManualReview::isApproved).count();
    return ManualReviewStats.builder()
        .pendingCount(pending)
        .reviewedCount(reviews.size())
        .approvedCount(approved)
        .correctedCount(reviews.size() - approved)
        .approvalRate(reviews.isEmpty() ? 0.0 : (double) approved / reviews.size())
        .build();
  }

  private static boolean isPending(ClassificationCase classificationCase) {
    return classificationCase.getStatus() == CaseStatus.MANUAL_REVIEW
        && classificationCase.getManualReview() == null;
  }

  private static Classification corrected(
      Classification current, ManualReviewRequest request, Instant now) {
    TransformationCategory target = request.getCorrectedCategory();
    String rationale =
        current == null
            ? "Set by reviewer to " + target.getDisplayName() + "."
            : "Reviewer corrected from "
                + current.getCategory().getDisplayName()
                + " to "
                + target.getDisplayName()
                + ".";
    if (request.getReviewNotes() != null && !request.getReviewNotes().isBlank()) {
      rationale = rationale + " " + request.getReviewNotes().trim();
    }
    Classification.ClassificationBuilder builder =
        current == null ? Classification.builder() : current.toBuilder();
    return builder.category(target).confidence(1.0).rationale(rationale).timestamp(now).build();
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
