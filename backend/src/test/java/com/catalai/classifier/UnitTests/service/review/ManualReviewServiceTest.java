package com.catalai.classifier.service.review;

import static com.catalai.classifier.fixtures.TestFixtures.classifiedCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
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

@ExtendWith(MockitoExtension.class)
@DisplayName("ManualReviewService Tests")
class ManualReviewServiceTest {

  @Mock private CaseRepository caseRepository;
  @Mock private AuditLogService auditLogService;

  @InjectMocks private ManualReviewService manualReviewService;

  private static ClassificationCase reviewCase(String caseId, String createdAt, TransformationCategory category) {
    ClassificationCase c = classifiedCase(caseId, category, 0.5);
    c.setCreatedAt(Instant.parse(createdAt));
    c.setStatus(CaseStatus.MANUAL_REVIEW);
    c.setManualReviewReason("low confidence");
    return c;
  }

  private static ManualReviewRequest approval() {
    return ManualReviewRequest.builder().reviewedBy("lead").approved(true).build();
  }

  private static ManualReviewRequest correction(TransformationCategory category) {
    return ManualReviewRequest.builder()
        .reviewedBy("lead")
        .approved(false)
        .correctedCategory(category)
        .reviewNotes("Needs a form first")
        .build();
  }

  @Nested
  @DisplayName("Pending queue")
  class QueueTests {

    @Test
    @DisplayName("Should list only unresolved review cases, oldest first")
    void shouldListPendingOldestFirst() {
      // Given
      ClassificationCase resolved = reviewCase("case-4", "2024-03-01T08:00:00Z", TransformationCategory.RPA);
      resolved.setManualReview(ManualReview.builder().approved(true).reviewedBy("lead").build());
      when(caseRepository.findAll())
          .thenReturn(
              Arrays.asList(
                  reviewCase("case-2", "2024-03-03T10:00:00Z", TransformationCategory.RPA),
                  classifiedCase("case-3", TransformationCategory.SIMPLIFY, 0.9),
                  reviewCase("case-1", "2024-03-02T10:00:00Z", TransformationCategory.AI_AGENT),
                  resolved));

      // When
      ManualReviewQueue queue = manualReviewService.pending(1, 20);

      // Then
      assertThat(queue.getCases()).extracting(ClassificationCase::getCaseId).containsExactly("case-1", "case-2");
      assertThat(queue.getTotal()).isEqualTo(2);
      assertThat(queue.getTotalPages()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should page through the queue")
    void shouldPaginate() {
      // Given
      when(caseRepository.findAll())
          .thenReturn(
              Arrays.asList(
                  reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA),
                  reviewCase("case-2", "2024-03-02T10:00:00Z", TransformationCategory.RPA),
                  reviewCase("case-3", "2024-03-03T10:00:00Z", TransformationCategory.RPA)));

      // When
      ManualReviewQueue second = manualReviewService.pending(2, 2);

      // Then
      assertThat(second.getCases()).extracting(ClassificationCase::getCaseId).containsExactly("case-3");
      assertThat(second.getTotal()).isEqualTo(3);
      assertThat(second.getTotalPages()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return an empty page past the end")
    void shouldReturnEmptyPagePastEnd() {
      when(caseRepository.findAll())
          .thenReturn(List.of(reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA)));

      ManualReviewQueue queue = manualReviewService.pending(5, 20);

      assertThat(queue.getCases()).isEmpty();
      assertThat(queue.getTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a page size outside the allowed range")
    void shouldRejectBadPageSize() {
      assertThatThrownBy(() -> manualReviewService.pending(1, 0))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> manualReviewService.pending(1, ManualReviewService.MAX_PAGE_SIZE + 1))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> manualReviewService.pending(0, 20))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(caseRepository);
    }
  }

  @Nested
  @DisplayName("Resolving cases")
  class ResolveTests {

    @Test
    @DisplayName("Should approve the classification and close the case")
    void shouldApprove() {
      // Given
      when(caseRepository.findById("case-1"))
          .thenReturn(Optional.of(reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA)));

      // When
      ClassificationCase result = manualReviewService.resolve("case-1", approval());

      // Then
      assertThat(result.getStatus()).isEqualTo(CaseStatus.CLASSIFIED);
      assertThat(result.getClassification().getCategory()).isEqualTo(TransformationCategory.RPA);
      assertThat(result.getClassification().getConfidence()).isEqualTo(0.5);
      assertThat(result.getManualReview().isApproved()).isTrue();
      assertThat(result.getManualReview().getReviewedBy()).isEqualTo("lead");
      assertThat(result.getManualReview().getOriginalCategory()).isEqualTo(TransformationCategory.RPA);
      verify(caseRepository).save(result);

      ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
      verify(auditLogService).record(event.capture());
      assertThat(event.getValue().getEventType()).isEqualTo(AuditEventType.MANUAL_REVIEW);
      assertThat(event.getValue().getUserId()).isEqualTo("lead");
      assertThat(event.getValue().getData()).containsEntry("approved", true).containsEntry("finalCategory", "RPA");
    }

    @Test
    @DisplayName("Should replace the category when the reviewer corrects it")
    void shouldCorrect() {
      // Given
      when(caseRepository.findById("case-1"))
          .thenReturn(Optional.of(reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA)));

      // When
      ClassificationCase result =
          manualReviewService.resolve("case-1", correction(TransformationCategory.DIGITISE));

      // Then
      assertThat(result.getStatus()).isEqualTo(CaseStatus.CLASSIFIED);
      assertThat(result.getClassification().getCategory()).isEqualTo(TransformationCategory.DIGITISE);
      assertThat(result.getClassification().getConfidence()).isEqualTo(1.0);
      assertThat(result.getClassification().getRationale())
          .isEqualTo("Reviewer corrected from RPA to Digitise. Needs a form first");
      assertThat(result.getManualReview().isApproved()).isFalse();
      assertThat(result.getManualReview().getOriginalCategory()).isEqualTo(TransformationCategory.RPA);
      assertThat(result.getManualReview().getCorrectedCategory()).isEqualTo(TransformationCategory.DIGITISE);
      ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
      verify(auditLogService).record(event.capture());
      assertThat(event.getValue().getData())
          .containsEntry("originalCategory", "RPA")
          .containsEntry("finalCategory", "Digitise");
    }

    @Test
    @DisplayName("Should classify a case that never got a classification")
    void shouldSetCategoryWhenUnclassified() {
      // Given
      ClassificationCase unclassified =
          reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA);
      unclassified.setClassification(null);
      when(caseRepository.findById("case-1")).thenReturn(Optional.of(unclassified));

      // When
      ClassificationCase result =
          manualReviewService.resolve("case-1", correction(TransformationCategory.SIMPLIFY));

      // Then
      assertThat(result.getClassification().getCategory()).isEqualTo(TransformationCategory.SIMPLIFY);
      assertThat(result.getManualReview().getOriginalCategory()).isNull();
    }

    @Test
    @DisplayName("Should refuse to approve a case without a classification")
    void shouldRefuseApprovalWithoutClassification() {
      // Given
      ClassificationCase unclassified =
          reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA);
      unclassified.setClassification(null);
      when(caseRepository.findById("case-1")).thenReturn(Optional.of(unclassified));

      // When & Then
      assertThatThrownBy(() -> manualReviewService.resolve("case-1", approval()))
          .isInstanceOf(WorkflowViolationException.class);
      verify(caseRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should refuse to resolve a case twice")
    void shouldRefuseResolvedCase() {
      // Given
      ClassificationCase resolved = reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA);
      resolved.setStatus(CaseStatus.CLASSIFIED);
      resolved.setManualReview(ManualReview.builder().approved(true).reviewedBy("lead").build());
      when(caseRepository.findById("case-1")).thenReturn(Optional.of(resolved));

      // When & Then
      assertThatThrownBy(() -> manualReviewService.resolve("case-1", approval()))
          .isInstanceOf(WorkflowViolationException.class)
          .hasMessageContaining("not pending manual review");
      verify(caseRepository, never()).save(any());
      verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("Should refuse a case that was never routed to review")
    void shouldRefuseClassifiedCase() {
      when(caseRepository.findById("case-1"))
          .thenReturn(Optional.of(classifiedCase("case-1", TransformationCategory.RPA, 0.9)));

      assertThatThrownBy(() -> manualReviewService.resolve("case-1", approval()))
          .isInstanceOf(WorkflowViolationException.class);
    }

    @Test
    @DisplayName("Should require a corrected category that differs from the current one")
    void shouldValidateCorrection() {
      // Given
      when(caseRepository.findById("case-1"))
          .thenReturn(Optional.of(reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA)));

      // When & Then
      assertThatThrownBy(
              () -> manualReviewService.resolve("case-1", correction(TransformationCategory.RPA)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("must differ");
      assertThatThrownBy(() -> manualReviewService.resolve("case-1", correction(null)))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("correctedCategory is required");
      verify(caseRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should report an unknown case as not found")
    void shouldRejectUnknownCase() {
      when(caseRepository.findById("missing")).thenReturn(Optional.empty());

      assertThatThrownBy(() -> manualReviewService.resolve("missing", approval()))
          .isInstanceOf(ResourceNotFoundException.class);
    }
  }

  @Test
  @DisplayName("Should count pending and resolved reviews")
  void shouldReportStats() {
    // Given
    ClassificationCase approved = classifiedCase("case-2", TransformationCategory.RPA, 0.5);
    approved.setManualReview(ManualReview.builder().approved(true).reviewedBy("lead").build());
    ClassificationCase corrected = classifiedCase("case-3", TransformationCategory.SIMPLIFY, 1.0);
    corrected.setManualReview(
        ManualReview.builder()
            .approved(false)
            .reviewedBy("lead")
            .correctedCategory(TransformationCategory.SIMPLIFY)
            .build());
    ClassificationCase otherApproval = classifiedCase("case-4", TransformationCategory.DIGITISE, 0.4);
    otherApproval.setManualReview(ManualReview.builder().approved(true).reviewedBy("lead").build());
    when(caseRepository.findAll())
        .thenReturn(
            Arrays.asList(
                reviewCase("case-1", "2024-03-01T10:00:00Z", TransformationCategory.RPA),
                approved,
                corrected,
                otherApproval,
                classifiedCase("case-5", TransformationCategory.RPA, 0.9)));

    // When
    ManualReviewStats stats = manualReviewService.stats();

    // Then
    assertThat(stats.getPendingCount()).isEqualTo(1);
    assertThat(stats.getReviewedCount()).isEqualTo(3);
    assertThat(stats.getApprovedCount()).isEqualTo(2);
    assertThat(stats.getCorrectedCount()).isEqualTo(1);
    assertThat(stats.getApprovalRate()).isEqualTo(2.0 / 3);
  }

  @Test
  @DisplayName("Should report a zero approval rate before any review")
  void shouldReportZeroRateWithoutReviews() {
    when(caseRepository.findAll()).thenReturn(List.of());

    ManualReviewStats stats = manualReviewService.stats();

    assertThat(stats.getReviewedCount()).isZero();
    assertThat(stats.getApprovalRate()).isZero();
  }
}
