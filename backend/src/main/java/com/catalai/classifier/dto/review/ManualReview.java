package com.catalai.classifier.dto.review;

import java.time.Instant;

import com.catalai.classifier.dto.classification.TransformationCategory;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A reviewer's decision on a case that was routed to manual review. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManualReview {
  private boolean approved;
  private String reviewedBy;
  private Instant reviewedAt;
  /** Category before the review; absent when the case had no classification. */
  private TransformationCategory originalCategory;
  private TransformationCategory correctedCategory;
  private String reviewNotes;
}
