package com.catalai.classifier.dto.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReviewStats {
  private int pendingCount;
  private int reviewedCount;
  private int approvedCount;
  private int correctedCount;
  /** Approved over reviewed; 0 before the first review. */
  private double approvalRate;
}
