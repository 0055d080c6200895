package com.catalai.classifier.dto.review;

import java.util.ArrayList;
import java.util.List;

import com.catalai.classifier.dto.process.ClassificationCase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One page of cases waiting for a reviewer, oldest first. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReviewQueue {
  @Builder.Default private List<ClassificationCase> cases = new ArrayList<>();
  private int total;
  private int page;
  private int limit;
  private int totalPages;
}
