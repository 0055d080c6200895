package com.catalai.classifier.dto.review;

import com.catalai.classifier.dto.classification.TransformationCategory;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualReviewRequest {

  @NotBlank private String reviewedBy;

  /** True keeps the current classification; false requires {@link #correctedCategory}. */
  @NotNull private Boolean approved;

  private TransformationCategory correctedCategory;

  private String reviewNotes;
}
