package com.catalai.classifier.dto.process;

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
public class FeedbackRequest {

  @NotBlank private String caseId;

  @NotNull private Boolean confirmed;

  private TransformationCategory correctedCategory;

  private String comments;

  private String userId;
}
