package com.catalai.classifier.dto.process;

import java.time.Instant;

import com.catalai.classifier.dto.classification.TransformationCategory;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Feedback {
  private boolean confirmed;
  private TransformationCategory correctedCategory;
  private String comments;
  private String userId;
  private Instant timestamp;
}
