package com.catalai.classifier.dto.learning;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {
  private Instant startDate;
  private Instant endDate;
  private boolean misclassifiedOnly;
}
