package com.catalai.classifier.dto.learning;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactEstimate {
  private int affectedCases;
  private double expectedImprovementPercent;
  private String notes;
}
