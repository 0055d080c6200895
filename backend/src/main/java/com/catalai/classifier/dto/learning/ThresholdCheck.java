package com.catalai.classifier.dto.learning;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdCheck {
  private boolean belowThreshold;
  private double threshold;
  private double overallRate;
  @Builder.Default private List<String> categories = new ArrayList<>();
}
