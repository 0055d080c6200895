package com.catalai.classifier.dto.learning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Replay of misclassified cases against the active matrix")
public class ValidationResult {
  private String testId;
  private Instant testedAt;
  private String matrixVersion;
  private int populationSize;
  private int sampleSize;
  private double samplePercentage;
  private int totalTested;
  private int improved;
  private int unchanged;
  private int worsened;
  private double improvementRate;
  @Builder.Default private List<ValidationCaseResult> details = new ArrayList<>();
}
