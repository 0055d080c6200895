package com.catalai.classifier.dto.matrix;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatrixExport {
  private Instant exportedAt;
  private String exportedBy;
  private String formatVersion;
  private DecisionMatrix matrix;
}
