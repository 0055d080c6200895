package com.catalai.classifier.dto.matrix;

import java.util.LinkedHashMap;
import java.util.Map;

import com.catalai.classifier.dto.classification.Classification;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateMatrixRequest {

  /** Evaluates against the active version when absent. */
  private String matrixVersion;

  @NotNull @Builder.Default private Map<String, Object> attributes = new LinkedHashMap<>();

  @NotNull @Valid private Classification classification;
}
