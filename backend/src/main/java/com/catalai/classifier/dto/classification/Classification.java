package com.catalai.classifier.dto.classification;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One classification attempt. A fresh instance is produced for every attempt; callers derive
 * adjusted results through {@link #toBuilder()} instead of mutating.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Classification of a business process into a transformation tier")
public class Classification {

  @NotNull private TransformationCategory category;

  @Schema(description = "Confidence in [0,1]")
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double confidence;

  private String rationale;

  private String categoryProgression;

  private String futureOpportunities;

  private String modelId;

  private Instant timestamp;
}
