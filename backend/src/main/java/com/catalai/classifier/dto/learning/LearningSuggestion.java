package com.catalai.classifier.dto.learning;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Proposed decision matrix change awaiting human review")
public class LearningSuggestion {

  private String id;

  private String analysisId;

  private SuggestionType type;

  private SuggestionStatus status;

  private String rationale;

  private ImpactEstimate impact;

  private ProposedChange proposedChange;

  private Instant createdAt;

  private String reviewedBy;

  private Instant reviewedAt;

  private String reviewNotes;

  private String appliedVersion;
}
