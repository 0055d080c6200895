package com.catalai.classifier.dto.matrix;

import com.catalai.classifier.dto.classification.TransformationCategory;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleAction {

  private ActionType type;

  /** Set for {@link ActionType#OVERRIDE}. */
  private TransformationCategory targetCategory;

  /** Signed delta, set for {@link ActionType#ADJUST_CONFIDENCE}. */
  private Double confidenceAdjustment;

  private String rationale;

  public static RuleAction override(TransformationCategory target, String rationale) {
    return RuleAction.builder()
        .type(ActionType.OVERRIDE)
        .targetCategory(target)
        .rationale(rationale)
        .build();
  }

  public static RuleAction adjustConfidence(double delta, String rationale) {
    return RuleAction.builder()
        .type(ActionType.ADJUST_CONFIDENCE)
        .confidenceAdjustment(delta)
        .rationale(rationale)
        .build();
  }

  public static RuleAction flagReview(String rationale) {
    return RuleAction.builder().type(ActionType.FLAG_REVIEW).rationale(rationale).build();
  }
}
