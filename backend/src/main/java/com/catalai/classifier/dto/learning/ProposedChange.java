package com.catalai.classifier.dto.learning;

import com.catalai.classifier.dto.matrix.Attribute;
import com.catalai.classifier.dto.matrix.Rule;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change payload of a suggestion. Which fields are set depends on the suggestion type:
 *
 * <ul>
 *   <li>new_rule: {@code rule}
 *   <li>modify_rule: {@code ruleId} and {@code rule}
 *   <li>remove_rule: {@code ruleId}
 *   <li>adjust_weight: {@code attributeName} and {@code weight}
 *   <li>new_attribute: {@code attribute}
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProposedChange {
  private String ruleId;
  private Rule rule;
  private String attributeName;
  private Double weight;
  private Attribute attribute;
}
