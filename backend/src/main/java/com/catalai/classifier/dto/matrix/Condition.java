package com.catalai.classifier.dto.matrix;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Condition {

  private String attribute;

  private ConditionOperator operator;

  /** A scalar, or a list of scalars for {@code in} and {@code not_in}. */
  private Object value;
}
