package com.catalai.classifier.dto.matrix;

import java.util.List;

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
public class Attribute {

  private String name;

  private AttributeType type;

  /** Allowed values; only meaningful for categorical attributes. */
  private List<String> possibleValues;

  private double weight;

  private String description;
}
