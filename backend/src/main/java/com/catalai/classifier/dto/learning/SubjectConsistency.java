package com.catalai.classifier.dto.learning;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubjectConsistency {
  private String subject;
  private int caseCount;
  private double agreementRate;
  private String mostCommonCategory;
  @Builder.Default private Map<String, Integer> categoryDistribution = new LinkedHashMap<>();
}
