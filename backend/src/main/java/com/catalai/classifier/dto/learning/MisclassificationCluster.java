package com.catalai.classifier.dto.learning;

import java.util.ArrayList;
import java.util.List;

import com.catalai.classifier.dto.classification.TransformationCategory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Cases classified as {@code fromCategory} that users corrected to {@code toCategory}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MisclassificationCluster {
  private TransformationCategory fromCategory;
  private TransformationCategory toCategory;
  private int count;
  @Builder.Default private List<String> exampleCaseIds = new ArrayList<>();
}
