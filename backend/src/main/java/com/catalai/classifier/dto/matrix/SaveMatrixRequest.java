package com.catalai.classifier.dto.matrix;

import java.util.ArrayList;
import java.util.List;

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
public class SaveMatrixRequest {

  /** Version the editor started from. */
  private String basedOnVersion;

  private boolean majorBump;

  private String description;

  @NotNull @Valid @Builder.Default private List<Attribute> attributes = new ArrayList<>();

  @NotNull @Valid @Builder.Default private List<Rule> rules = new ArrayList<>();
}
