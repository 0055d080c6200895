package com.catalai.classifier.dto.process;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswersRequest {

  /** One answer per pending question, in question order. */
  @NotEmpty private List<String> answers;
}
