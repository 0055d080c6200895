package com.catalai.classifier.dto.process;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitProcessRequest {

  @NotBlank
  @Size(min = 10, max = 10000, message = "Description must be between 10 and 10000 characters")
  private String description;

  private String subject;

  private String userId;
}
