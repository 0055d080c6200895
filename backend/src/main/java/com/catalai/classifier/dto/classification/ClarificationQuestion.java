package com.catalai.classifier.dto.classification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClarificationQuestion {
  private String question;
  private String purpose;
  private boolean critical;
}
