package com.catalai.classifier.dto.classification;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A single answered clarification question. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClarificationExchange {
  private String question;
  private String answer;
}
