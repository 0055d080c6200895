package com.catalai.classifier.dto.learning;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Date range of the cases to replay; open ends are unbounded. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRequest {
  private Instant startDate;
  private Instant endDate;
}
