package com.catalai.classifier.dto.audit;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditEvent {

  public static final String SYSTEM_CASE_ID = "system";

  private Instant timestamp;
  private String caseId;
  private AuditEventType eventType;
  private String userId;
  private String correlationId;
  @Builder.Default private Map<String, Object> data = new LinkedHashMap<>();
  private String modelId;
  private String provider;
  private Long latencyMs;
  private String matrixVersion;
}
