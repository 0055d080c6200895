package com.catalai.classifier.service.audit;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.catalai.classifier.dto.audit.AuditEvent;
import com.catalai.classifier.dto.audit.AuditEventType;
import com.catalai.classifier.exception.StorageException;
import com.catalai.classifier.service.storage.IJsonStorage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only audit trail. One JSON line per event in {@code audit-logs/yyyy-MM-dd.jsonl}, mirrored
 * to CloudWatch when it is enabled. Audit failures are logged and never fail the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogService {

  static final String PREFIX = "audit-logs/";

  private final IJsonStorage storage;
  private final ObjectMapper objectMapper;
  private final CloudWatchLoggingService cloudWatchLoggingService;

  public void record(AuditEvent event) {
    if (event.getTimestamp() == null) {
      event.setTimestamp(Instant.now());
    }
    if (event.getCaseId() == null) {
      event.setCaseId(AuditEvent.SYSTEM_CASE_ID);
    }
    if (event.getUserId() == null) {
      event.setUserId(MDC.get("username"));
    }
    if (event.getCorrelationId() == null) {
      event.setCorrelationId(MDC.get("correlationId"));
    }

    try {
      storage.appendLine(keyFor(event.getTimestamp()), objectMapper.writeValueAsString(event));
    } catch (JsonProcessingException | StorageException e) {
      log.error("Failed to write audit event {} for case {}", event.getEventType(), event.getCaseId(), e);
    }

    Map<String, Object> data = new LinkedHashMap<>(event.getData());
    data.put("eventType", event.getEventType().name());
    data.put("caseId", event.getCaseId());
    if (event.getMatrixVersion() != null) {
      data.put("matrixVersion", event.getMatrixVersion());
    }
    cloudWatchLoggingService.log(
        event.getEventType() == AuditEventType.ERROR ? "ERROR" : "INFO",
        "Audit " + event.getEventType() + " for case " + event.getCaseId(),
        data);
  }

  public void record(String caseId, AuditEventType type, Map<String, Object> data) {
    record(AuditEvent.builder().caseId(caseId).eventType(type).data(new LinkedHashMap<>(data)).build());
  }

  /** Events for one case, oldest first. */
  public List<AuditEvent> findByCase(String caseId) {
    List<AuditEvent> events = new ArrayList<>();
    for (String key : storage.list(PREFIX)) {
      for (String line : storage.readLines(key)) {
        try {
          AuditEvent event = objectMapper.readValue(line, AuditEvent.class);
          if (caseId.equals(event.getCaseId())) {
            events.add(event);
          }
        } catch (JsonProcessingException e) {
          log.warn("Skipping unreadable audit line in {}: {}", key, e.getOriginalMessage());
        }
      }
    }
    return events.stream()
        .sorted((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()))
        .collect(Collectors.toList());
  }

  static String keyFor(Instant timestamp) {
    return PREFIX + LocalDate.ofInstant(timestamp, ZoneOffset.UTC) + ".jsonl";
  }
}
