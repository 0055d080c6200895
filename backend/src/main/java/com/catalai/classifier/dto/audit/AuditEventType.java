package com.catalai.classifier.dto.audit;

public enum AuditEventType {
  INPUT,
  CLARIFICATION,
  CLASSIFICATION,
  FEEDBACK,
  MATRIX_SAVED,
  MATRIX_GENERATED,
  SUGGESTION_REVIEWED,
  MANUAL_REVIEW,
  ANALYSIS,
  VALIDATION,
  FALLBACK,
  RULE_WARNING,
  ERROR
}
