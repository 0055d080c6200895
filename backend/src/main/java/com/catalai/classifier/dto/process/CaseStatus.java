package com.catalai.classifier.dto.process;

public enum CaseStatus {
  ACTIVE,
  CLASSIFIED,
  MANUAL_REVIEW
}
