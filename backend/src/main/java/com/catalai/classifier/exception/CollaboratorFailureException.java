package com.catalai.classifier.exception;

import lombok.Getter;

/**
 * An LLM or storage call failed after all retries. The request may be resubmitted; nothing was
 * committed for the failed turn.
 */
@Getter
public class CollaboratorFailureException extends RuntimeException {

  private final String caseId;
  private final String stage;
  private final boolean retryable;

  public CollaboratorFailureException(String caseId, String stage, String message, Throwable cause) {
    super(message, cause);
    this.caseId = caseId;
    this.stage = stage;
    this.retryable = true;
  }
}
