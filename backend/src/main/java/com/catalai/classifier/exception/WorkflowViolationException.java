package com.catalai.classifier.exception;

/** A requested lifecycle transition is not allowed from the current state. Never retried. */
public class WorkflowViolationException extends RuntimeException {

  public WorkflowViolationException(String message) {
    super(message);
  }
}
