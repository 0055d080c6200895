package com.catalai.classifier.service.llm;

import java.util.function.Function;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of an LLM call: a validated value, a reply that could not be used, or a call that did
 * not complete.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class LlmResult<T> {

  public enum Status {
    OK,
    MALFORMED,
    FAILED
  }

  private final Status status;
  private final T value;
  private final String error;
  private final Throwable cause;

  public static <T> LlmResult<T> ok(T value) {
    return new LlmResult<>(Status.OK, value, null, null);
  }

  public static <T> LlmResult<T> malformed(String reason) {
    return new LlmResult<>(Status.MALFORMED, null, reason, null);
  }

  public static <T> LlmResult<T> failed(String reason, Throwable cause) {
    return new LlmResult<>(Status.FAILED, null, reason, cause);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  /** Transforms the value of an OK result; other variants pass through unchanged. */
  public <R> LlmResult<R> map(Function<T, R> mapper) {
    if (status == Status.OK) {
      return ok(mapper.apply(value));
    }
    return new LlmResult<>(status, null, error, cause);
  }

  @Override
  public String toString() {
    return status == Status.OK ? "LlmResult[OK]" : "LlmResult[" + status + ": " + error + "]";
  }
}
