package com.catalai.classifier.service.llm;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

import org.springframework.stereotype.Component;

import com.catalai.classifier.config.ApplicationProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an LLM call with a per-attempt timeout and bounded retry with exponential backoff. Both
 * failed calls and malformed replies are retried; the outcome of the last attempt is returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmCallExecutor {

  private final ApplicationProperties applicationProperties;
  private final Executor llmExecutor;

  public <T> LlmResult<T> execute(
      String operation, Callable<String> call, Function<String, LlmResult<T>> parser) {
    ApplicationProperties.Llm config = applicationProperties.getLlm();
    int maxAttempts = Math.max(1, config.getMaxAttempts());
    long backoff = config.getInitialBackoffMs();
    LlmResult<T> last = LlmResult.failed(operation + " was not attempted", null);

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      last = attemptOnce(operation, call, parser, config.getTimeoutSeconds());
      if (last.isOk()) {
        if (attempt > 1) {
          log.info("{} succeeded on attempt {}/{}", operation, attempt, maxAttempts);
        }
        return last;
      }
      log.warn("{} attempt {}/{} returned {}", operation, attempt, maxAttempts, last);
      if (last.getCause() instanceof IllegalStateException) {
        // Provider not configured; retrying cannot help.
        return last;
      }
      if (attempt < maxAttempts && backoff > 0) {
        try {
          Thread.sleep(backoff);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return LlmResult.failed(operation + " interrupted during backoff", e);
        }
        backoff = Math.min(backoff * 2, config.getMaxBackoffMs());
      }
    }
    return last;
  }

  private <T> LlmResult<T> attemptOnce(
      String operation,
      Callable<String> call,
      Function<String, LlmResult<T>> parser,
      long timeoutSeconds) {
    CompletableFuture<String> future =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return call.call();
              } catch (Exception e) {
                throw new CompletionException(e);
              }
            },
            llmExecutor);
    String raw;
    try {
      raw = future.get(timeoutSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      return LlmResult.failed(operation + " timed out after " + timeoutSeconds + "s", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() instanceof CompletionException ? e.getCause().getCause() : e.getCause();
      return LlmResult.failed(operation + " failed: " + (cause != null ? cause.getMessage() : e.getMessage()), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return LlmResult.failed(operation + " interrupted", e);
    }

    if (raw == null || raw.isBlank()) {
      return LlmResult.malformed(operation + " returned an empty reply");
    }
    try {
      return parser.apply(raw);
    } catch (RuntimeException e) {
      log.debug("Parser for {} threw", operation, e);
      return LlmResult.malformed(operation + " reply could not be parsed: " + e.getMessage());
    }
  }
}
