package com.catalai.classifier.service.learning;

/** The LLM produced no usable suggestions for an analysis. */
public class SuggestionGenerationException extends RuntimeException {

  public SuggestionGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
