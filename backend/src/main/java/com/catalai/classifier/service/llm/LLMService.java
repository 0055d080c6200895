package com.catalai.classifier.service.llm;

/** Chat-completion provider. Implementations make exactly one remote call per invocation. */
public interface LLMService {

  /**
   * Sends one system/user prompt pair and returns the model's text reply.
   *
   * @throws Exception if the provider call fails
   */
  String chat(String systemPrompt, String userPrompt) throws Exception;

  String getCurrentModelId();

  boolean isConfigured();

  String getProviderName();
}
