package com.catalai.classifier.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Picks the configured provider, falling back to whichever one has credentials. */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMServiceSelector {

  private final AwsBedrockService awsBedrockService;
  private final OpenAIService openAIService;

  @Value("${llm.provider:openai}")
  private String preferredProvider;

  /**
   * @throws IllegalStateException if no provider is configured
   */
  public LLMService getLLMService() {
    if ("openai".equalsIgnoreCase(preferredProvider) && openAIService.isConfigured()) {
      return openAIService;
    }
    if ("bedrock".equalsIgnoreCase(preferredProvider) && awsBedrockService.isConfigured()) {
      return awsBedrockService;
    }
    if (openAIService.isConfigured()) {
      log.debug("Preferred provider {} not available, falling back to OpenAI", preferredProvider);
      return openAIService;
    }
    if (awsBedrockService.isConfigured()) {
      log.debug("Preferred provider {} not available, falling back to AWS Bedrock", preferredProvider);
      return awsBedrockService;
    }
    throw new IllegalStateException(
        "No LLM service is configured. Configure an OpenAI API key or AWS Bedrock credentials.");
  }

  public boolean isAnyConfigured() {
    return openAIService.isConfigured() || awsBedrockService.isConfigured();
  }
}
