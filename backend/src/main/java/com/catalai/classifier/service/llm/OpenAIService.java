package com.catalai.classifier.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** OpenAI chat completions over {@link RestTemplate}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAIService implements LLMService {

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;

  @Value("${openai.api-key:}")
  private String openaiApiKey;

  @Value("${openai.model:gpt-4o}")
  private String model;

  @Value("${openai.max-tokens:4096}")
  private int maxTokens;

  @Value("${openai.temperature:0.2}")
  private double temperature;

  @Value("${openai.api-url:https://api.openai.com/v1/chat/completions}")
  private String apiUrl;

  @Override
  public boolean isConfigured() {
    return openaiApiKey != null && !openaiApiKey.trim().isEmpty();
  }

  @Override
  public String getProviderName() {
    return "openai";
  }

  @Override
  public String getCurrentModelId() {
    return model;
  }

  @Override
  public String chat(String systemPrompt, String userPrompt) throws Exception {
    if (!isConfigured()) {
      throw new IllegalStateException("OpenAI API key not configured. Set OPENAI_API_KEY.");
    }

    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.put("model", model);
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);

    ArrayNode messages = requestBody.putArray("messages");
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      messages.addObject().put("role", "system").put("content", systemPrompt);
    }
    messages.addObject().put("role", "user").put("content", userPrompt);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(openaiApiKey);

    log.debug("OpenAI request model={}, prompt length={}", model, userPrompt.length());
    ResponseEntity<String> response =
        restTemplate.exchange(
            apiUrl, HttpMethod.POST, new HttpEntity<>(requestBody.toString(), headers), String.class);

    if (response.getBody() == null) {
      throw new IllegalStateException("Empty response from OpenAI API: " + response.getStatusCode());
    }

    JsonNode content = objectMapper.readTree(response.getBody()).path("choices").path(0).path("message").path("content");
    if (!content.isTextual()) {
      throw new IllegalStateException("Invalid response format from OpenAI API");
    }
    log.debug("OpenAI response content length={} chars", content.asText().length());
    return content.asText();
  }
}
