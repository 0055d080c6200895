package com.catalai.classifier.service.llm;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.AccessDeniedException;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ThrottlingException;
import software.amazon.awssdk.services.bedrockruntime.model.ValidationException;

/** AWS Bedrock through the model-agnostic Converse API. */
@Slf4j
@Service
public class AwsBedrockService implements LLMService {

  private BedrockRuntimeClient bedrockRuntimeClient;

  @Value("${aws.bedrock.model-id:anthropic.claude-3-5-sonnet-20240620-v1:0}")
  private String modelId;

  @Value("${aws.region:us-east-1}")
  private String defaultAwsRegion;

  @Value("${aws.bedrock.access-key-id:}")
  private String accessKeyId;

  @Value("${aws.bedrock.secret-access-key:}")
  private String secretAccessKey;

  @Value("${aws.bedrock.use-default-credentials:false}")
  private boolean useDefaultCredentials;

  @Value("${aws.bedrock.max-tokens:4096}")
  private int maxTokens;

  @Value("${aws.bedrock.temperature:0}")
  private double temperature;

  private String currentRegion;

  @PostConstruct
  public void init() {
    if (accessKeyId != null && !accessKeyId.isBlank() && secretAccessKey != null && !secretAccessKey.isBlank()) {
      initializeClient(accessKeyId, secretAccessKey, defaultAwsRegion);
    } else if (useDefaultCredentials) {
      currentRegion = defaultAwsRegion;
      bedrockRuntimeClient =
          BedrockRuntimeClient.builder()
              .region(Region.of(currentRegion))
              .credentialsProvider(DefaultCredentialsProvider.create())
              .build();
      log.info("AWS Bedrock client initialized from default credentials in {}", currentRegion);
    } else {
      log.info("AWS Bedrock credentials not configured; provider disabled");
    }
  }

  public void initializeClient(String accessKey, String secretKey, String region) {
    this.currentRegion = region != null ? region : defaultAwsRegion;
    this.bedrockRuntimeClient =
        BedrockRuntimeClient.builder()
            .region(Region.of(currentRegion))
            .credentialsProvider(
                StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey)))
            .build();
    log.info("AWS Bedrock client initialized for region {} with model {}", currentRegion, modelId);
  }

  /** Supplies a preconfigured client. */
  public void setClient(BedrockRuntimeClient client, String region) {
    this.bedrockRuntimeClient = client;
    this.currentRegion = region;
  }

  @PreDestroy
  public void clearCredentials() {
    if (bedrockRuntimeClient != null) {
      bedrockRuntimeClient.close();
      bedrockRuntimeClient = null;
    }
  }

  @Override
  public boolean isConfigured() {
    return bedrockRuntimeClient != null && modelId != null && !modelId.isBlank();
  }

  @Override
  public String getProviderName() {
    return "bedrock";
  }

  @Override
  public String getCurrentModelId() {
    return modelId;
  }

  public String getCurrentRegion() {
    return currentRegion;
  }

  @Override
  public String chat(String systemPrompt, String userPrompt) {
    if (!isConfigured()) {
      throw new IllegalStateException("AWS Bedrock client not initialized. Configure AWS credentials first.");
    }

    ConverseRequest.Builder request =
        ConverseRequest.builder()
            .modelId(modelId)
            .messages(
                Message.builder()
                    .role(ConversationRole.USER)
                    .content(ContentBlock.fromText(userPrompt))
                    .build())
            .inferenceConfig(
                InferenceConfiguration.builder()
                    .maxTokens(maxTokens)
                    .temperature((float) temperature)
                    .build());
    if (systemPrompt != null && !systemPrompt.isBlank()) {
      request.system(SystemContentBlock.fromText(systemPrompt));
    }

    try {
      ConverseResponse response = bedrockRuntimeClient.converse(request.build());
      Message message = response.output().message();
      if (message != null && !message.content().isEmpty() && message.content().get(0).text() != null) {
        return message.content().get(0).text();
      }
      throw new IllegalStateException("No content in Bedrock model response");
    } catch (ThrottlingException e) {
      log.warn("AWS Bedrock throttled model {}", modelId);
      throw new BedrockCallException("AWS Bedrock throttled the request", e);
    } catch (AccessDeniedException e) {
      throw new BedrockCallException(
          String.format("No access to model '%s' in region %s", modelId, currentRegion), e);
    } catch (ValidationException e) {
      throw new BedrockCallException(
          String.format("Model '%s' rejected the request in region %s", modelId, currentRegion), e);
    }
  }

  /** Provider-level failure with a message fit for the caller. */
  public static class BedrockCallException extends RuntimeException {
    public BedrockCallException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
