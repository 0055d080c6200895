package com.catalai.classifier.service.audit;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatchlogs.CloudWatchLogsClient;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogGroupRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.CreateLogStreamRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.InputLogEvent;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidSequenceTokenException;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsRequest;
import software.amazon.awssdk.services.cloudwatchlogs.model.PutLogEventsResponse;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceAlreadyExistsException;

/**
 * Ships audit events and selected application logs to CloudWatch Logs. Enabled only when admin
 * credentials are configured; otherwise every call is a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CloudWatchLoggingService {

  private static final int MAX_BATCH_SIZE = 10000;
  private static final int MAX_BATCH_BYTES = 1048576;
  private static final int MAX_MESSAGE_BYTES = 256000;
  private static final List<String> LEVELS = Arrays.asList("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

  private final ObjectMapper objectMapper;

  @Value("${aws.cloudwatch.log-group:/aws/catalai}")
  private String logGroupName;

  @Value("${aws.cloudwatch.log-stream:classifier}")
  private String logStreamName;

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  @Value("${aws.cloudwatch.admin-access-key-id:}")
  private String adminAccessKeyId;

  @Value("${aws.cloudwatch.admin-secret-access-key:}")
  private String adminSecretAccessKey;

  @Value("${aws.cloudwatch.filter.min-level:INFO}")
  private String minLevel;

  @Value("${aws.cloudwatch.filter.allowed-loggers:com.catalai.classifier.service}")
  private String allowedLoggersCsv;

  private final ConcurrentLinkedQueue<InputLogEvent> queue = new ConcurrentLinkedQueue<>();
  private CloudWatchLogsClient client;
  private ScheduledExecutorService scheduler;
  private String sequenceToken;
  private volatile boolean enabled;

  @PostConstruct
  public void init() {
    if (!hasAdminCredentials()) {
      log.info("CloudWatch logging is disabled");
      return;
    }
    try {
      client =
          CloudWatchLogsClient.builder()
              .region(Region.of(awsRegion))
              .credentialsProvider(
                  StaticCredentialsProvider.create(
                      AwsBasicCredentials.create(adminAccessKeyId, adminSecretAccessKey)))
              .build();
      ensureLogGroupAndStreamExist();
      scheduler = Executors.newSingleThreadScheduledExecutor();
      scheduler.scheduleAtFixedRate(this::uploadLogs, 5, 5, TimeUnit.SECONDS);
      enabled = true;
      log.info("CloudWatch logging initialized for {}/{}", logGroupName, logStreamName);
    } catch (Exception e) {
      log.error("Failed to initialize CloudWatch logging", e);
      enabled = false;
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean hasAdminCredentials() {
    return adminAccessKeyId != null
        && !adminAccessKeyId.isEmpty()
        && adminSecretAccessKey != null
        && !adminSecretAccessKey.isEmpty();
  }

  /** Queues a structured entry. Entries carrying an {@code eventType} bypass the logger filter. */
  public void log(String level, String message, Map<String, Object> data) {
    if (!enabled) {
      return;
    }
    String normalizedLevel = level != null ? level.toUpperCase(Locale.ROOT) : "INFO";
    if (!shouldSend(normalizedLevel, data)) {
      return;
    }

    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("level", normalizedLevel);
    entry.put("username", resolve(data, "username", "anonymous"));
    entry.put("message", message);
    entry.put("timestamp", Instant.now().toString());
    String correlationId = resolve(data, "correlationId", null);
    if (correlationId != null) {
      entry.put("correlationId", correlationId);
    }
    if (data != null && !data.isEmpty()) {
      entry.put("data", data);
    }

    try {
      String formatted =
          String.format(
              "[%s] [%s] %s%n%s",
              normalizedLevel,
              entry.get("username"),
              message,
              objectMapper.writeValueAsString(entry));
      queue.offer(
          InputLogEvent.builder()
              .timestamp(Instant.now().toEpochMilli())
              .message(truncate(formatted))
              .build());
    } catch (JsonProcessingException e) {
      log.warn("Failed to serialize CloudWatch entry: {}", e.getMessage());
    }
  }

  boolean shouldSend(String level, Map<String, Object> data) {
    int lvl = LEVELS.indexOf(level);
    int min = LEVELS.indexOf(minLevel.toUpperCase(Locale.ROOT));
    if (lvl >= 0 && min >= 0 && lvl < min) {
      return false;
    }
    if (data != null && data.containsKey("eventType")) {
      return true;
    }
    if (data != null && data.containsKey("logger")) {
      String logger = String.valueOf(data.get("logger"));
      Set<String> prefixes =
          Arrays.stream(allowedLoggersCsv.split(",")).map(String::trim).collect(Collectors.toSet());
      return prefixes.stream().anyMatch(logger::startsWith);
    }
    return true;
  }

  private String resolve(Map<String, Object> data, String key, String fallback) {
    if (data != null && data.get(key) != null) {
      return String.valueOf(data.get(key));
    }
    String fromMdc = MDC.get(key);
    return fromMdc != null && !fromMdc.isEmpty() ? fromMdc : fallback;
  }

  private String truncate(String message) {
    byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= MAX_MESSAGE_BYTES) {
      return message;
    }
    return new String(bytes, 0, MAX_MESSAGE_BYTES - 100, StandardCharsets.UTF_8) + "... [TRUNCATED]";
  }

  private void ensureLogGroupAndStreamExist() {
    try {
      client.createLogGroup(CreateLogGroupRequest.builder().logGroupName(logGroupName).build());
    } catch (ResourceAlreadyExistsException e) {
      log.debug("Log group {} already exists", logGroupName);
    }
    try {
      client.createLogStream(
          CreateLogStreamRequest.builder()
              .logGroupName(logGroupName)
              .logStreamName(logStreamName)
              .build());
    } catch (ResourceAlreadyExistsException e) {
      log.debug("Log stream {} already exists", logStreamName);
    }
  }

  private synchronized void uploadLogs() {
    List<InputLogEvent> batch = new ArrayList<>();
    int batchBytes = 0;
    while (!queue.isEmpty() && batch.size() < MAX_BATCH_SIZE) {
      InputLogEvent event = queue.peek();
      int size = event.message().getBytes(StandardCharsets.UTF_8).length + 26;
      if (batchBytes + size > MAX_BATCH_BYTES && !batch.isEmpty()) {
        break;
      }
      queue.poll();
      batch.add(event);
      batchBytes += size;
    }
    if (batch.isEmpty()) {
      return;
    }

    batch.sort(Comparator.comparing(InputLogEvent::timestamp));
    PutLogEventsRequest.Builder request =
        PutLogEventsRequest.builder()
            .logGroupName(logGroupName)
            .logStreamName(logStreamName)
            .logEvents(batch);
    if (sequenceToken != null) {
      request.sequenceToken(sequenceToken);
    }
    try {
      PutLogEventsResponse response = client.putLogEvents(request.build());
      sequenceToken = response.nextSequenceToken();
    } catch (InvalidSequenceTokenException e) {
      sequenceToken = e.expectedSequenceToken();
      batch.forEach(queue::offer);
    } catch (Exception e) {
      log.error("Failed to upload logs to CloudWatch", e);
      batch.forEach(queue::offer);
    }
  }

  @PreDestroy
  public void shutdown() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
        scheduler.shutdownNow();
      }
      uploadLogs();
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
