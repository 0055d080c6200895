package com.catalai.classifier.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class CoreConfigTest {

  private CoreConfig coreConfig;

  @BeforeEach
  public void setUp() {
    coreConfig = new CoreConfig();
  }

  @Test
  public void testObjectMapperConfiguration() {
    ObjectMapper mapper = coreConfig.objectMapper();

    assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    assertFalse(mapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
  }

  @Test
  public void testInstantsAreWrittenAsIsoText() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    String json = mapper.writeValueAsString(Instant.parse("2024-03-01T10:00:00Z"));
    assertEquals("\"2024-03-01T10:00:00Z\"", json);

    TestClass result = mapper.readValue("{\"known\":\"value\",\"unknown\":\"value\"}", TestClass.class);
    assertEquals("value", result.known);
  }

  @Test
  public void testLlmExecutorConfiguration() {
    Executor executor = coreConfig.llmExecutor();

    assertTrue(executor instanceof ThreadPoolTaskExecutor);
    ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;
    assertEquals(8, taskExecutor.getCorePoolSize());
    assertEquals(32, taskExecutor.getMaxPoolSize());
    assertEquals(200, taskExecutor.getQueueCapacity());
    assertEquals("llm-call-", taskExecutor.getThreadNamePrefix());
    taskExecutor.shutdown();
  }

  @Test
  public void testLlmExecutorRunsTasks() throws Exception {
    ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) coreConfig.llmExecutor();
    CountDownLatch latch = new CountDownLatch(10);

    for (int i = 0; i < 10; i++) {
      executor.execute(latch::countDown);
    }

    assertTrue(latch.await(2, TimeUnit.SECONDS));
    executor.shutdown();
  }

  private static final class TestClass {
    public String known;
  }
}
