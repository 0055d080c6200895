package com.catalai.classifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "catalai")
public class ApplicationProperties {

  private String version;

  private Clarification clarification = new Clarification();
  private Llm llm = new Llm();
  private Learning learning = new Learning();
  private Storage storage = new Storage();
  private Cache cache = new Cache();

  @Data
  public static class Clarification {
    private double highConfidenceThreshold = 0.85;
    private double lowConfidenceThreshold = 0.6;
    private int softQuestionLimit = 8;
    private int hardQuestionLimit = 15;
    private int repetitionWindow = 5;
    private int repetitionMinDistinct = 3;
    private int dontKnowWindow = 3;
    private int dontKnowThreshold = 2;
    private double duplicateSimilarity = 0.8;
  }

  @Data
  public static class Llm {
    private long timeoutSeconds = 30;
    private int maxAttempts = 3;
    private long initialBackoffMs = 1000;
    private long maxBackoffMs = 8000;
  }

  @Data
  public static class Learning {
    private double agreementThreshold = 0.8;
    private double validationSampleRatio = 0.1;
    private int validationMinSample = 10;
    private int validationMaxSample = 1000;
    private int maxExamplesPerMisclassification = 5;
    private double lowConfidenceMisclassification = 0.7;
  }

  @Data
  public static class Storage {
    /** {@code file} or {@code s3}. */
    private String type = "file";

    private String baseDir = "./data";
    private String s3Bucket;
    private String s3Prefix = "catalai/";
  }

  @Data
  public static class Cache {
    private long maxSize = 50;
    private long expireAfterWriteMinutes = 60;
  }
}
