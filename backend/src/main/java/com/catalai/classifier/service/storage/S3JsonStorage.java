package com.catalai.classifier.service.storage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.exception.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Stores each document as one S3 object under {@code catalai.storage.s3-prefix}. Credentials come
 * from the default AWS provider chain.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "catalai.storage.type", havingValue = "s3")
public class S3JsonStorage implements IJsonStorage {

  private final ObjectMapper objectMapper;
  private final ApplicationProperties applicationProperties;

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  private S3Client s3Client;
  private String bucket;
  private String prefix;

  @PostConstruct
  public void init() {
    bucket = applicationProperties.getStorage().getS3Bucket();
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException("catalai.storage.s3-bucket must be set for S3 storage");
    }
    prefix = applicationProperties.getStorage().getS3Prefix();
    if (prefix == null) {
      prefix = "";
    }
    if (s3Client == null) {
      s3Client = S3Client.builder().region(Region.of(awsRegion)).build();
    }
    log.info("S3 storage using bucket {} with prefix '{}'", bucket, prefix);
  }

  /** Supplies a preconfigured client; must be called before {@link #init()}. */
  public void setS3Client(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @PreDestroy
  public void cleanup() {
    if (s3Client != null) {
      s3Client.close();
    }
  }

  @Override
  public <T> Optional<T> read(String key, Class<T> type) {
    return readBytes(key)
        .map(
            bytes -> {
              try {
                return objectMapper.readValue(bytes, type);
              } catch (IOException e) {
                throw new StorageException("Failed to parse " + key, e);
              }
            });
  }

  @Override
  public void write(String key, Object value) {
    try {
      putBytes(key, objectMapper.writeValueAsBytes(value), "application/json");
    } catch (IOException e) {
      throw new StorageException("Failed to serialize " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(prefix + key).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw new StorageException("Failed to check " + key, e);
    }
  }

  @Override
  public List<String> list(String keyPrefix) {
    List<String> keys = new ArrayList<>();
    String continuationToken = null;
    try {
      do {
        ListObjectsV2Request.Builder request =
            ListObjectsV2Request.builder().bucket(bucket).prefix(prefix + keyPrefix);
        if (continuationToken != null) {
          request.continuationToken(continuationToken);
        }
        ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
        for (S3Object object : response.contents()) {
          keys.add(object.key().substring(prefix.length()));
        }
        continuationToken = response.isTruncated() ? response.nextContinuationToken() : null;
      } while (continuationToken != null);
    } catch (S3Exception e) {
      throw new StorageException("Failed to list " + keyPrefix, e);
    }
    Collections.sort(keys);
    return keys;
  }

  /** S3 has no append; the object is rewritten. Callers append rarely and from one node. */
  @Override
  public synchronized void appendLine(String key, String line) {
    String existing = readBytes(key).map(b -> new String(b, StandardCharsets.UTF_8)).orElse("");
    String updated = existing + line + "\n";
    putBytes(key, updated.getBytes(StandardCharsets.UTF_8), "application/x-ndjson");
  }

  @Override
  public List<String> readLines(String key) {
    return readBytes(key)
        .map(b -> new String(b, StandardCharsets.UTF_8))
        .map(
            text ->
                Arrays.stream(text.split("\n"))
                    .filter(l -> !l.isBlank())
                    .collect(Collectors.toList()))
        .orElse(Collections.emptyList());
  }

  private Optional<byte[]> readBytes(String key) {
    try {
      ResponseBytes<GetObjectResponse> bytes =
          s3Client.getObjectAsBytes(
              GetObjectRequest.builder().bucket(bucket).key(prefix + key).build());
      return Optional.of(bytes.asByteArray());
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      throw new StorageException("Failed to read " + key, e);
    }
  }

  private void putBytes(String key, byte[] body, String contentType) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucket).key(prefix + key).contentType(contentType).build(),
          RequestBody.fromBytes(body));
    } catch (S3Exception e) {
      throw new StorageException("Failed to write " + key, e);
    }
  }
}
