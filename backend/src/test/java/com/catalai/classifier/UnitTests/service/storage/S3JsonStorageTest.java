package com.catalai.classifier.service.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.catalai.classifier.config.ApplicationProperties;
import com.catalai.classifier.config.CoreConfig;
import com.catalai.classifier.dto.learning.ReviewRequest;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

@ExtendWith(MockitoExtension.class)
@DisplayName("S3JsonStorage Tests")
class S3JsonStorageTest {

  @Mock private S3Client s3Client;

  private S3JsonStorage storage;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getStorage().setS3Bucket("catalai-bucket");
    properties.getStorage().setS3Prefix("env/");
    storage = new S3JsonStorage(new CoreConfig().objectMapper(), properties);
    storage.setS3Client(s3Client);
    storage.init();
  }

  @Test
  @DisplayName("Should refuse to start without a bucket")
  void shouldRequireBucket() {
    S3JsonStorage unconfigured = new S3JsonStorage(new CoreConfig().objectMapper(), new ApplicationProperties());
    unconfigured.setS3Client(s3Client);

    assertThatThrownBy(unconfigured::init)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("s3-bucket");
  }

  @Test
  @DisplayName("Should read a document under the configured prefix")
  void shouldReadDocument() {
    // Given
    byte[] body = "{\"reviewedBy\":\"lead\",\"reviewNotes\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), body));

    // When
    Optional<ReviewRequest> result = storage.read("reviews/r1.json", ReviewRequest.class);

    // Then
    assertThat(result).get().extracting(ReviewRequest::getReviewedBy).isEqualTo("lead");
    ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
    verify(s3Client).getObjectAsBytes(request.capture());
    assertThat(request.getValue().bucket()).isEqualTo("catalai-bucket");
    assertThat(request.getValue().key()).isEqualTo("env/reviews/r1.json");
  }

  @Test
  @DisplayName("Should report a missing key as empty")
  void shouldReturnEmptyForMissingKey() {
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThat(storage.read("reviews/none.json", ReviewRequest.class)).isEmpty();
    assertThat(storage.readLines("audit-logs/2024-03-01.jsonl")).isEmpty();
  }

  @Test
  @DisplayName("Should append by rewriting the object")
  void shouldAppendLine() {
    // Given
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenReturn(
            ResponseBytes.fromByteArray(
                GetObjectResponse.builder().build(), "{\"a\":1}\n".getBytes(StandardCharsets.UTF_8)));

    // When
    storage.appendLine("audit-logs/2024-03-01.jsonl", "{\"b\":2}");

    // Then
    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(request.getValue().key()).isEqualTo("env/audit-logs/2024-03-01.jsonl");
    assertThat(request.getValue().contentType()).isEqualTo("application/x-ndjson");
  }

  @Test
  @DisplayName("Should list keys across pages with the prefix stripped")
  void shouldListAcrossPages() {
    // Given
    when(s3Client.listObjectsV2(any(ListObjectsV2Request.class)))
        .thenReturn(
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("env/decision-matrix/1.1.json").build())
                .isTruncated(true)
                .nextContinuationToken("page-2")
                .build())
        .thenReturn(
            ListObjectsV2Response.builder()
                .contents(S3Object.builder().key("env/decision-matrix/1.0.json").build())
                .isTruncated(false)
                .build());

    // When & Then
    assertThat(storage.list("decision-matrix/"))
        .containsExactly("decision-matrix/1.0.json", "decision-matrix/1.1.json");
  }
}
