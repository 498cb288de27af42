package com.scholary.podcast.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * End-to-end test of an upload job against MinIO.
 *
 * <p>Collaborators run in simulation mode and the transcript is supplied with the request, so no
 * transcription, scoring or speech service is needed. Skipped when Docker is not available.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
class PodcastIntegrationTest {

  private static final String MINIO_ACCESS_KEY = "minioadmin";
  private static final String MINIO_SECRET_KEY = "minioadmin";
  private static final String TEST_BUCKET = "meetings-it";
  private static final String AUDIO_KEY = "uploads/standup.wav";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", MINIO_ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", MINIO_SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3Client s3Client;
  private static Path workDir;

  @Autowired private TestRestTemplate restTemplate;
  @Autowired private ObjectMapper objectMapper;

  @DynamicPropertySource
  static void configureProperties(DynamicPropertyRegistry registry) throws Exception {
    workDir = Files.createTempDirectory("podcast-it-");
    registry.add("objectstore.endpoint", PodcastIntegrationTest::minioEndpoint);
    registry.add("objectstore.accessKey", () -> MINIO_ACCESS_KEY);
    registry.add("objectstore.secretKey", () -> MINIO_SECRET_KEY);
    registry.add("objectstore.bucket", () -> TEST_BUCKET);
    registry.add("objectstore.pathStyleAccess", () -> "true");
    registry.add("podcast.collaborators.mode", () -> "simulation");
    registry.add("podcast.pipeline.tempDir", () -> workDir.toString());
  }

  @BeforeAll
  static void setUp() {
    s3Client =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(MINIO_ACCESS_KEY, MINIO_SECRET_KEY)))
            .endpointOverride(URI.create(minioEndpoint()))
            .forcePathStyle(true)
            .build();

    s3Client.createBucket(CreateBucketRequest.builder().bucket(TEST_BUCKET).build());

    byte[] recording = WavCodec.encode(tone(120.0));
    s3Client.putObject(
        PutObjectRequest.builder().bucket(TEST_BUCKET).key(AUDIO_KEY).build(),
        RequestBody.fromBytes(recording));
  }

  @AfterAll
  static void tearDown() {
    if (s3Client != null) {
      s3Client.close();
    }
  }

  @Test
  void uploadJob_shouldStorePodcastManifestAndCaptions() throws Exception {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("workflow", "UPLOAD");
    request.put("title", "Stand-up");
    request.put("audioKey", AUDIO_KEY);
    request.put("voice", "british");
    request.put("style", "casual");
    request.put("segmentCount", 3);
    request.put("addMusic", true);
    request.put("transcript", transcript());

    ResponseEntity<JsonNode> created =
        restTemplate.postForEntity("/api/podcasts", request, JsonNode.class);
    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    String jobId = created.getBody().get("jobId").asText();

    await()
        .atMost(Duration.ofSeconds(60))
        .pollInterval(Duration.ofMillis(200))
        .until(() -> isTerminal(status(jobId).get("state").asText()));

    JsonNode status = status(jobId);
    assertThat(status.get("state").asText()).isEqualTo("DONE");
    assertThat(status.get("degradedSegmentIds")).isEmpty();
    JsonNode result = status.get("result");
    assertThat(result.get("audioUrl").asText()).contains(jobId);
    assertThat(result.get("durationSeconds").asDouble()).isPositive();

    byte[] podcast = download(result.get("audioKey").asText());
    assertThat(WavCodec.decode(podcast)).isNotEmpty();
    assertThat(WavCodec.durationSeconds(podcast))
        .isCloseTo(result.get("durationSeconds").asDouble(), within(0.001));

    JsonNode manifest =
        objectMapper.readTree(download(result.get("manifestKey").asText()));
    assertThat(manifest.get("jobId").asText()).isEqualTo(jobId);
    assertThat(manifest.get("voice").asText()).isEqualTo("british");
    assertThat(manifest.get("musicTrack").asText()).isEqualTo("music:built-in");
    assertThat(manifest.get("segments")).hasSize(3);
    assertThat(manifest.get("segments").get(0).get("keyPoints").isArray()).isTrue();

    // Without ffmpeg on the path the podcast is stored as WAV only
    if (result.hasNonNull("mp3Key")) {
      assertThat(download(result.get("mp3Key").asText())).isNotEmpty();
    }

    String captions =
        new String(download(result.get("captionsKey").asText()), StandardCharsets.UTF_8);
    assertThat(captions).startsWith("1\n").contains(" --> ");

    ResponseEntity<Void> acknowledged =
        restTemplate.exchange(
            "/api/podcasts/" + jobId,
            HttpMethod.DELETE,
            null,
            Void.class);
    assertThat(acknowledged.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    assertThat(
            restTemplate
                .getForEntity("/api/podcasts/" + jobId, JsonNode.class)
                .getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void uploadJob_shouldFailWhenAudioIsMissing() {
    Map<String, Object> request = new LinkedHashMap<>();
    request.put("workflow", "UPLOAD");
    request.put("audioKey", "uploads/nope.wav");
    request.put("transcript", transcript());

    String jobId =
        restTemplate
            .postForEntity("/api/podcasts", request, JsonNode.class)
            .getBody()
            .get("jobId")
            .asText();

    await()
        .atMost(Duration.ofSeconds(30))
        .until(() -> isTerminal(status(jobId).get("state").asText()));

    JsonNode failure = status(jobId).get("failure");
    assertThat(failure.get("stage").asText()).isEqualTo("TRANSCRIBING");
    assertThat(failure.get("kind").asText()).isEqualTo("ASSET_UNREADABLE");
  }

  private JsonNode status(String jobId) {
    return restTemplate.getForObject("/api/podcasts/" + jobId, JsonNode.class);
  }

  private static boolean isTerminal(String state) {
    return state.equals("DONE") || state.equals("FAILED") || state.equals("CANCELLED");
  }

  private static byte[] download(String key) {
    ResponseBytes<GetObjectResponse> bytes =
        s3Client.getObjectAsBytes(GetObjectRequest.builder().bucket(TEST_BUCKET).key(key).build());
    return bytes.asByteArray();
  }

  private static List<Map<String, Object>> transcript() {
    List<Map<String, Object>> chunks = new ArrayList<>();
    String[] speakers = {"alice", "bob"};
    for (int i = 0; i < 8; i++) {
      Map<String, Object> chunk = new LinkedHashMap<>();
      chunk.put("start", i * 15.0);
      chunk.put("end", i * 15.0 + 12.0);
      chunk.put("speaker", speakers[i % 2]);
      chunk.put(
          "text",
          "Item " + i + ": the release decision depends on the migration and the budget review"
              + " needs an owner".repeat(i % 3 + 1));
      chunks.add(chunk);
    }
    return chunks;
  }

  private static short[] tone(double seconds) {
    short[] samples = new short[AudioFormat.samplesFor(seconds)];
    for (int i = 0; i < samples.length; i++) {
      samples[i] =
          (short) Math.round(3000 * Math.sin(2 * Math.PI * 220 * i / AudioFormat.SAMPLE_RATE));
    }
    return samples;
  }

  private static String minioEndpoint() {
    return String.format(
        "http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));
  }
}
