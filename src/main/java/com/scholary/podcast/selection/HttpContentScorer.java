package com.scholary.podcast.selection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the external content scorer.
 *
 * <p>Posts {@code {text, style, previous, next}} as JSON to {@code /v1/score} and expects {@code
 * {relevance, summary}} back. There is no retry here: a failed call makes the selector switch the
 * whole selection to the local heuristic.
 */
public class HttpContentScorer implements ContentScorer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpContentScorer.class);

  private final HttpClient httpClient;
  private final ScorerProperties properties;
  private final ObjectMapper objectMapper;

  public HttpContentScorer(ScorerProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized content scorer client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public ContentScore score(String text, ScoringContext context) {
    try {
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/v1/score"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(buildBody(text, context)));
      if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
        builder.header("Authorization", "Bearer " + properties.apiKey());
      }

      HttpResponse<String> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new ContentScorerException(
            String.format(
                "Scorer returned status %d: %s", response.statusCode(), response.body()));
      }
      return parse(response.body());

    } catch (IOException e) {
      throw new ContentScorerException("Scorer request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ContentScorerException("Scorer request interrupted", e);
    }
  }

  @Override
  public String name() {
    return "http";
  }

  private String buildBody(String text, ScoringContext context) throws JsonProcessingException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("text", text);
    body.put("style", context.style().tag());
    body.put("previous", context.previousText());
    body.put("next", context.nextText());
    return objectMapper.writeValueAsString(body);
  }

  private ContentScore parse(String body) throws JsonProcessingException {
    JsonNode node = objectMapper.readTree(body);
    JsonNode relevance = node.get("relevance");
    JsonNode summary = node.get("summary");
    if (relevance == null || !relevance.isNumber() || summary == null || !summary.isTextual()) {
      throw new ContentScorerException("Malformed scorer response: " + body);
    }
    return new ContentScore(relevance.asDouble(), summary.asText());
  }
}
