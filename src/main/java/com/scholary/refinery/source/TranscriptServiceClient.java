package com.scholary.refinery.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the transcript service.
 *
 * <p>The service wraps caption retrieval and answers
 * {@code GET /api/v1/transcripts/{videoId}?language=xx} with
 *
 * <pre>
 * {
 *   "videoId": "abc123",
 *   "language": "en",
 *   "segments": [{"text": "hello", "start": 0.0, "duration": 1.5}]
 * }
 * </pre>
 *
 * <p>Any failure (404, other status, timeout, malformed body) is reported as an unavailable
 * transcript; the caller decides whether that is fatal.
 */
@Component
public class TranscriptServiceClient implements TranscriptSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptServiceClient.class);

  private final HttpClient httpClient;
  private final TranscriptSourceProperties properties;
  private final ObjectMapper objectMapper;

  public TranscriptServiceClient(TranscriptSourceProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized transcript client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public Optional<String> resolveDocumentId(String sourceRef) {
    return VideoIdExtractor.extract(sourceRef);
  }

  @Override
  public Optional<String> fetchDocument(String documentId) {
    String encodedId = URLEncoder.encode(documentId, StandardCharsets.UTF_8);
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(
                URI.create(
                    properties.baseUrl()
                        + "/api/v1/transcripts/"
                        + encodedId
                        + "?language="
                        + URLEncoder.encode(properties.language(), StandardCharsets.UTF_8)))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Accept", "application/json")
            .GET()
            .build();

    LOGGER.debug("Fetching transcript from {}", request.uri());

    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() == 404) {
        LOGGER.warn("No transcript available for video {}", documentId);
        return Optional.empty();
      }
      if (response.statusCode() != 200) {
        LOGGER.warn(
            "Transcript service returned status {} for video {}: {}",
            response.statusCode(),
            documentId,
            response.body());
        return Optional.empty();
      }

      Optional<String> transcript = joinSegments(response.body());
      transcript.ifPresent(
          text ->
              LOGGER.info(
                  "Fetched transcript for video {}: {} chars", documentId, text.length()));
      return transcript;

    } catch (IOException e) {
      LOGGER.warn("Failed to fetch transcript for video {}: {}", documentId, e.getMessage());
      return Optional.empty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted fetching transcript for video {}", documentId);
      return Optional.empty();
    }
  }

  Optional<String> joinSegments(String json) throws IOException {
    JsonNode segments = objectMapper.readTree(json).path("segments");
    StringJoiner text = new StringJoiner(" ");
    for (JsonNode segment : segments) {
      String part = segment.path("text").asText("").trim();
      if (!part.isEmpty()) {
        text.add(part);
      }
    }
    String joined = text.toString();
    return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
  }
}
