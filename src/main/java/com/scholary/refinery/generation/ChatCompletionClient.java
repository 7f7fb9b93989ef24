package com.scholary.refinery.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible chat-completions endpoint.
 *
 * <p>Sends one user message per call and returns the first choice. There is no retry here: a
 * failed call is reported to the stage executor, which turns it into a failed stage.
 */
@Component
public class ChatCompletionClient implements TextGenerationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionClient.class);

  private final HttpClient httpClient;
  private final GenerationProperties properties;
  private final ObjectMapper objectMapper;

  public ChatCompletionClient(GenerationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized chat completion client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public GenerationResponse complete(String prompt, int maxTokens) {
    try {
      return attemptComplete(prompt, maxTokens);
    } catch (IOException e) {
      throw new GenerationException("Chat completion request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationException("Chat completion interrupted", e);
    }
  }

  private GenerationResponse attemptComplete(String prompt, int maxTokens)
      throws IOException, InterruptedException {

    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("max_tokens", maxTokens);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "user").put("content", prompt);

    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }
    HttpRequest request = builder.build();

    LOGGER.debug("Sending chat completion request to {} (maxTokens={})", request.uri(), maxTokens);

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new GenerationException(
          String.format(
              "Chat completion returned status %d: %s", response.statusCode(), response.body()));
    }

    return parseResponse(response.body());
  }

  GenerationResponse parseResponse(String json) throws IOException {
    JsonNode root = objectMapper.readTree(json);
    JsonNode content = root.path("choices").path(0).path("message").path("content");
    if (!content.isTextual() || content.asText().isBlank()) {
      throw new GenerationException("Chat completion returned no text");
    }

    JsonNode usage = root.path("usage");
    Integer promptTokens = usage.hasNonNull("prompt_tokens") ? usage.get("prompt_tokens").asInt() : null;
    Integer completionTokens =
        usage.hasNonNull("completion_tokens") ? usage.get("completion_tokens").asInt() : null;
    String model = root.hasNonNull("model") ? root.get("model").asText() : properties.model();

    LOGGER.info(
        "Chat completion successful: model={}, promptTokens={}, completionTokens={}",
        model,
        promptTokens,
        completionTokens);

    return new GenerationResponse(content.asText().trim(), model, promptTokens, completionTokens);
  }
}
