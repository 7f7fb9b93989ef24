package com.scholary.refinery.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the text-generation backend.
 *
 * <p>Any OpenAI-compatible chat-completions endpoint works (hosted providers, LiteLLM proxies,
 * Ollama). The cost ceiling is checked per call before the request is sent.
 *
 * @param baseUrl endpoint root, without {@code /v1}
 * @param apiKey bearer token; blank for local backends
 * @param model model name sent with every request
 * @param maxCostLimit largest estimated cost, in dollars, a single call may have
 * @param costPer1kTokens estimated dollars per 1000 prompt tokens
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout request timeout in seconds
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @PositiveOrZero double maxCostLimit,
    @PositiveOrZero double costPer1kTokens,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
