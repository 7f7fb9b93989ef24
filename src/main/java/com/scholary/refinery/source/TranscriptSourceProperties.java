package com.scholary.refinery.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the transcript service the source client talks to.
 *
 * @param baseUrl transcript service root
 * @param language preferred caption language
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout request timeout in seconds
 */
@ConfigurationProperties(prefix = "transcripts")
@Validated
public record TranscriptSourceProperties(
    @NotBlank String baseUrl,
    @NotBlank String language,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
