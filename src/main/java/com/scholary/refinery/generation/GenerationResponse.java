package com.scholary.refinery.generation;

/**
 * Text returned by the generation backend, with token usage when the backend reports it.
 */
public record GenerationResponse(
    String text, String model, Integer promptTokens, Integer completionTokens) {}
