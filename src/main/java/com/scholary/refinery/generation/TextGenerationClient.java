package com.scholary.refinery.generation;

/**
 * Interface for text-generation backends.
 *
 * <p>Lets the stage executor stay independent of the provider and lets tests script replies.
 */
public interface TextGenerationClient {

  /**
   * Generate a completion for a single-turn prompt.
   *
   * @param prompt the full prompt
   * @param maxTokens upper bound on completion tokens
   * @return the generated text
   * @throws GenerationException if the call fails or returns no text
   */
  GenerationResponse complete(String prompt, int maxTokens);
}
