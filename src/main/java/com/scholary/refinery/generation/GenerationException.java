package com.scholary.refinery.generation;

/**
 * Thrown when a text-generation call fails.
 *
 * <p>Covers transport errors, timeouts, non-success responses and replies without any text.
 */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
