package com.scholary.refinery.pipeline;

/**
 * Thrown when a pipeline run cannot produce its result.
 *
 * <p>The message is what the task reports as its error.
 */
public class PipelineException extends RuntimeException {

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
