package com.scholary.refinery.progress;

/**
 * A discrete progress update for a running pipeline.
 *
 * @param current units of work done so far, {@code 0 <= current <= total}
 * @param total units of work in the run
 * @param label human-readable description of the current phase
 */
public record ProgressEvent(int current, int total, String label) {

  public ProgressEvent {
    if (total < 0 || current < 0 || current > total) {
      throw new IllegalArgumentException(
          String.format("Invalid progress %d/%d", current, total));
    }
  }
}
