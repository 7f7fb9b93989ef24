package com.scholary.refinery.progress;

/**
 * Sink for pipeline progress events.
 *
 * <p>Pipelines emit events here and know nothing about how they are stored or polled.
 */
@FunctionalInterface
public interface ProgressReporter {

  ProgressReporter NO_OP = event -> {};

  void report(ProgressEvent event);
}
