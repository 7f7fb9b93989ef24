package com.scholary.refinery.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards progress events while keeping {@code current} non-decreasing.
 *
 * <p>An event whose count is lower than one already forwarded (for example from a document that
 * finished out of order) is forwarded with the higher count and the new label.
 */
public class MonotonicProgressReporter implements ProgressReporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonotonicProgressReporter.class);

  private final ProgressReporter delegate;
  private ProgressEvent last;

  public MonotonicProgressReporter(ProgressReporter delegate) {
    this.delegate = delegate;
  }

  @Override
  public synchronized void report(ProgressEvent event) {
    ProgressEvent effective = event;
    if (last != null && event.current() < last.current()) {
      LOGGER.debug("Clamping progress {} to {}", event.current(), last.current());
      int total = Math.max(event.total(), last.current());
      effective = new ProgressEvent(last.current(), total, event.label());
    }
    last = effective;
    delegate.report(effective);
  }
}
