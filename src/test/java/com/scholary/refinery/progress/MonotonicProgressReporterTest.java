package com.scholary.refinery.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MonotonicProgressReporterTest {

  @Test
  void report_shouldForwardIncreasingEventsUnchanged() {
    List<ProgressEvent> seen = new ArrayList<>();
    MonotonicProgressReporter reporter = new MonotonicProgressReporter(seen::add);

    reporter.report(new ProgressEvent(1, 3, "Processing video 1/3"));
    reporter.report(new ProgressEvent(2, 3, "Processing video 2/3"));

    assertThat(seen)
        .containsExactly(
            new ProgressEvent(1, 3, "Processing video 1/3"),
            new ProgressEvent(2, 3, "Processing video 2/3"));
  }

  @Test
  void report_shouldClampLowerCountsButKeepTheLabel() {
    List<ProgressEvent> seen = new ArrayList<>();
    MonotonicProgressReporter reporter = new MonotonicProgressReporter(seen::add);

    reporter.report(new ProgressEvent(3, 3, "Processing video 3/3"));
    reporter.report(new ProgressEvent(1, 2, "Generating summary..."));

    assertThat(seen.get(1)).isEqualTo(new ProgressEvent(3, 3, "Generating summary..."));
  }

  @Test
  void progressEvent_shouldRejectCountsOutsideTotal() {
    assertThatThrownBy(() -> new ProgressEvent(4, 3, "too far"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ProgressEvent(-1, 3, "negative"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
