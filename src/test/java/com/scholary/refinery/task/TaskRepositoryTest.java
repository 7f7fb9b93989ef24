package com.scholary.refinery.task;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.refinery.config.RefineryProperties;
import com.scholary.refinery.progress.ProgressEvent;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TaskRepositoryTest {

  private final TaskRepository repository =
      new TaskRepository(
          new RefineryProperties(
              Duration.ofDays(7), 100, Duration.ofHours(1), 100, 1, 1, "memory"));

  private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void update_shouldReplaceActiveHandle() {
    repository.save(TaskHandle.pending("t-1", TaskKind.CLUSTER, "s-1", now));

    repository.update("t-1", handle -> handle.running(now.plusSeconds(1)));

    assertThat(repository.findById("t-1").orElseThrow().state()).isEqualTo(TaskState.RUNNING);
  }

  @Test
  void update_shouldNeverReplaceTerminalHandle() {
    repository.save(TaskHandle.pending("t-1", TaskKind.SINGLE_DOCUMENT, null, now));
    TaskHandle failed =
        repository.update("t-1", handle -> handle.failed("boom", now.plusSeconds(1))).orElseThrow();

    repository.update(
        "t-1", handle -> handle.withProgress(new ProgressEvent(1, 1, "late"), now.plusSeconds(2)));
    repository.update("t-1", handle -> handle.running(now.plusSeconds(3)));

    assertThat(repository.findById("t-1")).contains(failed);
  }

  @Test
  void update_shouldIgnoreUnknownTask() {
    assertThat(repository.update("missing", handle -> handle.running(now))).isEmpty();
    assertThat(repository.findById("missing")).isEmpty();
  }
}
