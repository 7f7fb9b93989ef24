package com.scholary.refinery.cluster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClusterStateTest {

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  private ClusterState cluster;

  @BeforeEach
  void setUp() {
    cluster =
        ClusterState.create(
            "Topic A",
            List.of("https://youtu.be/aaa", "https://youtu.be/bbb"),
            true,
            clock);
  }

  @Test
  void create_shouldStartPendingWithNoDocuments() {
    assertThat(cluster.getSessionId()).isNotBlank();
    assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.PENDING);
    assertThat(cluster.getRawDocuments()).isEmpty();
    assertThat(cluster.getEnrichedDocuments()).isEmpty();
    assertThat(cluster.getSynthesis()).isNull();
    assertThat(cluster.getCreatedAt()).isEqualTo(cluster.getUpdatedAt());
  }

  @Test
  void mutators_shouldAdvanceUpdatedAtEvenWithAFixedClock() {
    Instant before = cluster.getUpdatedAt();

    cluster.advanceTo(ClusterStatus.PROCESSING, clock);
    Instant afterTransition = cluster.getUpdatedAt();
    cluster.putRawDocument("aaa", "raw text", clock);

    assertThat(afterTransition).isAfter(before);
    assertThat(cluster.getUpdatedAt()).isAfter(afterTransition);
  }

  @Test
  void transcriptCount_shouldCountDistinctCollectedTranscripts() {
    ClusterState duplicated =
        ClusterState.create(
            "Topic A", List.of("https://youtu.be/aaa", "https://youtu.be/aaa"), false, clock);
    duplicated.putRawDocument("aaa", "raw text", clock);
    duplicated.putRawDocument("aaa", "raw text", clock);

    assertThat(duplicated.transcriptCount()).isEqualTo(1);
    assertThat(duplicated.getSourceRefs()).hasSize(2);
  }

  @Test
  void advanceTo_shouldRejectIllegalTransitions() {
    assertThatThrownBy(() -> cluster.advanceTo(ClusterStatus.TRANSCRIPTS_READY, clock))
        .isInstanceOf(IllegalStateException.class);
    assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.PENDING);
  }

  @Test
  void advanceTo_shouldNotCompleteWithoutAReport() {
    cluster.advanceTo(ClusterStatus.PROCESSING, clock);
    cluster.advanceTo(ClusterStatus.TRANSCRIPTS_READY, clock);

    assertThatThrownBy(() -> cluster.advanceTo(ClusterStatus.COMPLETED, clock))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void putEnrichedDocument_shouldRequireRawCounterpart() {
    assertThatThrownBy(() -> cluster.putEnrichedDocument("zzz", "clean", clock))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void effectiveDocuments_shouldPreferEnrichedSet() {
    cluster.putRawDocument("aaa", "raw a", clock);
    cluster.putRawDocument("bbb", "raw b", clock);
    assertThat(cluster.effectiveDocuments()).containsEntry("aaa", "raw a");

    cluster.putEnrichedDocument("aaa", "clean a", clock);

    assertThat(cluster.effectiveDocuments()).containsOnlyKeys("aaa");
    assertThat(cluster.pendingEnrichment()).containsExactly("bbb");
  }

  @Test
  void complete_shouldSetReportOnceAndMoveToCompleted() {
    cluster.advanceTo(ClusterStatus.PROCESSING, clock);
    cluster.advanceTo(ClusterStatus.TRANSCRIPTS_READY, clock);

    cluster.complete("# Report", List.of("alpha"), clock);

    assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.COMPLETED);
    assertThat(cluster.getSynthesis()).isEqualTo("# Report");
    assertThat(cluster.getKeywords()).containsExactly("alpha");
    assertThatThrownBy(() -> cluster.complete("# Other", List.of(), clock))
        .isInstanceOf(IllegalStateException.class);
    assertThat(cluster.getSynthesis()).isEqualTo("# Report");
  }

  @Test
  void complete_shouldLeaveStateUntouchedWhenTransitionIsIllegal() {
    assertThatThrownBy(() -> cluster.complete("# Report", List.of(), clock))
        .isInstanceOf(IllegalStateException.class);

    assertThat(cluster.getSynthesis()).isNull();
    assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.PENDING);
  }

  @Test
  void fail_shouldRecordReasonAndBeAbsorbing() {
    cluster.advanceTo(ClusterStatus.PROCESSING, clock);

    cluster.fail("backend down", clock);

    assertThat(cluster.getStatus()).isEqualTo(ClusterStatus.FAILED);
    assertThat(cluster.getError()).isEqualTo("backend down");
    assertThatThrownBy(() -> cluster.advanceTo(ClusterStatus.TRANSCRIPTS_READY, clock))
        .isInstanceOf(IllegalStateException.class);
  }
}
