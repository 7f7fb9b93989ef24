package com.scholary.refinery.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.cluster.ClusterStatus;
import com.scholary.refinery.objectstore.ObjectStoreClient;
import com.scholary.refinery.objectstore.ObjectStoreProperties;
import com.scholary.refinery.pipeline.DocumentRunResult;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ArtifactWriterTest {

  private static final String BUCKET = "artifacts";

  @Mock private ObjectStoreClient objectStoreClient;

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

  private ArtifactWriter writer;

  @BeforeEach
  void setUp() {
    writer =
        new ArtifactWriter(
            objectStoreClient,
            new ObjectStoreProperties("http://localhost:9000", "a", "b", BUCKET, "us-east-1", true),
            clock);
  }

  @Test
  void writeDocumentArtifacts_shouldWriteTranscriptAndSummaryUnderVideoId() throws Exception {
    DocumentRunResult result =
        new DocumentRunResult("abc123", "the transcript", "the summary", 2, 14, true, "gpt-test");

    writer.writeDocumentArtifacts(result);

    ArgumentCaptor<InputStream> body = ArgumentCaptor.forClass(InputStream.class);
    verify(objectStoreClient, times(1)).ensureBucket(BUCKET);
    verify(objectStoreClient)
        .putObject(eq(BUCKET), eq("videos/abc123/transcript.md"), body.capture(), anyLong(), any());
    verify(objectStoreClient)
        .putObject(eq(BUCKET), eq("videos/abc123/summary.md"), any(), anyLong(), any());

    String transcript = new String(body.getValue().readAllBytes(), StandardCharsets.UTF_8);
    assertThat(transcript)
        .startsWith("# Transcript: abc123")
        .contains("**Generated:** 2024-05-01T10:00:00Z")
        .contains("**Word Count:** 2")
        .endsWith("## Transcript\n\nthe transcript");
  }

  @Test
  void renderReport_shouldIncludeHeaderAndLinkedReport() {
    ClusterState cluster = completedCluster();

    String report = writer.renderReport(cluster);

    assertThat(report)
        .startsWith("# Research Report: Topic A")
        .contains("**Session ID:** " + cluster.getSessionId())
        .contains("**Videos Processed:** 1")
        .endsWith("About [[caching]].");
  }

  @Test
  void writeClusterReport_shouldRejectClusterWithoutReport() {
    ClusterState cluster =
        ClusterState.create("Topic A", List.of("https://youtu.be/aaa"), false, clock);

    assertThatThrownBy(() -> writer.writeClusterReport(cluster))
        .isInstanceOf(IllegalArgumentException.class);
    verify(objectStoreClient, never()).putObject(any(), any(), any(), anyLong(), any());
  }

  @Test
  void read_shouldReturnStoredMarkdown() {
    when(objectStoreClient.objectExists(BUCKET, "clusters/s-1/report.md")).thenReturn(true);
    when(objectStoreClient.getObjectStream(BUCKET, "clusters/s-1/report.md"))
        .thenReturn(new ByteArrayInputStream("# Report".getBytes(StandardCharsets.UTF_8)));

    assertThat(writer.read(ArtifactType.REPORT, "s-1")).contains("# Report");
  }

  @Test
  void read_shouldReturnEmptyForMissingArtifact() {
    when(objectStoreClient.objectExists(BUCKET, "videos/zzz/summary.md")).thenReturn(false);

    assertThat(writer.read(ArtifactType.SUMMARY, "zzz")).isEmpty();
  }

  @Test
  void keyFor_shouldRejectPathTraversal() {
    assertThatThrownBy(() -> ArtifactType.TRANSCRIPT.keyFor("../secret"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private ClusterState completedCluster() {
    ClusterState cluster =
        ClusterState.create("Topic A", List.of("https://youtu.be/aaa"), false, clock);
    cluster.advanceTo(ClusterStatus.PROCESSING, clock);
    cluster.putRawDocument("aaa", "caching talk", clock);
    cluster.advanceTo(ClusterStatus.TRANSCRIPTS_READY, clock);
    cluster.complete("About [[caching]].", List.of("caching"), clock);
    return cluster;
  }
}
