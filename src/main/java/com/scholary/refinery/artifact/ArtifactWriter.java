package com.scholary.refinery.artifact;

import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.objectstore.ObjectStoreClient;
import com.scholary.refinery.objectstore.ObjectStoreException;
import com.scholary.refinery.objectstore.ObjectStoreProperties;
import com.scholary.refinery.pipeline.DocumentRunResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes and reads the Markdown artifacts of finished runs.
 *
 * <p>A single-video run produces a transcript and a summary keyed by video id; a cluster run
 * produces a report keyed by session id. Later runs overwrite earlier artifacts for the same id.
 */
@Component
public class ArtifactWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactWriter.class);

  private static final String MARKDOWN = "text/markdown; charset=utf-8";

  private final ObjectStoreClient objectStoreClient;
  private final String bucket;
  private final Clock clock;

  private volatile boolean bucketReady;

  public ArtifactWriter(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties, Clock clock) {
    this.objectStoreClient = objectStoreClient;
    this.bucket = properties.bucket();
    this.clock = clock;
  }

  /**
   * Render a transcript artifact.
   *
   * <pre>
   * # Transcript: abc123
   *
   * **Generated:** 2024-01-01T00:00:00Z
   * **Word Count:** 120
   * ...
   * ## Transcript
   * </pre>
   */
  public String renderTranscript(DocumentRunResult result) {
    return "# Transcript: " + result.documentId() + "\n\n"
        + "**Generated:** " + clock.instant() + "\n"
        + "**Word Count:** " + result.wordCount() + "\n"
        + "**Character Count:** " + result.characterCount() + "\n"
        + "**Cleaned:** " + result.cleaned() + "\n\n"
        + "## Transcript\n\n"
        + result.transcript();
  }

  public String renderSummary(DocumentRunResult result) {
    return "# Summary: " + result.documentId() + "\n\n"
        + "**Generated:** " + clock.instant() + "\n"
        + "**Model:** " + (result.model() != null ? result.model() : "Unknown") + "\n\n"
        + "## Summary\n\n"
        + result.summary();
  }

  public String renderReport(ClusterState cluster) {
    return "# Research Report: " + cluster.getName() + "\n\n"
        + "**Generated:** " + clock.instant() + "\n"
        + "**Session ID:** " + cluster.getSessionId() + "\n"
        + "**Videos Processed:** " + cluster.getRawDocuments().size() + "\n\n"
        + "---\n\n"
        + cluster.getSynthesis();
  }

  /** Publish the transcript and summary of a single-video run. */
  public void writeDocumentArtifacts(DocumentRunResult result) {
    put(ArtifactType.TRANSCRIPT.keyFor(result.documentId()), renderTranscript(result));
    put(ArtifactType.SUMMARY.keyFor(result.documentId()), renderSummary(result));
    LOGGER.info("Saved artifacts for video {}", result.documentId());
  }

  /** Publish the report of a completed cluster. */
  public void writeClusterReport(ClusterState cluster) {
    if (cluster.getSynthesis() == null) {
      throw new IllegalArgumentException(
          "Cluster " + cluster.getSessionId() + " has no report to publish");
    }
    put(ArtifactType.REPORT.keyFor(cluster.getSessionId()), renderReport(cluster));
    LOGGER.info("Saved report for cluster {} ({})", cluster.getSessionId(), cluster.getName());
  }

  /**
   * Read an artifact back.
   *
   * @param type which artifact
   * @param id video id or session id
   * @return the Markdown, or empty if it was never written
   */
  public Optional<String> read(ArtifactType type, String id) {
    String key = type.keyFor(id);
    if (!objectStoreClient.objectExists(bucket, key)) {
      return Optional.empty();
    }
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, key)) {
      return Optional.of(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to read artifact: key=" + key, e);
    }
  }

  private void put(String key, String markdown) {
    if (!bucketReady) {
      objectStoreClient.ensureBucket(bucket);
      bucketReady = true;
    }
    byte[] bytes = markdown.getBytes(StandardCharsets.UTF_8);
    objectStoreClient.putObject(bucket, key, new ByteArrayInputStream(bytes), bytes.length, MARKDOWN);
  }
}
