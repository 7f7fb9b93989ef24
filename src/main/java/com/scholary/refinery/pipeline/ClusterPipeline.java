package com.scholary.refinery.pipeline;

import com.scholary.refinery.artifact.ArtifactWriter;
import com.scholary.refinery.cluster.ClusterNotFoundException;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.cluster.ClusterStatus;
import com.scholary.refinery.logging.StructuredLogger;
import com.scholary.refinery.objectstore.ObjectStoreException;
import com.scholary.refinery.progress.ProgressEvent;
import com.scholary.refinery.progress.ProgressReporter;
import com.scholary.refinery.source.TranscriptSource;
import com.scholary.refinery.stage.StageExecutor;
import com.scholary.refinery.stage.StageInput;
import com.scholary.refinery.stage.StageKind;
import com.scholary.refinery.stage.StageResult;
import com.scholary.refinery.store.ClusterStore;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a research cluster from submitted URLs to a linked research report.
 *
 * <p>Steps:
 *
 * <ol>
 *   <li>PROCESSING: fetch each video's transcript; an invalid URL or missing transcript skips that
 *       video only
 *   <li>TRANSCRIPTS_READY: optionally clean each transcript, keeping the original when cleaning
 *       fails
 *   <li>CLEANED_READY / TRANSCRIPTS_READY: synthesize one report over all transcripts, link its
 *       keywords and complete; a failed synthesis fails the cluster
 * </ol>
 *
 * <p>The cluster is written to the store after every mutation, so its status always names the
 * last finished step. Running a cluster again picks up at that step and skips videos already
 * fetched or cleaned. Store failures propagate and stop the run.
 */
@Service
public class ClusterPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final ClusterStore clusterStore;
  private final TranscriptSource transcriptSource;
  private final StageExecutor stageExecutor;
  private final KeywordLinker keywordLinker;
  private final ArtifactWriter artifactWriter;
  private final Clock clock;

  public ClusterPipeline(
      ClusterStore clusterStore,
      TranscriptSource transcriptSource,
      StageExecutor stageExecutor,
      KeywordLinker keywordLinker,
      ArtifactWriter artifactWriter,
      Clock clock) {
    this.clusterStore = clusterStore;
    this.transcriptSource = transcriptSource;
    this.stageExecutor = stageExecutor;
    this.keywordLinker = keywordLinker;
    this.artifactWriter = artifactWriter;
    this.clock = clock;
  }

  /**
   * Create and persist a new pending cluster.
   *
   * @param name cluster name
   * @param sourceRefs video URLs, in submission order
   * @param cleanRequested whether transcripts are cleaned before synthesis
   * @return the stored cluster
   */
  public ClusterState create(String name, List<String> sourceRefs, boolean cleanRequested) {
    ClusterState cluster = ClusterState.create(name, sourceRefs, cleanRequested, clock);
    clusterStore.put(cluster);
    LOGGER.info(
        "Created cluster: sessionId={}, name={}, sources={}, clean={}",
        cluster.getSessionId(),
        name,
        sourceRefs.size(),
        cleanRequested);
    return cluster;
  }

  /**
   * Run (or continue) the pipeline for a cluster.
   *
   * @param sessionId the cluster to run
   * @param progress receives progress events
   * @return the result of the completed cluster
   * @throws ClusterNotFoundException if the cluster does not exist or has expired
   * @throws IllegalStateException if the cluster failed in an earlier run
   * @throws PipelineException if synthesis fails in this run
   * @throws com.scholary.refinery.store.ClusterStoreException if state could not be persisted
   */
  public ClusterRunResult run(String sessionId, ProgressReporter progress) {
    ClusterState cluster =
        clusterStore.get(sessionId).orElseThrow(() -> new ClusterNotFoundException(sessionId));
    int total = cluster.getSourceRefs().size();

    if (cluster.getStatus() == ClusterStatus.COMPLETED) {
      LOGGER.info("Cluster {} already completed", sessionId);
      progress.report(new ProgressEvent(total, total, "Completed"));
      return toResult(cluster);
    }
    if (cluster.getStatus() == ClusterStatus.FAILED) {
      throw new IllegalStateException(
          "Cluster " + sessionId + " has failed and cannot be rerun: " + cluster.getError());
    }

    LOGGER.info(
        "Running cluster: sessionId={}, status={}, sources={}",
        sessionId,
        cluster.getStatus(),
        total);

    if (cluster.getStatus() == ClusterStatus.PENDING) {
      transition(cluster, ClusterStatus.PROCESSING);
    }

    if (cluster.getStatus() == ClusterStatus.PROCESSING) {
      fetchTranscripts(cluster, progress);
      transition(cluster, ClusterStatus.TRANSCRIPTS_READY);
    } else {
      progress.report(new ProgressEvent(total, total, "Transcripts already collected"));
    }

    if (cluster.isCleanRequested() && cluster.getStatus() == ClusterStatus.TRANSCRIPTS_READY) {
      progress.report(new ProgressEvent(total, total, "Cleaning transcripts..."));
      cleanTranscripts(cluster);
      transition(cluster, ClusterStatus.CLEANED_READY);
    }

    progress.report(new ProgressEvent(total, total, "Generating synthesis report..."));
    synthesize(cluster);
    progress.report(new ProgressEvent(total, total, "Completed"));

    return toResult(cluster);
  }

  private void fetchTranscripts(ClusterState cluster, ProgressReporter progress) {
    List<String> sourceRefs = cluster.getSourceRefs();
    int total = sourceRefs.size();

    for (int i = 0; i < total; i++) {
      String sourceRef = sourceRefs.get(i);
      Optional<String> documentId = resolve(sourceRef);

      if (documentId.isEmpty()) {
        structuredLogger.logSourceSkipped(sourceRef, "invalid video URL");
      } else if (cluster.getRawDocuments().containsKey(documentId.get())) {
        LOGGER.info("Transcript for {} already collected, skipping fetch", documentId.get());
      } else {
        Optional<String> transcript = fetch(documentId.get());
        if (transcript.isPresent()) {
          cluster.putRawDocument(documentId.get(), transcript.get(), clock);
          clusterStore.put(cluster);
          structuredLogger.logSourceFetched(sourceRef, documentId.get(), transcript.get().length());
        } else {
          structuredLogger.logSourceSkipped(sourceRef, "transcript unavailable");
        }
      }

      progress.report(
          new ProgressEvent(i + 1, total, String.format("Processing video %d/%d", i + 1, total)));
    }

    LOGGER.info(
        "Collected {}/{} transcripts for cluster {}",
        cluster.getRawDocuments().size(),
        total,
        cluster.getSessionId());
  }

  private void cleanTranscripts(ClusterState cluster) {
    for (String documentId : cluster.pendingEnrichment()) {
      String raw = cluster.getRawDocuments().get(documentId);
      StageResult result = stageExecutor.runStage(StageKind.CLEAN, StageInput.single(documentId, raw));

      String content;
      if (result instanceof StageResult.Ok ok) {
        content = ok.content();
      } else {
        LOGGER.warn(
            "Cleaning failed for {}, keeping original transcript: {}",
            documentId,
            ((StageResult.Failed) result).reason());
        content = raw;
      }

      cluster.putEnrichedDocument(documentId, content, clock);
      clusterStore.put(cluster);
    }
  }

  private void synthesize(ClusterState cluster) {
    Map<String, String> documents = cluster.effectiveDocuments();
    if (documents.isEmpty()) {
      failCluster(cluster, "No transcripts available for synthesis");
    }

    StageResult result =
        stageExecutor.runStage(StageKind.SYNTHESIZE, StageInput.of(cluster.getName(), documents));
    if (result instanceof StageResult.Failed failed) {
      failCluster(cluster, "Synthesis failed: " + failed.reason());
    }

    String report = ((StageResult.Ok) result).content();
    List<String> keywords = extractKeywords(report);
    String linked = keywordLinker.link(report, keywords);

    ClusterStatus from = cluster.getStatus();
    cluster.complete(linked, keywords, clock);
    clusterStore.put(cluster);
    structuredLogger.logStatusTransition(
        cluster.getSessionId(), from.wireName(), cluster.getStatus().wireName());

    try {
      artifactWriter.writeClusterReport(cluster);
    } catch (ObjectStoreException e) {
      // the report is already durable in the cluster record
      LOGGER.error("Failed to publish report for cluster {}", cluster.getSessionId(), e);
    }
  }

  private List<String> extractKeywords(String report) {
    StageResult result =
        stageExecutor.runStage(StageKind.EXTRACT_KEYWORDS, StageInput.single("report", report));
    if (result instanceof StageResult.Ok ok) {
      return keywordLinker.parseKeywords(ok.content());
    }
    LOGGER.warn(
        "Keyword extraction failed, report will not be linked: {}",
        ((StageResult.Failed) result).reason());
    return List.of();
  }

  private void failCluster(ClusterState cluster, String reason) {
    ClusterStatus from = cluster.getStatus();
    cluster.fail(reason, clock);
    clusterStore.put(cluster);
    structuredLogger.logStatusTransition(
        cluster.getSessionId(), from.wireName(), ClusterStatus.FAILED.wireName());
    throw new PipelineException(reason);
  }

  private void transition(ClusterState cluster, ClusterStatus next) {
    ClusterStatus from = cluster.getStatus();
    cluster.advanceTo(next, clock);
    clusterStore.put(cluster);
    structuredLogger.logStatusTransition(cluster.getSessionId(), from.wireName(), next.wireName());
  }

  private Optional<String> resolve(String sourceRef) {
    try {
      return transcriptSource.resolveDocumentId(sourceRef);
    } catch (RuntimeException e) {
      LOGGER.warn("Could not resolve {}: {}", sourceRef, e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<String> fetch(String documentId) {
    try {
      return transcriptSource.fetchDocument(documentId);
    } catch (RuntimeException e) {
      LOGGER.warn("Transcript fetch failed for {}: {}", documentId, e.getMessage());
      return Optional.empty();
    }
  }

  private ClusterRunResult toResult(ClusterState cluster) {
    int processed = 0;
    for (String sourceRef : cluster.getSourceRefs()) {
      Optional<String> documentId = resolve(sourceRef);
      if (documentId.isPresent() && cluster.getRawDocuments().containsKey(documentId.get())) {
        processed++;
      }
    }
    return new ClusterRunResult(
        cluster.getSessionId(),
        cluster.getStatus(),
        processed,
        cluster.getSourceRefs().size(),
        cluster.getKeywords(),
        cluster.getSynthesis());
  }
}
