package com.scholary.refinery.pipeline;

import com.scholary.refinery.artifact.ArtifactWriter;
import com.scholary.refinery.logging.StructuredLogger;
import com.scholary.refinery.progress.ProgressEvent;
import com.scholary.refinery.progress.ProgressReporter;
import com.scholary.refinery.source.TranscriptNormalizer;
import com.scholary.refinery.source.TranscriptSource;
import com.scholary.refinery.stage.StageExecutor;
import com.scholary.refinery.stage.StageInput;
import com.scholary.refinery.stage.StageKind;
import com.scholary.refinery.stage.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-video run: fetch the transcript, optionally clean it, summarize it and publish both as
 * artifacts.
 *
 * <p>Unlike a cluster run nothing is kept in the cluster store; the artifacts are the only output.
 */
@Service
public class DocumentPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private static final int STEPS = 2;

  private final TranscriptSource transcriptSource;
  private final TranscriptNormalizer normalizer;
  private final StageExecutor stageExecutor;
  private final ArtifactWriter artifactWriter;

  public DocumentPipeline(
      TranscriptSource transcriptSource,
      TranscriptNormalizer normalizer,
      StageExecutor stageExecutor,
      ArtifactWriter artifactWriter) {
    this.transcriptSource = transcriptSource;
    this.normalizer = normalizer;
    this.stageExecutor = stageExecutor;
    this.artifactWriter = artifactWriter;
  }

  /**
   * Process one video.
   *
   * @param sourceRef the video URL
   * @param cleanRequested whether to strip cues, fillers and boilerplate before summarizing
   * @param progress receives progress events
   * @return transcript, summary and statistics
   * @throws PipelineException if the URL is invalid, the transcript is unavailable or the summary
   *     could not be generated
   */
  public DocumentRunResult run(String sourceRef, boolean cleanRequested, ProgressReporter progress) {
    progress.report(new ProgressEvent(0, STEPS, "Fetching transcript..."));

    String documentId =
        transcriptSource
            .resolveDocumentId(sourceRef)
            .orElseThrow(() -> new PipelineException("Invalid YouTube URL"));
    String transcript =
        transcriptSource
            .fetchDocument(documentId)
            .orElseThrow(() -> new PipelineException("Transcript not available for this video"));
    structuredLogger.logSourceFetched(sourceRef, documentId, transcript.length());

    if (cleanRequested) {
      transcript = normalizer.normalize(transcript);
      LOGGER.debug("Normalized transcript for {} to {} chars", documentId, transcript.length());
    }

    progress.report(new ProgressEvent(1, STEPS, "Generating summary..."));
    StageResult result =
        stageExecutor.runStage(StageKind.SUMMARIZE, StageInput.single(documentId, transcript));
    if (result instanceof StageResult.Failed failed) {
      throw new PipelineException("Summary generation failed: " + failed.reason());
    }
    StageResult.Ok summary = (StageResult.Ok) result;

    DocumentRunResult runResult =
        new DocumentRunResult(
            documentId,
            transcript,
            summary.content(),
            countWords(transcript),
            transcript.length(),
            cleanRequested,
            summary.model());

    artifactWriter.writeDocumentArtifacts(runResult);
    progress.report(new ProgressEvent(STEPS, STEPS, "Completed"));

    LOGGER.info(
        "Processed video {}: words={}, cleaned={}",
        documentId,
        runResult.wordCount(),
        cleanRequested);
    return runResult;
  }

  private int countWords(String text) {
    String trimmed = text.trim();
    return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
  }
}
