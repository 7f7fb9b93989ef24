package com.scholary.refinery.source;

import java.util.Optional;

/**
 * Where transcripts come from.
 *
 * <p>Resolution and retrieval are separate so a pipeline can recognise a source it already holds
 * without fetching it again.
 */
public interface TranscriptSource {

  /**
   * Derive the document id for a source reference.
   *
   * @param sourceRef a video URL
   * @return the video id, or empty if the reference is not a recognised video URL
   */
  Optional<String> resolveDocumentId(String sourceRef);

  /**
   * Fetch the transcript of a video.
   *
   * @param documentId the video id
   * @return the transcript text, or empty if it is unavailable (no captions, timeout, backend down)
   */
  Optional<String> fetchDocument(String documentId);
}
