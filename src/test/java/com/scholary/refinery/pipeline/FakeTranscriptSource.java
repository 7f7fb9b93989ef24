package com.scholary.refinery.pipeline;

import com.scholary.refinery.source.TranscriptSource;
import com.scholary.refinery.source.VideoIdExtractor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Transcript source serving canned transcripts by video id. */
class FakeTranscriptSource implements TranscriptSource {

  private final Map<String, String> transcripts = new HashMap<>();
  private final Set<String> broken = new HashSet<>();
  final List<String> fetched = new ArrayList<>();

  FakeTranscriptSource with(String videoId, String transcript) {
    transcripts.put(videoId, transcript);
    return this;
  }

  /** Fetching this id throws instead of returning empty. */
  FakeTranscriptSource broken(String videoId) {
    broken.add(videoId);
    return this;
  }

  @Override
  public Optional<String> resolveDocumentId(String sourceRef) {
    return VideoIdExtractor.extract(sourceRef);
  }

  @Override
  public Optional<String> fetchDocument(String documentId) {
    fetched.add(documentId);
    if (broken.contains(documentId)) {
      throw new IllegalStateException("connection reset");
    }
    return Optional.ofNullable(transcripts.get(documentId));
  }
}
