package com.scholary.refinery.cluster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable state of one research cluster (a group of videos synthesized into one report).
 *
 * <p>Every mutator advances {@code updatedAt}. Callers persist the state through {@link
 * com.scholary.refinery.store.ClusterStore} after each mutation; instances read from the store are
 * private copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterState {

  private final String sessionId;
  private final String name;
  private final List<String> sourceRefs;
  private final boolean cleanRequested;
  private final Instant createdAt;

  private ClusterStatus status;
  private final Map<String, String> rawDocuments;
  private final Map<String, String> enrichedDocuments;
  private String synthesis;
  private List<String> keywords;
  private String error;
  private Instant updatedAt;

  @JsonCreator
  public ClusterState(
      @JsonProperty("sessionId") String sessionId,
      @JsonProperty("name") String name,
      @JsonProperty("sourceRefs") List<String> sourceRefs,
      @JsonProperty("cleanRequested") boolean cleanRequested,
      @JsonProperty("status") ClusterStatus status,
      @JsonProperty("rawDocuments") Map<String, String> rawDocuments,
      @JsonProperty("enrichedDocuments") Map<String, String> enrichedDocuments,
      @JsonProperty("synthesis") String synthesis,
      @JsonProperty("keywords") List<String> keywords,
      @JsonProperty("error") String error,
      @JsonProperty("createdAt") Instant createdAt,
      @JsonProperty("updatedAt") Instant updatedAt) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.name = Objects.requireNonNull(name, "name");
    this.sourceRefs = List.copyOf(sourceRefs);
    this.cleanRequested = cleanRequested;
    this.status = status == null ? ClusterStatus.PENDING : status;
    this.rawDocuments = rawDocuments == null ? new LinkedHashMap<>() : new LinkedHashMap<>(rawDocuments);
    this.enrichedDocuments =
        enrichedDocuments == null ? new LinkedHashMap<>() : new LinkedHashMap<>(enrichedDocuments);
    this.synthesis = synthesis;
    this.keywords = keywords == null ? null : List.copyOf(keywords);
    this.error = error;
    this.createdAt = createdAt;
    this.updatedAt = updatedAt == null ? createdAt : updatedAt;
  }

  /** Create a fresh pending cluster with a new session id. */
  public static ClusterState create(
      String name, List<String> sourceRefs, boolean cleanRequested, Clock clock) {
    Instant now = clock.instant();
    return new ClusterState(
        UUID.randomUUID().toString(),
        name,
        sourceRefs,
        cleanRequested,
        ClusterStatus.PENDING,
        null,
        null,
        null,
        null,
        null,
        now,
        now);
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getName() {
    return name;
  }

  public List<String> getSourceRefs() {
    return sourceRefs;
  }

  public boolean isCleanRequested() {
    return cleanRequested;
  }

  public ClusterStatus getStatus() {
    return status;
  }

  public Map<String, String> getRawDocuments() {
    return Collections.unmodifiableMap(rawDocuments);
  }

  public Map<String, String> getEnrichedDocuments() {
    return Collections.unmodifiableMap(enrichedDocuments);
  }

  public String getSynthesis() {
    return synthesis;
  }

  public List<String> getKeywords() {
    return keywords;
  }

  public String getError() {
    return error;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /**
   * Move to the next status.
   *
   * @throws IllegalStateException if the move would regress or leave a terminal status
   */
  public void advanceTo(ClusterStatus next, Clock clock) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Illegal cluster transition %s -> %s for %s", status, next, sessionId));
    }
    if (next == ClusterStatus.COMPLETED && synthesis == null) {
      throw new IllegalStateException("Cluster " + sessionId + " cannot complete without a report");
    }
    this.status = next;
    touch(clock);
  }

  public void putRawDocument(String documentId, String content, Clock clock) {
    rawDocuments.put(documentId, content);
    touch(clock);
  }

  /**
   * Store the enriched version of a document.
   *
   * @throws IllegalArgumentException if the document has no raw counterpart
   */
  public void putEnrichedDocument(String documentId, String content, Clock clock) {
    if (!rawDocuments.containsKey(documentId)) {
      throw new IllegalArgumentException(
          "No raw transcript for " + documentId + " in cluster " + sessionId);
    }
    enrichedDocuments.put(documentId, content);
    touch(clock);
  }

  /**
   * Record the final report and complete the cluster.
   *
   * @throws IllegalStateException if a report was already recorded
   */
  public void complete(String report, List<String> linkedKeywords, Clock clock) {
    if (synthesis != null) {
      throw new IllegalStateException("Report already recorded for cluster " + sessionId);
    }
    if (!status.canTransitionTo(ClusterStatus.COMPLETED)) {
      throw new IllegalStateException(
          String.format("Illegal cluster transition %s -> COMPLETED for %s", status, sessionId));
    }
    this.synthesis = Objects.requireNonNull(report, "report");
    this.keywords = List.copyOf(linkedKeywords);
    advanceTo(ClusterStatus.COMPLETED, clock);
  }

  public void fail(String reason, Clock clock) {
    advanceTo(ClusterStatus.FAILED, clock);
    this.error = reason;
  }

  /** Documents the synthesis runs over: the enriched set when there is one. */
  public Map<String, String> effectiveDocuments() {
    return enrichedDocuments.isEmpty() ? getRawDocuments() : getEnrichedDocuments();
  }

  /**
   * Number of distinct transcripts collected so far. Duplicate source URLs share one transcript,
   * unlike the per-source count of a run result.
   */
  public int transcriptCount() {
    return rawDocuments.size();
  }

  /** Raw documents that have no enriched version yet, in collection order. */
  public List<String> pendingEnrichment() {
    List<String> pending = new ArrayList<>();
    for (String documentId : rawDocuments.keySet()) {
      if (!enrichedDocuments.containsKey(documentId)) {
        pending.add(documentId);
      }
    }
    return pending;
  }

  private void touch(Clock clock) {
    Instant now = clock.instant();
    // keep updatedAt strictly advancing even on coarse clocks
    this.updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plusNanos(1000);
  }
}
