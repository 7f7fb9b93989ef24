package com.scholary.refinery.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scholary.refinery.cluster.ClusterState;

/**
 * JSON encoding of cluster state as stored in the backing store.
 *
 * <p>Timestamps are written as ISO-8601 strings so records stay readable with plain Redis tooling.
 */
public class ClusterStateCodec {

  private final ObjectMapper objectMapper;

  public ClusterStateCodec(ObjectMapper objectMapper) {
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(ClusterState state) {
    try {
      return objectMapper.writeValueAsString(state);
    } catch (JsonProcessingException e) {
      throw new ClusterStoreException(
          "Failed to encode cluster " + state.getSessionId(), e);
    }
  }

  public ClusterState decode(String json) {
    try {
      return objectMapper.readValue(json, ClusterState.class);
    } catch (JsonProcessingException e) {
      throw new ClusterStoreException("Failed to decode stored cluster state", e);
    }
  }
}
