package com.scholary.refinery.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.refinery.cluster.ClusterState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-node cluster store backed by Caffeine.
 *
 * <p>Values are held as encoded JSON rather than live objects: a write is one atomic cache put and
 * every read decodes a private copy, which matches what the Redis store gives callers.
 */
public class InMemoryClusterStore implements ClusterStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryClusterStore.class);

  private final Cache<String, String> cache;
  private final ClusterStateCodec codec;

  public InMemoryClusterStore(ClusterStateCodec codec, Duration retention, long maxSize) {
    this.codec = codec;
    this.cache =
        Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(retention).build();
    LOGGER.info("Initialized in-memory cluster store: retention={}, maxSize={}", retention, maxSize);
  }

  @Override
  public void put(ClusterState state) {
    cache.put(state.getSessionId(), codec.encode(state));
    LOGGER.debug(
        "Stored cluster: sessionId={}, status={}", state.getSessionId(), state.getStatus());
  }

  @Override
  public Optional<ClusterState> get(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId)).map(codec::decode);
  }

  @Override
  public List<ClusterState> listAll() {
    List<ClusterState> clusters = new ArrayList<>();
    for (String json : cache.asMap().values()) {
      clusters.add(codec.decode(json));
    }
    clusters.sort(Comparator.comparing(ClusterState::getCreatedAt).reversed());
    return clusters;
  }
}
