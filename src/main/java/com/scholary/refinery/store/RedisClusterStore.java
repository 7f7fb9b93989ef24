package com.scholary.refinery.store;

import com.scholary.refinery.cluster.ClusterState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed cluster store.
 *
 * <p>One string key per session ({@code cluster:<sessionId>}) holding the JSON state, written with
 * a single {@code SET ... EX} so the value and its refreshed expiry land together.
 */
public class RedisClusterStore implements ClusterStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RedisClusterStore.class);

  static final String KEY_PREFIX = "cluster:";

  private final StringRedisTemplate redisTemplate;
  private final ClusterStateCodec codec;
  private final Duration retention;

  public RedisClusterStore(
      StringRedisTemplate redisTemplate, ClusterStateCodec codec, Duration retention) {
    this.redisTemplate = redisTemplate;
    this.codec = codec;
    this.retention = retention;
    LOGGER.info("Initialized Redis cluster store: retention={}", retention);
  }

  @Override
  public void put(ClusterState state) {
    String key = KEY_PREFIX + state.getSessionId();
    String json = codec.encode(state);
    try {
      redisTemplate.opsForValue().set(key, json, retention);
      LOGGER.debug("Stored cluster: key={}, status={}", key, state.getStatus());
    } catch (RuntimeException e) {
      String message = String.format("Failed to store cluster: key=%s", key);
      LOGGER.error(message, e);
      throw new ClusterStoreException(message, e);
    }
  }

  @Override
  public Optional<ClusterState> get(String sessionId) {
    String key = KEY_PREFIX + sessionId;
    String json;
    try {
      json = redisTemplate.opsForValue().get(key);
    } catch (RuntimeException e) {
      String message = String.format("Failed to load cluster: key=%s", key);
      LOGGER.error(message, e);
      throw new ClusterStoreException(message, e);
    }
    return Optional.ofNullable(json).map(codec::decode);
  }

  @Override
  public List<ClusterState> listAll() {
    List<String> keys = new ArrayList<>();
    ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + "*").count(100).build();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      cursor.forEachRemaining(keys::add);
    } catch (RuntimeException e) {
      String message = "Failed to scan clusters";
      LOGGER.error(message, e);
      throw new ClusterStoreException(message, e);
    }

    List<ClusterState> clusters = new ArrayList<>();
    for (String key : keys) {
      String json;
      try {
        json = redisTemplate.opsForValue().get(key);
      } catch (RuntimeException e) {
        String message = String.format("Failed to load cluster: key=%s", key);
        LOGGER.error(message, e);
        throw new ClusterStoreException(message, e);
      }
      if (json == null) {
        // expired between scan and read
        continue;
      }
      try {
        clusters.add(codec.decode(json));
      } catch (ClusterStoreException e) {
        LOGGER.warn("Skipping unreadable cluster: key={}", key, e);
      }
    }
    clusters.sort(Comparator.comparing(ClusterState::getCreatedAt).reversed());
    LOGGER.debug("Listed {} clusters from {} keys", clusters.size(), keys.size());
    return clusters;
  }
}
