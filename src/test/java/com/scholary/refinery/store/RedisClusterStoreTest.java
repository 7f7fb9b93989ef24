package com.scholary.refinery.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.refinery.cluster.ClusterState;
import com.scholary.refinery.cluster.ClusterStatus;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Runs the Redis store against a real Redis; skipped when Docker is not available. */
@Testcontainers(disabledWithoutDocker = true)
class RedisClusterStoreTest {

  @Container
  static GenericContainer<?> redisContainer =
      new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;
  private static StringRedisTemplate redisTemplate;

  private final Clock clock = Clock.systemUTC();

  @BeforeAll
  static void connect() {
    connectionFactory =
        new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(
                redisContainer.getHost(), redisContainer.getMappedPort(6379)));
    connectionFactory.afterPropertiesSet();
    redisTemplate = new StringRedisTemplate(connectionFactory);
  }

  @AfterAll
  static void disconnect() {
    connectionFactory.destroy();
  }

  private RedisClusterStore store(Duration retention) {
    return new RedisClusterStore(
        redisTemplate, new ClusterStateCodec(new ObjectMapper()), retention);
  }

  @Test
  void put_shouldWriteJsonUnderSessionKeyWithExpiry() {
    RedisClusterStore store = store(Duration.ofDays(7));
    ClusterState cluster =
        ClusterState.create("Topic A", List.of("https://youtu.be/aaa"), false, clock);

    store.put(cluster);

    String key = "cluster:" + cluster.getSessionId();
    assertThat(redisTemplate.opsForValue().get(key)).contains("\"status\":\"pending\"");
    assertThat(redisTemplate.getExpire(key)).isGreaterThan(Duration.ofDays(6).toSeconds());
  }

  @Test
  void get_shouldReadBackLatestWrite() {
    RedisClusterStore store = store(Duration.ofDays(7));
    ClusterState cluster =
        ClusterState.create("Topic A", List.of("https://youtu.be/aaa"), false, clock);
    store.put(cluster);
    cluster.advanceTo(ClusterStatus.PROCESSING, clock);
    cluster.putRawDocument("aaa", "transcript", clock);
    store.put(cluster);

    ClusterState loaded = store.get(cluster.getSessionId()).orElseThrow();

    assertThat(loaded.getStatus()).isEqualTo(ClusterStatus.PROCESSING);
    assertThat(loaded.getRawDocuments()).containsEntry("aaa", "transcript");
  }

  @Test
  void listAll_shouldIncludeStoredClusters() {
    RedisClusterStore store = store(Duration.ofDays(7));
    ClusterState cluster =
        ClusterState.create("Listed", List.of("https://youtu.be/ccc"), false, clock);
    store.put(cluster);

    assertThat(store.listAll())
        .extracting(ClusterState::getSessionId)
        .contains(cluster.getSessionId());
  }

  @Test
  void get_shouldReturnEmptyAfterExpiry() throws InterruptedException {
    RedisClusterStore store = store(Duration.ofSeconds(1));
    ClusterState cluster =
        ClusterState.create("Short-lived", List.of("https://youtu.be/ddd"), false, clock);
    store.put(cluster);

    Thread.sleep(2100);

    assertThat(store.get(cluster.getSessionId())).isEmpty();
  }
}
