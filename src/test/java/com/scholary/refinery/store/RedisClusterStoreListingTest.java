package com.scholary.refinery.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.refinery.cluster.ClusterState;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

/** Listing behaviour of the Redis store against a mocked template. */
@ExtendWith(MockitoExtension.class)
class RedisClusterStoreListingTest {

  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ValueOperations<String, String> valueOperations;
  @Mock private Cursor<String> cursor;

  private final ClusterStateCodec codec = new ClusterStateCodec(new ObjectMapper());
  private final Clock clock = Clock.systemUTC();

  private RedisClusterStore store;

  @BeforeEach
  void setUp() {
    store = new RedisClusterStore(redisTemplate, codec, Duration.ofDays(7));
    when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
    when(redisTemplate.opsForValue()).thenReturn(valueOperations);
  }

  private void scanReturns(String... keys) {
    doAnswer(
            invocation -> {
              Consumer<String> action = invocation.getArgument(0);
              for (String key : keys) {
                action.accept(key);
              }
              return null;
            })
        .when(cursor)
        .forEachRemaining(any());
  }

  @Test
  void listAll_shouldWrapReadFailures() {
    scanReturns("cluster:a", "cluster:b");
    when(valueOperations.get("cluster:a"))
        .thenThrow(new RedisConnectionFailureException("down"));

    assertThatThrownBy(() -> store.listAll())
        .isInstanceOf(ClusterStoreException.class)
        .hasMessageContaining("cluster:a")
        .hasCauseInstanceOf(RedisConnectionFailureException.class);
  }

  @Test
  void listAll_shouldSkipUnreadableAndExpiredRecords() {
    ClusterState valid =
        ClusterState.create("Topic B", List.of("https://youtu.be/bbb"), false, clock);
    scanReturns("cluster:a", "cluster:b", "cluster:gone");
    when(valueOperations.get("cluster:a")).thenReturn("{not json");
    when(valueOperations.get("cluster:b")).thenReturn(codec.encode(valid));
    when(valueOperations.get("cluster:gone")).thenReturn(null);

    List<ClusterState> clusters = store.listAll();

    assertThat(clusters).extracting(ClusterState::getSessionId).containsExactly(valid.getSessionId());
  }
}
