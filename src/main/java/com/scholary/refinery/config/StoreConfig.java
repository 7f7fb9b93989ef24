package com.scholary.refinery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.refinery.store.ClusterStateCodec;
import com.scholary.refinery.store.ClusterStore;
import com.scholary.refinery.store.InMemoryClusterStore;
import com.scholary.refinery.store.RedisClusterStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the cluster store backend.
 *
 * <p>{@code refinery.store=redis} (the default) keeps clusters in Redis so they survive restarts
 * and are shared between instances; {@code memory} keeps them in this process only.
 */
@Configuration
public class StoreConfig {

  @Bean
  public ClusterStateCodec clusterStateCodec(ObjectMapper objectMapper) {
    return new ClusterStateCodec(objectMapper);
  }

  @Bean
  @ConditionalOnProperty(name = "refinery.store", havingValue = "redis", matchIfMissing = true)
  public ClusterStore redisClusterStore(
      StringRedisTemplate redisTemplate, ClusterStateCodec codec, RefineryProperties properties) {
    return new RedisClusterStore(redisTemplate, codec, properties.clusterRetention());
  }

  @Bean
  @ConditionalOnProperty(name = "refinery.store", havingValue = "memory")
  public ClusterStore inMemoryClusterStore(
      ClusterStateCodec codec, RefineryProperties properties) {
    return new InMemoryClusterStore(
        codec, properties.clusterRetention(), properties.clusterMaxSize());
  }
}
