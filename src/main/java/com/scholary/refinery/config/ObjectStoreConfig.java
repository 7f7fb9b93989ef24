package com.scholary.refinery.config;

import com.scholary.refinery.objectstore.ObjectStoreClient;
import com.scholary.refinery.objectstore.ObjectStoreProperties;
import com.scholary.refinery.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the artifact object store.
 *
 * <p>Wires up the ObjectStoreClient bean from the "objectstore.*" properties. The bucket is created
 * on first write if it does not exist.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
