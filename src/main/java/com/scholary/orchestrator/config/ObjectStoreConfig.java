package com.scholary.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.objectstore.ObjectStoreClient;
import com.scholary.orchestrator.objectstore.ObjectStoreProperties;
import com.scholary.orchestrator.objectstore.S3ObjectStoreClient;
import com.scholary.orchestrator.store.ObjectStoreResultStoreFactory;
import com.scholary.orchestrator.store.ResultStoreFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for keeping batch results in object storage.
 *
 * <p>Only active with {@code orchestrator.results.backend=object-store}. The bucket is created at
 * startup if it is missing.
 */
@Configuration
@ConditionalOnProperty(
    prefix = "orchestrator.results",
    name = "backend",
    havingValue = "object-store")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public ResultStoreFactory objectStoreResultStoreFactory(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      ObjectMapper objectMapper) {
    objectStoreClient.ensureBucket(properties.bucket());
    return new ObjectStoreResultStoreFactory(
        objectStoreClient, properties.bucket(), properties.prefix(), objectMapper);
  }
}
