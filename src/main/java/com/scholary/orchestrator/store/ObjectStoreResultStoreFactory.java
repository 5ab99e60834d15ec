package com.scholary.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.objectstore.ObjectStoreClient;

/**
 * Stores each pipeline's records under {@code <prefix>/<pipeline>/} in one bucket, or directly
 * under {@code <pipeline>/} when the prefix is empty.
 */
public class ObjectStoreResultStoreFactory implements ResultStoreFactory {

  private final ObjectStoreClient client;
  private final String bucket;
  private final String prefix;
  private final ObjectMapper objectMapper;

  public ObjectStoreResultStoreFactory(
      ObjectStoreClient client, String bucket, String prefix, ObjectMapper objectMapper) {
    this.client = client;
    this.bucket = bucket;
    this.prefix = prefix;
    this.objectMapper = objectMapper;
  }

  @Override
  public <P, R> ResultStore<P, R> create(
      String pipeline, Class<P> payloadType, Class<R> resultType) {
    return new ObjectStoreResultStore<>(
        client,
        bucket,
        keyPrefixFor(pipeline),
        new BatchRecordCodec<>(objectMapper, payloadType, resultType));
  }

  String keyPrefixFor(String pipeline) {
    return prefix == null || prefix.isBlank() ? pipeline + "/" : prefix + "/" + pipeline + "/";
  }
}
