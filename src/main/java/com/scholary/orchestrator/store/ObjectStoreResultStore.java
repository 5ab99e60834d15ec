package com.scholary.orchestrator.store;

import com.scholary.orchestrator.objectstore.ObjectNotFoundException;
import com.scholary.orchestrator.objectstore.ObjectStoreClient;
import com.scholary.orchestrator.objectstore.ObjectStoreException;
import com.scholary.orchestrator.task.TaskOutcome;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result store keeping one JSON object per run under {@code <prefix>/<pipeline>/} in a bucket.
 *
 * <p>Object storage has no create-if-absent write, so saves from this instance are serialized and
 * check for an existing key before writing.
 */
public class ObjectStoreResultStore<P, R> implements ResultStore<P, R> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreResultStore.class);
  private static final String CONTENT_TYPE = "application/json";

  private final ObjectStoreClient client;
  private final String bucket;
  private final String keyPrefix;
  private final BatchRecordCodec<P, R> codec;
  private final Clock clock;

  public ObjectStoreResultStore(
      ObjectStoreClient client, String bucket, String keyPrefix, BatchRecordCodec<P, R> codec) {
    this(client, bucket, keyPrefix, codec, Clock.systemUTC());
  }

  public ObjectStoreResultStore(
      ObjectStoreClient client,
      String bucket,
      String keyPrefix,
      BatchRecordCodec<P, R> codec,
      Clock clock) {
    this.client = client;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix.endsWith("/") ? keyPrefix : keyPrefix + "/";
    this.codec = codec;
    this.clock = clock;
  }

  @Override
  public synchronized String save(List<TaskOutcome<P, R>> outcomes) {
    String timestamp = RecordIds.timestamp(clock);
    byte[] bytes = codec.encode(BatchRecord.of(timestamp, outcomes));

    try {
      for (int collision = 0; collision <= RecordIds.MAX_COLLISIONS; collision++) {
        String recordId = RecordIds.candidate(timestamp, collision);
        String key = keyFor(recordId);
        if (client.objectExists(bucket, key)) {
          continue;
        }
        client.putObject(bucket, key, bytes, CONTENT_TYPE);
        LOGGER.info(
            "Saved batch record: bucket={}, key={}, outcomes={}", bucket, key, outcomes.size());
        return recordId;
      }
    } catch (ObjectStoreException e) {
      throw new ResultSaveException("Failed to save batch record: " + e.getMessage(), e);
    }
    throw new ResultSaveException("Too many batch records saved at " + timestamp);
  }

  @Override
  public Optional<StoredBatch<P, R>> loadLatest() {
    List<String> ids = listRecordIds();
    if (ids.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(load(ids.get(0)));
  }

  @Override
  public StoredBatch<P, R> load(String recordId) {
    if (!RecordIds.isValid(recordId)) {
      throw new RecordNotFoundException("Batch record not found: " + recordId);
    }
    byte[] bytes;
    try {
      bytes = client.getObject(bucket, keyFor(recordId));
    } catch (ObjectNotFoundException e) {
      throw new RecordNotFoundException("Batch record not found: " + recordId, e);
    } catch (ObjectStoreException e) {
      throw new ResultStoreException("Failed to read batch record " + recordId, e);
    }
    BatchRecord<P, R> record = codec.decode(recordId, bytes);
    return new StoredBatch<>(recordId, record.timestamp(), record.results());
  }

  @Override
  public List<String> listRecordIds() {
    try {
      return client.listKeys(bucket, keyPrefix).stream()
          .map(key -> key.substring(keyPrefix.length()))
          .filter(RecordIds::isRecordFile)
          .map(RecordIds::stripExtension)
          .sorted(Comparator.reverseOrder())
          .toList();
    } catch (ObjectStoreException e) {
      throw new ResultStoreException("Failed to list batch records: " + e.getMessage(), e);
    }
  }

  private String keyFor(String recordId) {
    return keyPrefix + recordId + RecordIds.EXTENSION;
  }
}
