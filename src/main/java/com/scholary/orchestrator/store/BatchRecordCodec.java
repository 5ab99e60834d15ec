package com.scholary.orchestrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

/** JSON encoding of batch records for one pipeline's payload types. */
public class BatchRecordCodec<P, R> {

  private final ObjectMapper objectMapper;
  private final JavaType recordType;

  public BatchRecordCodec(ObjectMapper objectMapper, Class<P> payloadType, Class<R> resultType) {
    this.objectMapper = objectMapper;
    this.recordType =
        objectMapper
            .getTypeFactory()
            .constructParametricType(BatchRecord.class, payloadType, resultType);
  }

  public byte[] encode(BatchRecord<P, R> record) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new ResultSaveException("Failed to encode batch record: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Decode a record.
   *
   * @throws ResultDecodeException if the bytes are not a valid record
   */
  public BatchRecord<P, R> decode(String recordId, byte[] bytes) {
    try {
      BatchRecord<P, R> record = objectMapper.readValue(bytes, recordType);
      if (record == null) {
        throw new ResultDecodeException("Batch record " + recordId + " is empty", null);
      }
      if (record.results().stream().anyMatch(outcome -> outcome == null || outcome.input() == null)) {
        throw new ResultDecodeException(
            "Batch record " + recordId + " has results without task input", null);
      }
      return record;
    } catch (IOException e) {
      throw new ResultDecodeException(
          "Failed to decode batch record " + recordId + ": " + e.getMessage(), e);
    }
  }
}
