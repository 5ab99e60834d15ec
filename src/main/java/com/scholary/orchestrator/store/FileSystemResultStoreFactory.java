package com.scholary.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;

/** Stores each pipeline's records in its own subdirectory of the results directory. */
public class FileSystemResultStoreFactory implements ResultStoreFactory {

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileSystemResultStoreFactory(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public <P, R> ResultStore<P, R> create(
      String pipeline, Class<P> payloadType, Class<R> resultType) {
    return new FileSystemResultStore<>(
        directory.resolve(pipeline), new BatchRecordCodec<>(objectMapper, payloadType, resultType));
  }
}
