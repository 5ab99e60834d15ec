package com.scholary.orchestrator.store;

import com.scholary.orchestrator.task.TaskOutcome;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Result store keeping one JSON file per run in a directory.
 *
 * <p>Files are created with {@link StandardOpenOption#CREATE_NEW}, so two saves can never write to
 * the same file even when they race within the same second.
 */
public class FileSystemResultStore<P, R> implements ResultStore<P, R> {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemResultStore.class);

  private final Path directory;
  private final BatchRecordCodec<P, R> codec;
  private final Clock clock;

  public FileSystemResultStore(Path directory, BatchRecordCodec<P, R> codec) {
    this(directory, codec, Clock.systemUTC());
  }

  public FileSystemResultStore(Path directory, BatchRecordCodec<P, R> codec, Clock clock) {
    this.directory = directory;
    this.codec = codec;
    this.clock = clock;
  }

  @Override
  public String save(List<TaskOutcome<P, R>> outcomes) {
    String timestamp = RecordIds.timestamp(clock);
    byte[] bytes = codec.encode(BatchRecord.of(timestamp, outcomes));

    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new ResultSaveException("Failed to create results directory " + directory, e);
    }

    for (int collision = 0; collision <= RecordIds.MAX_COLLISIONS; collision++) {
      String recordId = RecordIds.candidate(timestamp, collision);
      Path file = directory.resolve(recordId + RecordIds.EXTENSION);
      try {
        Files.write(file, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        LOGGER.info("Saved batch record: file={}, outcomes={}", file, outcomes.size());
        return recordId;
      } catch (FileAlreadyExistsException e) {
        LOGGER.debug("Record {} already exists, trying next suffix", recordId);
      } catch (IOException e) {
        throw new ResultSaveException("Failed to write batch record " + file, e);
      }
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
    Path file = directory.resolve(recordId + RecordIds.EXTENSION);
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      throw new RecordNotFoundException("Batch record not found: " + recordId, e);
    } catch (IOException e) {
      throw new ResultStoreException("Failed to read batch record " + file, e);
    }
    BatchRecord<P, R> record = codec.decode(recordId, bytes);
    LOGGER.debug("Loaded batch record: id={}, outcomes={}", recordId, record.results().size());
    return new StoredBatch<>(recordId, record.timestamp(), record.results());
  }

  @Override
  public List<String> listRecordIds() {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .map(file -> file.getFileName().toString())
          .filter(RecordIds::isRecordFile)
          .map(RecordIds::stripExtension)
          .sorted(Comparator.reverseOrder())
          .toList();
    } catch (IOException e) {
      throw new ResultStoreException("Failed to list batch records in " + directory, e);
    }
  }

  public Path directory() {
    return directory;
  }
}
