package com.scholary.orchestrator.store;

import com.scholary.orchestrator.task.TaskOutcome;
import java.util.List;
import java.util.Optional;

/**
 * Append-only history of completed runs for one pipeline.
 *
 * <p>Every save creates a new record; existing records are never overwritten. Record ids sort
 * lexicographically in save order, so the greatest id is the latest run.
 */
public interface ResultStore<P, R> {

  /**
   * Persist a run.
   *
   * @return the new record's id
   * @throws ResultSaveException if the record could not be written
   */
  String save(List<TaskOutcome<P, R>> outcomes);

  /**
   * Load the most recent record.
   *
   * @throws ResultDecodeException if the latest record is unreadable
   */
  Optional<StoredBatch<P, R>> loadLatest();

  /** The most recent record, reduced to its failed outcomes. */
  default Optional<StoredBatch<P, R>> loadFailedFromLatest() {
    return loadLatest().map(StoredBatch::failedOnly);
  }

  /**
   * Load one record.
   *
   * @throws RecordNotFoundException if no record has that id
   * @throws ResultDecodeException if the record exists but cannot be decoded
   */
  StoredBatch<P, R> load(String recordId);

  /** Ids of all records, newest first. */
  List<String> listRecordIds();
}
