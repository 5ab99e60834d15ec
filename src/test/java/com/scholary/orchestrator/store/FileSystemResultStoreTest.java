package com.scholary.orchestrator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.concurrent.MutableClock;
import com.scholary.orchestrator.task.TaskInput;
import com.scholary.orchestrator.task.TaskOutcome;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemResultStoreTest {

  @TempDir Path tempDir;

  private MutableClock clock;
  private FileSystemResultStore<String, String> store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-10-19T12:00:00Z"));
    store =
        new FileSystemResultStore<>(
            tempDir.resolve("prompt"),
            new BatchRecordCodec<>(new ObjectMapper(), String.class, String.class),
            clock);
  }

  private static List<TaskOutcome<String, String>> outcomes() {
    return List.of(
        TaskOutcome.succeeded(new TaskInput<>("a", "high", "payload-a"), "reply-a", 0),
        TaskOutcome.failed(new TaskInput<>("b", "low", "payload-b"), "Call failed", 2),
        TaskOutcome.succeeded(new TaskInput<>("c", null, "payload-c"), null, 1));
  }

  @Test
  void saveThenLoadLatest_shouldReturnSameOutcomes() {
    String recordId = store.save(outcomes());

    StoredBatch<String, String> latest = store.loadLatest().orElseThrow();

    assertThat(recordId).isEqualTo("run_20261019_120000");
    assertThat(latest.recordId()).isEqualTo(recordId);
    assertThat(latest.timestamp()).isEqualTo("20261019_120000");
    assertThat(latest.outcomes()).isEqualTo(outcomes());
  }

  @Test
  void save_shouldWriteRecordWithCounters() throws Exception {
    String recordId = store.save(outcomes());

    String json =
        Files.readString(tempDir.resolve("prompt").resolve(recordId + ".json"), StandardCharsets.UTF_8);

    assertThat(json)
        .contains("\"timestamp\" : \"20261019_120000\"")
        .contains("\"total\" : 3")
        .contains("\"succeeded\" : 2")
        .contains("\"failed\" : 1");
  }

  @Test
  void save_shouldNeverOverwriteRecordsFromTheSameSecond() {
    String first = store.save(outcomes());
    String second = store.save(outcomes().subList(0, 1));
    String third = store.save(List.of());

    assertThat(List.of(first, second, third))
        .containsExactly("run_20261019_120000", "run_20261019_120000_001", "run_20261019_120000_002");
    assertThat(store.load(first).outcomes()).hasSize(3);
    assertThat(store.loadLatest().orElseThrow().recordId()).isEqualTo(third);
  }

  @Test
  void listRecordIds_shouldReturnNewestFirst() {
    store.save(outcomes());
    clock.advance(Duration.ofMinutes(1));
    store.save(outcomes());
    clock.advance(Duration.ofDays(1));
    store.save(outcomes());

    assertThat(store.listRecordIds())
        .containsExactly("run_20261020_120100", "run_20261019_120100", "run_20261019_120000");
  }

  @Test
  void loadFailedFromLatest_shouldFilterAndBeIdempotent() {
    store.save(outcomes());

    StoredBatch<String, String> first = store.loadFailedFromLatest().orElseThrow();
    StoredBatch<String, String> second = store.loadFailedFromLatest().orElseThrow();

    assertThat(first.outcomes()).extracting(TaskOutcome::key).containsExactly("b");
    assertThat(first).isEqualTo(second);
  }

  @Test
  void loadLatest_shouldBeEmptyWithoutRecords() {
    assertThat(store.loadLatest()).isEmpty();
    assertThat(store.loadFailedFromLatest()).isEmpty();
    assertThat(store.listRecordIds()).isEmpty();
  }

  @Test
  void load_shouldTellMissingFromUnreadable() throws Exception {
    Path directory = tempDir.resolve("prompt");
    Files.createDirectories(directory);
    Files.writeString(directory.resolve("run_20261019_110000.json"), "{ not json");

    assertThatThrownBy(() -> store.load("run_20261019_100000"))
        .isInstanceOf(RecordNotFoundException.class);
    assertThatThrownBy(() -> store.load("../../etc/passwd"))
        .isInstanceOf(RecordNotFoundException.class);
    assertThatThrownBy(() -> store.load("run_20261019_110000"))
        .isInstanceOf(ResultDecodeException.class)
        .hasMessageContaining("run_20261019_110000");
  }

  @Test
  void listRecordIds_shouldIgnoreForeignFiles() throws Exception {
    Path directory = tempDir.resolve("prompt");
    Files.createDirectories(directory);
    Files.writeString(directory.resolve("notes.txt"), "hello");
    Files.writeString(directory.resolve("run_latest.json"), "{}");
    store.save(outcomes());

    assertThat(store.listRecordIds()).containsExactly("run_20261019_120000");
  }
}
