package com.scholary.orchestrator.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.orchestrator.job.ApplyReport;
import com.scholary.orchestrator.job.ApplyStep;
import com.scholary.orchestrator.task.TaskOutcome;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each parsed reply to {@code <directory>/<task key>.json}, replacing an earlier export of
 * the same task.
 *
 * <p>A dry run writes nothing and lists the files it would write in the report details.
 */
public class ReplyExportStep implements ApplyStep<JsonNode, JsonNode> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReplyExportStep.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public ReplyExportStep(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public ApplyReport apply(List<TaskOutcome<JsonNode, JsonNode>> successful, boolean dryRun)
      throws IOException {
    if (!dryRun) {
      Files.createDirectories(directory);
    }
    int applied = 0;
    int skipped = 0;
    List<String> details = new ArrayList<>();

    for (TaskOutcome<JsonNode, JsonNode> outcome : successful) {
      if (outcome.payload() == null || outcome.payload().isNull()) {
        skipped++;
        details.add(outcome.key() + ": no reply to export");
        continue;
      }
      Path file = directory.resolve(fileNameFor(outcome.key()));
      if (dryRun) {
        details.add(outcome.key() + ": would write " + file);
      } else {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), outcome.payload());
      }
      applied++;
    }

    if (dryRun) {
      LOGGER.info("Dry run: would export {} replies to {} ({} skipped)", applied, directory, skipped);
    } else {
      LOGGER.info("Exported {} replies to {} ({} skipped)", applied, directory, skipped);
    }
    return new ApplyReport(applied, skipped, details);
  }

  static String fileNameFor(String key) {
    return key.replaceAll("[^A-Za-z0-9_.-]", "_") + ".json";
  }
}
