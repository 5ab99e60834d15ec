package com.scholary.orchestrator.store;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Naming rules for batch records.
 *
 * <p>Ids look like {@code run_20261019_120000}; a second save within the same second gets {@code
 * _001}, {@code _002} and so on.
 */
final class RecordIds {

  static final String PREFIX = "run_";
  static final String EXTENSION = ".json";
  static final int MAX_COLLISIONS = 999;

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private static final Pattern RECORD_ID = Pattern.compile("run_\\d{8}_\\d{6}(_\\d{3})?");

  private RecordIds() {}

  static String timestamp(Clock clock) {
    return TIMESTAMP.format(clock.instant());
  }

  static String candidate(String timestamp, int collision) {
    return collision == 0
        ? PREFIX + timestamp
        : PREFIX + timestamp + String.format("_%03d", collision);
  }

  static boolean isValid(String recordId) {
    return recordId != null && RECORD_ID.matcher(recordId).matches();
  }

  static boolean isRecordFile(String fileName) {
    return fileName.endsWith(EXTENSION) && isValid(stripExtension(fileName));
  }

  static String stripExtension(String fileName) {
    return fileName.substring(0, fileName.length() - EXTENSION.length());
  }
}
