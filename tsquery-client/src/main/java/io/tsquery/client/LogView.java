package io.tsquery.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Typed view of a {@code logview} response.
 *
 * <p>The server returns one record per log line in the {@code l} property. The first record
 * additionally carries {@code last_pos}, the position to pass as {@code begin_pos} for the next
 * window, and {@code file_size}. Older servers pack several lines into a single {@code l} value
 * separated by newlines; those are split here.
 *
 * @param lines log lines in the order received
 * @param lastPos continuation cursor, empty if the server did not send one
 * @param fileSize size of the log file, empty if the server did not send one
 */
public record LogView(List<String> lines, OptionalLong lastPos, OptionalLong fileSize) {

  public LogView {
    lines = List.copyOf(lines);
  }

  public static LogView from(QueryResponse response) {
    List<String> lines = new ArrayList<>();
    OptionalLong lastPos = OptionalLong.empty();
    OptionalLong fileSize = OptionalLong.empty();
    for (Map<String, String> record : response.records()) {
      if (lastPos.isEmpty()) {
        lastPos = parseLong(record.get("last_pos"));
      }
      if (fileSize.isEmpty()) {
        fileSize = parseLong(record.get("file_size"));
      }
      String text = record.get("l");
      if (text == null) {
        continue;
      }
      for (String line : text.split("\n")) {
        String trimmed = line.strip();
        if (!trimmed.isEmpty()) {
          lines.add(trimmed);
        }
      }
    }
    return new LogView(lines, lastPos, fileSize);
  }

  private static OptionalLong parseLong(String value) {
    if (value == null || value.isBlank()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      return OptionalLong.empty();
    }
  }
}
