package io.tsquery.mcp.logs;

import io.tsquery.client.LogView;
import java.util.List;
import java.util.OptionalLong;

/**
 * One page returned by {@code logview}.
 *
 * @param lines log lines in the order received
 * @param cursor continuation position ({@code last_pos}), absent if the server sent none
 * @param fileSize size of the log file, if reported
 */
public record LogPage(List<String> lines, OptionalLong cursor, OptionalLong fileSize) {

  public LogPage {
    lines = List.copyOf(lines);
  }

  public static LogPage of(LogView view) {
    return new LogPage(view.lines(), view.lastPos(), view.fileSize());
  }

  public boolean isEmpty() {
    return lines.isEmpty();
  }

  /** True when the cursor points at more data. */
  public boolean moreAvailable() {
    return cursor.isPresent() && cursor.getAsLong() > 0;
  }
}
