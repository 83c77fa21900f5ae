package io.tsquery.mcp.logs;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Outcome of a complete log fetch.
 *
 * @param lines accumulated lines in fetch order
 * @param iterations pages whose lines were accepted
 * @param finalCursor last cursor seen, absent if the server never sent one
 * @param terminatedBy why the loop stopped
 * @param error remote error message when {@code terminatedBy} is {@link Termination#REMOTE_ERROR}
 */
public record LogResult(
    List<String> lines,
    int iterations,
    OptionalLong finalCursor,
    Termination terminatedBy,
    String error) {

  /** Halting conditions of the pagination loop. */
  public enum Termination {
    EMPTY_PAGE,
    NO_CURSOR,
    ZERO_CURSOR,
    REPEATED_CURSOR,
    MAX_ITERATIONS,
    REMOTE_ERROR,
    INTERRUPTED
  }

  public LogResult {
    lines = List.copyOf(lines);
  }

  /** True if the loop ended at a natural end of log rather than a bound or failure. */
  public boolean reachedEnd() {
    return switch (terminatedBy) {
      case EMPTY_PAGE, NO_CURSOR, ZERO_CURSOR, REPEATED_CURSOR -> true;
      default -> false;
    };
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("lines", lines);
    map.put("line_count", lines.size());
    map.put("iterations", iterations);
    map.put("final_cursor", finalCursor.isPresent() ? finalCursor.getAsLong() : null);
    map.put("terminated_by", terminatedBy.name());
    if (error != null) {
      map.put("error", error);
    }
    return map;
  }
}
