package io.tsquery.mcp.logs;

import io.tsquery.client.QueryCommand;

/**
 * One windowed {@code logview} request.
 *
 * @param lines lines to request, clamped to {@link #MAX_LINES_PER_PAGE}
 * @param reverse newest entries first
 * @param instanceScope read the instance log instead of the virtual server log
 * @param beginPos cursor to continue from, or {@code null} for the first page
 * @param logLevel optional level filter (1 error to 4 info)
 * @param timestampFrom optional lower time bound, unix seconds
 * @param timestampTo optional upper time bound, unix seconds
 */
public record LogRequest(
    int lines,
    boolean reverse,
    boolean instanceScope,
    Long beginPos,
    Integer logLevel,
    Long timestampFrom,
    Long timestampTo) {

  /** Largest window the server returns for one {@code logview}. */
  public static final int MAX_LINES_PER_PAGE = 100;

  public LogRequest {
    lines = Math.max(1, Math.min(lines, MAX_LINES_PER_PAGE));
  }

  public static LogRequest of(int lines, boolean reverse, boolean instanceScope) {
    return new LogRequest(lines, reverse, instanceScope, null, null, null, null);
  }

  public LogRequest withCursor(long cursor, int nextLines) {
    return new LogRequest(
        nextLines, reverse, instanceScope, cursor, logLevel, timestampFrom, timestampTo);
  }

  public LogRequest withBeginPos(Long pos) {
    return new LogRequest(lines, reverse, instanceScope, pos, logLevel, timestampFrom, timestampTo);
  }

  public LogRequest withFilters(Integer level, Long from, Long to) {
    return new LogRequest(lines, reverse, instanceScope, beginPos, level, from, to);
  }

  public QueryCommand toCommand() {
    return QueryCommand.of("logview")
        .param("lines", lines)
        .param("reverse", reverse)
        .param("instance", instanceScope)
        .param("begin_pos", beginPos)
        .param("loglevel", logLevel)
        .param("timestamp_begin", timestampFrom)
        .param("timestamp_end", timestampTo);
  }
}
