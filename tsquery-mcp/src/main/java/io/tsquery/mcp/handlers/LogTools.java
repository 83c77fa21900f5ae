package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.dispatch.ToolValidationException;
import io.tsquery.mcp.logs.LogPage;
import io.tsquery.mcp.logs.LogPageSource;
import io.tsquery.mcp.logs.LogPaginator;
import io.tsquery.mcp.logs.LogRequest;
import io.tsquery.mcp.logs.LogResult;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/** Server and instance log reading, custom log entries. */
final class LogTools extends QueryTools {

  private final LogPaginator paginator;

  LogTools(LogPaginator paginator) {
    this.paginator = paginator;
  }

  Map<String, Object> viewServerLogs(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    LogRequest base =
        LogRequest.of(
            args.integer("lines", 50), args.bool("reverse", true), args.bool("instance_log", false));
    LogPageSource source = LogPageSource.of(session);

    if (args.bool("complete_mode", false)) {
      int maxIterations = args.integer("max_iterations", LogPaginator.DEFAULT_MAX_ITERATIONS);
      if (maxIterations < 1) {
        throw new ToolValidationException("max_iterations must be at least 1");
      }
      // the walk starts at the log head; begin_pos and filters apply to single pages only
      LogResult result = paginator.fetchAll(source, base, maxIterations);
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("mode", "complete");
      data.putAll(result.toMap());
      data.put("max_iterations", maxIterations);
      return data;
    }

    LogRequest request =
        base.withBeginPos(args.longValue("begin_pos"))
            .withFilters(
                args.integer("log_level"),
                args.longValue("timestamp_from"),
                args.longValue("timestamp_to"));
    LogPage page = page(source, request);
    Map<String, Object> data = pageData(page);
    data.put("mode", "standard");
    if (args.bool("enhanced_debug", false)) {
      data.put("mode", "enhanced_debug");
      data.put("has_cursor", page.cursor().isPresent());
      data.put("has_file_size", page.fileSize().isPresent());
      data.put("begin_pos", request.beginPos());
      data.put("next_pos", value(page.cursor()));
      data.put("requested_lines", request.lines());
    }
    return data;
  }

  Map<String, Object> instanceLogs(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    LogRequest request =
        LogRequest.of(args.integer("lines", 50), args.bool("reverse", true), true)
            .withBeginPos(args.longValue("begin_pos"));
    return pageData(page(LogPageSource.of(session), request));
  }

  Map<String, Object> addEntry(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int level = args.requireInteger("log_level");
    if (level < 1 || level > 4) {
      throw new ToolValidationException("log_level must be between 1 and 4");
    }
    session.execute(
        QueryCommand.of("logadd")
            .param("loglevel", level)
            .param("logmsg", args.requireString("message")));
    return ok("Log entry added");
  }

  private LogPage page(LogPageSource source, LogRequest request)
      throws IOException, QueryException {
    try {
      return paginator.fetchPage(source, request);
    } catch (QueryException e) {
      if (e.isEmptyResult()) {
        return new LogPage(List.of(), OptionalLong.empty(), OptionalLong.empty());
      }
      throw e;
    }
  }

  private static Map<String, Object> pageData(LogPage page) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("lines", page.lines());
    data.put("line_count", page.lines().size());
    data.put("cursor", value(page.cursor()));
    data.put("file_size", value(page.fileSize()));
    data.put("more_available", page.moreAvailable());
    return data;
  }

  private static Long value(OptionalLong v) {
    return v.isPresent() ? v.getAsLong() : null;
  }
}
