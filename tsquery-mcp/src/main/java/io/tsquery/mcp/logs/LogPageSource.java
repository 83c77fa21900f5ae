package io.tsquery.mcp.logs;

import io.tsquery.client.LogView;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;

/** Issues one windowed log read. */
@FunctionalInterface
public interface LogPageSource {

  LogPage fetch(LogRequest request) throws IOException, QueryException;

  /** Reads pages through a connected session. */
  static LogPageSource of(QuerySession session) {
    return request -> LogPage.of(LogView.from(session.execute(request.toCommand())));
  }
}
