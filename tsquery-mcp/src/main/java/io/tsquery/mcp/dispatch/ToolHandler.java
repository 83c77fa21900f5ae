package io.tsquery.mcp.dispatch;

import io.tsquery.client.QueryException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Implementation of one tool, run against a connected session. */
@FunctionalInterface
public interface ToolHandler {

  /**
   * Runs the tool.
   *
   * @param session connected session, locked by the caller for the duration of the call
   * @param args validated arguments with defaults applied
   * @return result data, rendered as JSON for the caller
   * @throws IOException if the transport fails
   * @throws QueryException if the server rejects a command
   * @throws ToolValidationException if argument combinations are unusable
   */
  Map<String, Object> handle(QuerySession session, ToolArguments args)
      throws IOException, QueryException;
}
