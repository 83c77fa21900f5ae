package io.tsquery.mcp.handlers;

import static org.junit.jupiter.api.Assertions.*;

import io.tsquery.mcp.UnitTest;
import io.tsquery.mcp.dispatch.ToolHandler;
import io.tsquery.mcp.logs.LogPaginator;
import io.tsquery.mcp.tools.ToolKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Unit tests for the tool to handler binding. */
@UnitTest
class ToolHandlersTest {

  @Test
  void everyToolHasHandler() {
    Map<ToolKind, ToolHandler> handlers = ToolHandlers.create(new LogPaginator());

    for (ToolKind kind : ToolKind.values()) {
      assertNotNull(handlers.get(kind), kind.toolName());
    }
  }
}
