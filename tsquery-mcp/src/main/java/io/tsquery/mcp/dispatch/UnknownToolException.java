package io.tsquery.mcp.dispatch;

/** Thrown when a tool name is not in the registry. Never wrapped in an envelope. */
public class UnknownToolException extends TsQueryMcpException {

  private final String toolName;

  public UnknownToolException(String toolName) {
    super("Unknown tool: " + toolName);
    this.toolName = toolName;
  }

  public String getToolName() {
    return toolName;
  }
}
