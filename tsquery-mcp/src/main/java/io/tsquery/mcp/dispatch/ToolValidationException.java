package io.tsquery.mcp.dispatch;

/** Invalid or missing tool arguments. Reported to the caller as a validation error envelope. */
public class ToolValidationException extends TsQueryMcpException {

  public ToolValidationException(String message) {
    super(message);
  }
}
