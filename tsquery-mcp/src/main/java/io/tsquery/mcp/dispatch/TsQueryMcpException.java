package io.tsquery.mcp.dispatch;

/**
 * Base exception of the MCP layer.
 *
 * <p>Provides clear error messages for MCP tool failures.
 */
public class TsQueryMcpException extends RuntimeException {

  /**
   * Creates exception with message.
   *
   * @param message error message
   */
  public TsQueryMcpException(String message) {
    super(message);
  }

  /**
   * Creates exception with message and cause.
   *
   * @param message error message
   * @param cause underlying cause
   */
  public TsQueryMcpException(String message, Throwable cause) {
    super(message, cause);
  }
}
