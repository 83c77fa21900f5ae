package io.tsquery.mcp.dispatch;

/** Categories of failed tool invocations. */
public enum ErrorKind {
  /** Missing or unusable arguments; the handler did not run. */
  VALIDATION,
  /** The ServerQuery transport could not be established or was lost. */
  CONNECTION,
  /** The server rejected a command. */
  REMOTE_PROTOCOL,
  /** Unexpected failure inside a handler. */
  INTERNAL
}
