package io.tsquery.client;

/**
 * Thrown when the ServerQuery interface answers a command with a non-zero status. Transport
 * failures are reported as {@link java.io.IOException} instead.
 */
public class QueryException extends Exception {

  private final int errorId;
  private final String remoteMessage;
  private final String extraMessage;

  /**
   * Creates an exception from a parsed status line.
   *
   * @param command name of the command that failed
   * @param status non-ok status
   */
  public QueryException(String command, QueryCodec.Status status) {
    this(command, status.id(), status.message(), status.extraMessage());
  }

  /**
   * Creates an exception for a remote error.
   *
   * @param command name of the command that failed
   * @param errorId numeric status id
   * @param remoteMessage message sent by the server
   * @param extraMessage optional extra message sent by the server
   */
  public QueryException(String command, int errorId, String remoteMessage, String extraMessage) {
    super(formatMessage(command, errorId, remoteMessage, extraMessage));
    this.errorId = errorId;
    this.remoteMessage = remoteMessage;
    this.extraMessage = extraMessage;
  }

  private static String formatMessage(
      String command, int errorId, String remoteMessage, String extraMessage) {
    StringBuilder sb = new StringBuilder();
    sb.append(command).append(": error id ").append(errorId).append(": ").append(remoteMessage);
    if (extraMessage != null && !extraMessage.isBlank()) {
      sb.append(" (").append(extraMessage).append(')');
    }
    return sb.toString();
  }

  public int getErrorId() {
    return errorId;
  }

  public String getRemoteMessage() {
    return remoteMessage;
  }

  public String getExtraMessage() {
    return extraMessage;
  }

  public boolean isInsufficientPermissions() {
    return errorId == QueryErrorCodes.INSUFFICIENT_PERMISSIONS;
  }

  public boolean isEmptyResult() {
    return errorId == QueryErrorCodes.DATABASE_EMPTY_RESULT;
  }
}
