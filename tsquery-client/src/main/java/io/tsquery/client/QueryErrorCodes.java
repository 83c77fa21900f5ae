package io.tsquery.client;

/** Numeric status ids returned by the ServerQuery interface that callers act upon. */
public final class QueryErrorCodes {

  public static final int OK = 0;

  public static final int INVALID_CLIENT_ID = 512;

  public static final int INVALID_LOGIN = 520;

  public static final int INVALID_CHANNEL_ID = 768;

  /** Returned by list commands when there is nothing to list. */
  public static final int DATABASE_EMPTY_RESULT = 1281;

  public static final int INSUFFICIENT_PERMISSIONS = 2568;

  private QueryErrorCodes() {}
}
