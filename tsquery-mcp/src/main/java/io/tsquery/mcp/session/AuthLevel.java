package io.tsquery.mcp.session;

/** Privilege level a session ended up with after the authentication fallback chain. */
public enum AuthLevel {
  /** Not connected. */
  NONE,
  /** Logged in with ServerQuery login name and password. */
  LOGIN,
  /** The configured secret was redeemed as a privilege key. */
  TOKEN,
  /** Every authentication attempt failed or no secret was configured. */
  ANONYMOUS;

  public boolean isAuthenticated() {
    return this == LOGIN || this == TOKEN;
  }
}
