package io.tsquery.mcp.session;

import io.tsquery.client.QueryClient;
import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.client.QueryResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One logical ServerQuery session: credentials, the live client handle and the privilege level
 * that authentication achieved.
 *
 * <p>Only {@link ConnectionManager} attaches and detaches the handle. Callers hold {@link #lock()}
 * for the whole of a tool invocation so that commands of concurrent invocations never interleave
 * on one connection.
 */
public final class QuerySession {

  private final ServerCredentials credentials;
  private final boolean ephemeral;
  private final ReentrantLock lock = new ReentrantLock();

  private volatile QueryClient client;
  private volatile AuthLevel authLevel = AuthLevel.NONE;
  private volatile Instant connectedAt;

  QuerySession(ServerCredentials credentials, boolean ephemeral) {
    this.credentials = credentials;
    this.ephemeral = ephemeral;
  }

  public ServerCredentials credentials() {
    return credentials;
  }

  /** True for sessions created for a single invocation's per-call credentials. */
  public boolean isEphemeral() {
    return ephemeral;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public boolean isConnected() {
    return client != null;
  }

  public boolean isAuthenticated() {
    return client != null && authLevel.isAuthenticated();
  }

  public AuthLevel authLevel() {
    return authLevel;
  }

  /**
   * Returns the live handle.
   *
   * @throws IllegalStateException if the session is not connected
   */
  public QueryClient client() {
    QueryClient c = client;
    if (c == null) {
      throw new IllegalStateException("Session " + credentials + " is not connected");
    }
    return c;
  }

  /** Sends a command on the live handle. */
  public QueryResponse execute(QueryCommand command) throws IOException, QueryException {
    return client().execute(command);
  }

  void attach(QueryClient client, AuthLevel authLevel) {
    this.client = client;
    this.authLevel = authLevel;
    this.connectedAt = Instant.now();
  }

  QueryClient detach() {
    QueryClient c = client;
    client = null;
    authLevel = AuthLevel.NONE;
    connectedAt = null;
    return c;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = credentials.describe();
    map.put("connected", isConnected());
    map.put("authLevel", authLevel.name());
    map.put("ephemeral", ephemeral);
    Instant since = connectedAt;
    if (since != null) {
      map.put("connectedAt", since.toString());
    }
    return new LinkedHashMap<>(map);
  }

  @Override
  public String toString() {
    return (ephemeral ? "ephemeral " : "shared ") + credentials;
  }
}
