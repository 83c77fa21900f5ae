package io.tsquery.mcp.session;

import io.tsquery.client.QueryClient;
import io.tsquery.client.QueryClientFactory;
import io.tsquery.client.QueryException;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, connects and releases {@link QuerySession}s.
 *
 * <p>There is one process-wide shared session built from the configured defaults. Invocations that
 * carry credentials differing from the defaults get an ephemeral session of their own; the shared
 * session is never modified on their behalf.
 */
public final class ConnectionManager {

  private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

  private final ServerCredentials defaults;
  private final QueryClientFactory clientFactory;
  private QuerySession shared;

  public ConnectionManager(ServerCredentials defaults, QueryClientFactory clientFactory) {
    this.defaults = defaults;
    this.clientFactory = clientFactory;
  }

  public ServerCredentials defaults() {
    return defaults;
  }

  /** Returns the shared session, creating it on first use. */
  public synchronized QuerySession sharedSession() {
    if (shared == null) {
      shared = new QuerySession(defaults, false);
      LOG.debug("Created shared session {}", shared);
    }
    return shared;
  }

  /**
   * Picks the session for one invocation.
   *
   * @param credentialOverrides per-call credentials object, may be {@code null}
   * @return the shared session, or a new ephemeral session when the overrides change anything
   * @throws IllegalArgumentException if the overrides contain unparseable values
   */
  public QuerySession resolveSession(Map<String, ?> credentialOverrides) {
    if (credentialOverrides == null || credentialOverrides.isEmpty()) {
      return sharedSession();
    }
    ServerCredentials merged = defaults.withOverrides(credentialOverrides);
    if (merged.equals(defaults)) {
      return sharedSession();
    }
    LOG.debug("Using ephemeral session for {}", merged);
    return new QuerySession(merged, true);
  }

  /**
   * Establishes the transport and authenticates.
   *
   * <p>Authentication falls back from login to privilege key redemption to anonymous access and
   * never fails the connect; the resulting level is recorded on the session.
   *
   * @param session session to connect; an existing handle is released first
   * @return false if the transport could not be established
   */
  public boolean connect(QuerySession session) {
    if (session.isConnected()) {
      disconnect(session);
    }
    ServerCredentials creds = session.credentials();
    LOG.info("Connecting to ServerQuery at {}:{}", creds.host(), creds.port());

    QueryClient client;
    try {
      client = clientFactory.open(creds.host(), creds.port());
    } catch (IOException e) {
      LOG.error(
          "ServerQuery connection to {}:{} failed: {}", creds.host(), creds.port(), e.getMessage());
      return false;
    }

    try {
      boolean serverSelected = selectServer(client, creds);
      AuthLevel level = authenticate(client, creds);
      if (!serverSelected) {
        // anonymous query clients may not be allowed to select before authenticating
        serverSelected = selectServer(client, creds);
        if (!serverSelected) {
          LOG.warn(
              "Could not select virtual server {}, commands will target none", creds.serverId());
        }
      }
      smokeTest(client);
      session.attach(client, level);
      LOG.info("ServerQuery session established for {} ({})", creds, level);
      return true;
    } catch (IOException e) {
      LOG.error("ServerQuery connection to {} lost during setup: {}", creds, e.getMessage());
      client.close();
      return false;
    }
  }

  private boolean selectServer(QueryClient client, ServerCredentials creds) throws IOException {
    try {
      client.useServer(creds.serverId());
      return true;
    } catch (QueryException e) {
      LOG.info("Selecting virtual server {} failed: {}", creds.serverId(), e.getMessage());
      return false;
    }
  }

  private AuthLevel authenticate(QueryClient client, ServerCredentials creds) throws IOException {
    if (!creds.hasPassword()) {
      LOG.info("No password configured, using anonymous connection");
      return AuthLevel.ANONYMOUS;
    }
    try {
      client.login(creds.user(), creds.password());
      LOG.info("Authenticated as {} with login credentials", creds.user());
      return AuthLevel.LOGIN;
    } catch (QueryException loginError) {
      LOG.info("Login as {} failed: {}", creds.user(), loginError.getMessage());
    }
    try {
      client.usePrivilegeKey(creds.password());
      LOG.info("Redeemed configured secret as privilege key");
      return AuthLevel.TOKEN;
    } catch (QueryException tokenError) {
      LOG.warn("Could not use the secret as privilege key either: {}", tokenError.getMessage());
    }
    LOG.warn("Continuing with anonymous permissions; privileged tools will fail");
    return AuthLevel.ANONYMOUS;
  }

  private void smokeTest(QueryClient client) throws IOException {
    try {
      client.whoami();
      LOG.debug("Connectivity test passed");
    } catch (QueryException e) {
      LOG.warn("Connectivity test failed: {}", e.getMessage());
    }
  }

  /**
   * Closes the session's handle. Close errors are logged, never thrown; the handle is always
   * cleared.
   */
  public void disconnect(QuerySession session) {
    QueryClient client = session.detach();
    if (client == null) {
      return;
    }
    try {
      client.quit();
    } catch (IOException e) {
      LOG.warn("Error during disconnect from {}: {}", session.credentials(), e.getMessage());
    } finally {
      client.close();
      LOG.info("Disconnected {}", session);
    }
  }

  /** True iff the session holds a live handle. The transport itself is not probed. */
  public boolean isConnected(QuerySession session) {
    return session.isConnected();
  }

  /** Releases the shared session, if one was created. */
  public void shutdown() {
    QuerySession s;
    synchronized (this) {
      s = shared;
    }
    if (s == null) {
      return;
    }
    s.lock().lock();
    try {
      disconnect(s);
    } finally {
      s.lock().unlock();
    }
  }
}
