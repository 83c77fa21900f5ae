package io.tsquery.client;

import java.io.IOException;

/**
 * Connection to a ServerQuery interface.
 *
 * <p>Every method blocks until the server answers. Implementations must be safe for use from one
 * thread at a time; callers that share a client across threads serialize access themselves.
 */
public interface QueryClient extends AutoCloseable {

  /**
   * Sends a command and waits for its status line.
   *
   * @param command command to send
   * @return parsed records, possibly empty
   * @throws IOException if the transport fails or times out
   * @throws QueryException if the server answers with a non-zero status
   */
  QueryResponse execute(QueryCommand command) throws IOException, QueryException;

  /** Returns true while the underlying transport is open. */
  boolean isOpen();

  /**
   * Politely ends the session ({@code quit}) and closes the transport.
   *
   * @throws IOException if the goodbye could not be sent
   */
  void quit() throws IOException;

  /** Closes the transport without a goodbye. Never throws. */
  @Override
  void close();

  /** Selects the virtual server that subsequent commands address. */
  default void useServer(int serverId) throws IOException, QueryException {
    execute(QueryCommand.of("use").param("sid", serverId));
  }

  /** Authenticates with ServerQuery login credentials. */
  default void login(String user, String password) throws IOException, QueryException {
    execute(
        QueryCommand.of("login")
            .param("client_login_name", user)
            .param("client_login_password", password));
  }

  /** Redeems a privilege key, adding the group it grants to this query client. */
  default void usePrivilegeKey(String token) throws IOException, QueryException {
    execute(QueryCommand.of("privilegekeyuse").param("token", token));
  }

  /** Returns the identity of this query client. */
  default QueryResponse whoami() throws IOException, QueryException {
    return execute(QueryCommand.of("whoami"));
  }
}
