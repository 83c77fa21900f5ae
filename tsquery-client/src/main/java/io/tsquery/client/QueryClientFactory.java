package io.tsquery.client;

import java.io.IOException;
import java.time.Duration;

/** Opens transport connections to a ServerQuery endpoint. */
@FunctionalInterface
public interface QueryClientFactory {

  /**
   * Opens a connection and consumes the greeting.
   *
   * @param host server host name or address
   * @param port ServerQuery port
   * @return connected client
   * @throws IOException if the endpoint is unreachable or does not speak ServerQuery
   */
  QueryClient open(String host, int port) throws IOException;

  /**
   * Returns a factory for plain TCP connections.
   *
   * @param connectTimeout limit for establishing the connection
   * @param readTimeout limit for every single response
   * @return socket based factory
   */
  static QueryClientFactory socket(Duration connectTimeout, Duration readTimeout) {
    return (host, port) -> SocketQueryClient.connect(host, port, connectTimeout, readTimeout);
  }
}
