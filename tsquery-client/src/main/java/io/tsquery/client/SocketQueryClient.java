package io.tsquery.client;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryClient} over the raw TCP ServerQuery port (10011 by default).
 *
 * <p>Any transport failure, including a read timeout, closes the socket: the line stream can no
 * longer be trusted to be in sync with the command that was sent.
 */
public final class SocketQueryClient implements QueryClient {

  private static final Logger LOG = LoggerFactory.getLogger(SocketQueryClient.class);

  static final String BANNER = "TS3";

  private final Socket socket;
  private final BufferedReader reader;
  private final BufferedWriter writer;
  private final String endpoint;
  private volatile boolean open = true;

  private SocketQueryClient(Socket socket, String endpoint) throws IOException {
    this.socket = socket;
    this.endpoint = endpoint;
    this.reader =
        new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
    this.writer =
        new BufferedWriter(
            new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
  }

  /**
   * Connects and reads the greeting.
   *
   * @param host server host
   * @param port ServerQuery port
   * @param connectTimeout limit for establishing the connection
   * @param readTimeout limit for each response
   * @return connected client
   * @throws IOException if the connection fails or the greeting is not a ServerQuery banner
   */
  public static SocketQueryClient connect(
      String host, int port, Duration connectTimeout, Duration readTimeout) throws IOException {
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
      socket.setSoTimeout((int) readTimeout.toMillis());
      socket.setKeepAlive(true);
      SocketQueryClient client = new SocketQueryClient(socket, host + ":" + port);
      client.readGreeting();
      LOG.debug("Connected to ServerQuery at {}", client.endpoint);
      return client;
    } catch (IOException e) {
      closeQuietly(socket);
      throw e;
    }
  }

  private void readGreeting() throws IOException {
    String banner = readContentLine();
    if (banner == null || !banner.startsWith(BANNER)) {
      throw new IOException(
          "Endpoint " + endpoint + " is not a ServerQuery interface (banner: " + banner + ")");
    }
    // welcome text follows the banner
    String welcome = readContentLine();
    if (welcome == null) {
      throw new EOFException("Connection closed during greeting from " + endpoint);
    }
  }

  private String readContentLine() throws IOException {
    String line;
    do {
      line = readLine();
    } while (line != null && line.isEmpty());
    return line;
  }

  @Override
  public synchronized QueryResponse execute(QueryCommand command)
      throws IOException, QueryException {
    if (!open) {
      throw new IOException("Connection to " + endpoint + " is closed");
    }
    try {
      writer.write(command.encode());
      writer.write('\n');
      writer.flush();

      List<Map<String, String>> records = new ArrayList<>();
      while (true) {
        String line = readLine();
        if (line == null) {
          throw new EOFException("Connection closed by " + endpoint);
        }
        if (line.isEmpty() || QueryCodec.isNotification(line)) {
          continue;
        }
        if (QueryCodec.isStatusLine(line)) {
          QueryCodec.Status status = QueryCodec.parseStatus(line);
          if (!status.isOk()) {
            throw new QueryException(command.name(), status);
          }
          return new QueryResponse(records);
        }
        records.addAll(QueryCodec.parseRecords(line));
      }
    } catch (IOException e) {
      close();
      throw e;
    }
  }

  private String readLine() throws IOException {
    String line = reader.readLine();
    if (line == null) {
      return null;
    }
    // the server terminates lines with "\n\r"
    return line.replace("\r", "");
  }

  @Override
  public boolean isOpen() {
    return open && !socket.isClosed();
  }

  @Override
  public synchronized void quit() throws IOException {
    if (!open) {
      return;
    }
    try {
      writer.write("quit\n");
      writer.flush();
    } finally {
      close();
    }
  }

  @Override
  public void close() {
    if (open) {
      open = false;
      closeQuietly(socket);
      LOG.debug("Closed ServerQuery connection to {}", endpoint);
    }
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LOG.debug("Error closing socket: {}", e.getMessage());
    }
  }
}
