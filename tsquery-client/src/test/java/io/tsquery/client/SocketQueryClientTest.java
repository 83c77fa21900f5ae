package io.tsquery.client;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/** Tests SocketQueryClient against a loopback ServerQuery fake. */
class SocketQueryClientTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(2);
  private static final String GREETING =
      "TS3\n\rWelcome to the TeamSpeak 3 ServerQuery interface, type \"help\" for a list.\n\r";

  private FakeServer server;
  private SocketQueryClient client;

  @AfterEach
  void tearDown() throws Exception {
    if (client != null) {
      client.close();
    }
    if (server != null) {
      server.close();
    }
  }

  @Test
  void executesCommandAndParsesRecords() throws Exception {
    server =
        FakeServer.start(
            GREETING,
            line ->
                line.startsWith("clientlist")
                    ? "clid=1 client_nickname=Alice|clid=2 client_nickname=Bob\n\r"
                        + "error id=0 msg=ok\n\r"
                    : "error id=256 msg=command\\snot\\sfound\n\r");
    client = connect();

    QueryResponse response = client.execute(QueryCommand.of("clientlist"));

    assertEquals(2, response.size());
    assertEquals("Alice", response.first().get("client_nickname"));
    assertEquals(List.of("clientlist"), server.received());
  }

  @Test
  void welcomeTextIsNotPartOfFirstResponse() throws Exception {
    server = FakeServer.start(GREETING, line -> "error id=0 msg=ok\n\r");
    client = connect();

    assertTrue(client.execute(QueryCommand.of("use").param("sid", 1)).isEmpty());
  }

  @Test
  void nonZeroStatusThrowsQueryException() throws Exception {
    server =
        FakeServer.start(
            GREETING,
            line ->
                "error id=2568 msg=insufficient\\sclient\\spermissions"
                    + " failed_permid=4\n\r");
    client = connect();

    QueryException e =
        assertThrows(QueryException.class, () -> client.execute(QueryCommand.of("clientlist")));
    assertEquals(QueryErrorCodes.INSUFFICIENT_PERMISSIONS, e.getErrorId());
    assertTrue(e.isInsufficientPermissions());
    assertTrue(client.isOpen(), "a remote error leaves the connection usable");
  }

  @Test
  void notificationsAreSkipped() throws Exception {
    server =
        FakeServer.start(
            GREETING,
            line ->
                "notifycliententerview clid=7\n\r"
                    + "virtualserver_name=Test\n\r"
                    + "error id=0 msg=ok\n\r");
    client = connect();

    QueryResponse response = client.execute(QueryCommand.of("serverinfo"));

    assertEquals(1, response.size());
    assertEquals("Test", response.firstValue("virtualserver_name").orElseThrow());
  }

  @Test
  void rejectsEndpointWithoutBanner() throws Exception {
    server = FakeServer.start("SSH-2.0-OpenSSH\n", line -> "");

    assertThrows(IOException.class, this::connect);
  }

  @Test
  void closedConnectionMidResponseThrowsEofAndCloses() throws Exception {
    server = FakeServer.start(GREETING, line -> null);
    client = connect();

    assertThrows(EOFException.class, () -> client.execute(QueryCommand.of("whoami")));
    assertFalse(client.isOpen());
    assertThrows(IOException.class, () -> client.execute(QueryCommand.of("whoami")));
  }

  @Test
  void connectToClosedPortFails() throws Exception {
    int port;
    try (ServerSocket probe = new ServerSocket(0)) {
      port = probe.getLocalPort();
    }
    assertThrows(
        IOException.class,
        () -> SocketQueryClient.connect("127.0.0.1", port, Duration.ofMillis(500), TIMEOUT));
  }

  @Test
  void quitClosesConnection() throws Exception {
    server = FakeServer.start(GREETING, line -> "error id=0 msg=ok\n\r");
    client = connect();

    client.quit();

    assertFalse(client.isOpen());
    assertDoesNotThrow(client::close);
  }

  private SocketQueryClient connect() throws IOException {
    return SocketQueryClient.connect("127.0.0.1", server.port(), TIMEOUT, TIMEOUT);
  }

  /** Single-connection fake; the responder returns the raw reply, or null to hang up. */
  private static final class FakeServer implements AutoCloseable {
    private final ServerSocket socket;
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final Thread thread;

    private FakeServer(ServerSocket socket, String greeting, Function<String, String> responder) {
      this.socket = socket;
      this.thread = new Thread(() -> serve(greeting, responder), "fake-serverquery");
      this.thread.setDaemon(true);
    }

    static FakeServer start(String greeting, Function<String, String> responder)
        throws IOException {
      ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
      FakeServer server = new FakeServer(socket, greeting, responder);
      server.thread.start();
      return server;
    }

    int port() {
      return socket.getLocalPort();
    }

    List<String> received() {
      return received;
    }

    private void serve(String greeting, Function<String, String> responder) {
      try (Socket conn = socket.accept()) {
        OutputStream out = conn.getOutputStream();
        out.write(greeting.getBytes(StandardCharsets.UTF_8));
        out.flush();
        BufferedReader in =
            new BufferedReader(
                new InputStreamReader(conn.getInputStream(), StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null) {
          if (line.equals("quit")) {
            return;
          }
          received.add(line);
          String reply = responder.apply(line);
          if (reply == null) {
            return;
          }
          out.write(reply.getBytes(StandardCharsets.UTF_8));
          out.flush();
        }
      } catch (IOException e) {
        // client went away
      }
    }

    @Override
    public void close() throws IOException {
      socket.close();
    }
  }
}
