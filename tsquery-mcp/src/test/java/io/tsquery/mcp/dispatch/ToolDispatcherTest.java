package io.tsquery.mcp.dispatch;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import io.tsquery.client.QueryClientFactory;
import io.tsquery.client.QueryErrorCodes;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.FakeQueryClient;
import io.tsquery.mcp.UnitTest;
import io.tsquery.mcp.handlers.ToolHandlers;
import io.tsquery.mcp.logs.LogPaginator;
import io.tsquery.mcp.session.ConnectionManager;
import io.tsquery.mcp.session.ServerCredentials;
import io.tsquery.mcp.tools.ToolKind;
import io.tsquery.mcp.tools.ToolRegistry;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Unit tests for tool dispatch and error envelope normalization. */
@UnitTest
class ToolDispatcherTest {

  private FakeQueryClient client;
  private ConnectionManager connections;
  private Map<ToolKind, ToolHandler> handlers;
  private AtomicInteger opens;

  @BeforeEach
  void setUp() {
    client = new FakeQueryClient();
    opens = new AtomicInteger();
    QueryClientFactory factory = client.factory();
    connections =
        new ConnectionManager(
            ServerCredentials.defaults(),
            (host, port) -> {
              opens.incrementAndGet();
              return factory.open(host, port);
            });
    handlers = new EnumMap<>(ToolHandlers.create(new LogPaginator(Duration.ZERO)));
  }

  private ToolDispatcher dispatcher() {
    return new ToolDispatcher(ToolRegistry.standard(), connections, handlers);
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // lookup and validation
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void unknownToolThrowsWithoutTouchingConnectionManager() {
    ConnectionManager mocked = mock(ConnectionManager.class);
    ToolDispatcher dispatcher = new ToolDispatcher(ToolRegistry.standard(), mocked, handlers);

    UnknownToolException e =
        assertThrows(UnknownToolException.class, () -> dispatcher.invoke("no_such_tool", Map.of()));

    assertEquals("no_such_tool", e.getToolName());
    verifyNoInteractions(mocked);
  }

  @Test
  void kickClientWithoutArgumentsIsValidationErrorWithoutConnecting() {
    ConnectionManager mocked = mock(ConnectionManager.class);
    ToolDispatcher dispatcher = new ToolDispatcher(ToolRegistry.standard(), mocked, handlers);

    ToolResult result = dispatcher.invoke("kick_client", Map.of());

    assertTrue(result.isError());
    assertEquals(ErrorKind.VALIDATION, result.errorKind());
    assertTrue(result.message().contains("client_id"));
    verifyNoInteractions(mocked);
  }

  @Test
  void nullRequiredValueCountsAsMissing() {
    AtomicInteger calls = new AtomicInteger();
    handlers.put(ToolKind.POKE_CLIENT, (s, a) -> Map.of("calls", calls.incrementAndGet()));
    Map<String, Object> args = new HashMap<>();
    args.put("client_id", null);
    args.put("message", "hey");

    ToolResult result = dispatcher().invoke("poke_client", args);

    assertEquals(ErrorKind.VALIDATION, result.errorKind());
    assertEquals(0, calls.get());
    assertEquals(0, opens.get());
  }

  @Test
  void defaultsAreAppliedForMissingOptionalArguments() {
    AtomicReference<ToolArguments> seen = new AtomicReference<>();
    handlers.put(
        ToolKind.KICK_CLIENT,
        (s, a) -> {
          seen.set(a);
          return Map.of();
        });

    ToolResult result = dispatcher().invoke("kick_client", Map.of("client_id", 5));

    assertTrue(result.success());
    assertEquals(5, seen.get().requireInteger("client_id"));
    assertEquals("Expelled by AI", seen.get().string("reason"));
    assertFalse(seen.get().bool("from_server", true));
  }

  @Test
  void malformedCredentialsAreValidationErrors() {
    ToolResult result =
        dispatcher()
            .invoke("list_clients", Map.of(ToolRegistry.CREDENTIALS_ARGUMENT, Map.of("port", "x")));

    assertEquals(ErrorKind.VALIDATION, result.errorKind());
    assertEquals(0, opens.get());
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // connection handling
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void connectionFailureSkipsHandler() {
    connections =
        new ConnectionManager(
            ServerCredentials.defaults(),
            (host, port) -> {
              throw new ConnectException("Connection refused");
            });
    AtomicInteger calls = new AtomicInteger();
    handlers.put(ToolKind.LIST_CLIENTS, (s, a) -> Map.of("calls", calls.incrementAndGet()));

    ToolResult result = dispatcher().invoke("list_clients", null);

    assertEquals(ErrorKind.CONNECTION, result.errorKind());
    assertTrue(result.hint().contains("10011"));
    assertEquals("[NOT SET]", result.data().get("password"));
    assertEquals(0, calls.get());
  }

  @Test
  void sharedSessionIsConnectedOnceAndReused() {
    ToolDispatcher dispatcher = dispatcher();

    assertTrue(dispatcher.invoke("list_clients", Map.of()).success());
    assertTrue(dispatcher.invoke("list_channels", Map.of()).success());

    assertEquals(1, opens.get());
    assertTrue(connections.sharedSession().isConnected());
  }

  @Test
  void ephemeralSessionIsDisconnectedAfterInvocation() {
    Map<String, Object> args =
        Map.of(ToolRegistry.CREDENTIALS_ARGUMENT, Map.of("host", "other.example.org"));

    ToolResult result = dispatcher().invoke("server_info", args);

    assertTrue(result.success());
    assertEquals(1, client.quits());
    assertFalse(connections.sharedSession().isConnected());
  }

  @Test
  void transportFailureInHandlerDisconnectsSession() {
    handlers.put(
        ToolKind.LIST_CLIENTS,
        (s, a) -> {
          throw new IOException("Connection reset");
        });

    ToolResult result = dispatcher().invoke("list_clients", Map.of());

    assertEquals(ErrorKind.CONNECTION, result.errorKind());
    assertFalse(connections.sharedSession().isConnected());
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // handler errors
  // ─────────────────────────────────────────────────────────────────────────────

  @Test
  void insufficientPermissionGetsRemediationHint() {
    client.onError(
        "clientlist", QueryErrorCodes.INSUFFICIENT_PERMISSIONS, "insufficient client permissions");

    ToolResult result = dispatcher().invoke("list_clients", Map.of());

    assertEquals(ErrorKind.REMOTE_PROTOCOL, result.errorKind());
    assertEquals(QueryErrorCodes.INSUFFICIENT_PERMISSIONS, result.errorId());
    assertTrue(result.hint().contains("servergroupaddclient sgid=6"));
    assertTrue(result.hint().contains("ANONYMOUS"));
  }

  @Test
  void otherRemoteErrorsCarryNoHint() {
    client.onError("clientkick", QueryErrorCodes.INVALID_CLIENT_ID, "invalid clientID");

    ToolResult result = dispatcher().invoke("kick_client", Map.of("client_id", 99));

    assertEquals(ErrorKind.REMOTE_PROTOCOL, result.errorKind());
    assertEquals(QueryErrorCodes.INVALID_CLIENT_ID, result.errorId());
    assertNull(result.hint());
  }

  @Test
  void failingHandlerRunsExactlyOnce() {
    AtomicInteger calls = new AtomicInteger();
    handlers.put(
        ToolKind.CREATE_CHANNEL,
        (s, a) -> {
          calls.incrementAndGet();
          throw new QueryException("channelcreate", 771, "channel name is already in use", null);
        });

    ToolResult result = dispatcher().invoke("create_channel", Map.of("name", "Lobby"));

    assertTrue(result.isError());
    assertEquals(1, calls.get());
  }

  @Test
  void unexpectedExceptionIsInternalError() {
    handlers.put(
        ToolKind.SERVER_INFO,
        (s, a) -> {
          throw new IllegalStateException("boom");
        });

    ToolResult result = dispatcher().invoke("server_info", Map.of());

    assertEquals(ErrorKind.INTERNAL, result.errorKind());
    assertTrue(result.message().contains("boom"));
  }

  @Test
  void handlerValidationErrorIsReported() {
    ToolResult result =
        dispatcher()
            .invoke("manage_channel_permissions", Map.of("channel_id", 1, "action", "add"));

    assertEquals(ErrorKind.VALIDATION, result.errorKind());
    assertTrue(result.message().contains("permission"));
  }

  @Test
  void sharedSessionAccessIsSerialized() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    handlers.put(
        ToolKind.LIST_CLIENTS,
        (s, a) -> {
          maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
          try {
            Thread.sleep(5);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          active.decrementAndGet();
          return Map.of();
        });
    ToolDispatcher dispatcher = dispatcher();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      Callable<ToolResult> task = () -> dispatcher.invoke("list_clients", Map.of());
      List<Future<ToolResult>> results = pool.invokeAll(Collections.nCopies(12, task));
      for (Future<ToolResult> f : results) {
        assertTrue(f.get(5, TimeUnit.SECONDS).success());
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, maxActive.get());
  }
}
