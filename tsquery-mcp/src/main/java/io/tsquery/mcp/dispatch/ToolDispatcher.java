package io.tsquery.mcp.dispatch;

import io.tsquery.client.QueryErrorCodes;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.session.ConnectionManager;
import io.tsquery.mcp.session.QuerySession;
import io.tsquery.mcp.tools.ArgSpec;
import io.tsquery.mcp.tools.ToolKind;
import io.tsquery.mcp.tools.ToolRegistry;
import io.tsquery.mcp.tools.ToolSpec;
import java.io.IOException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves tool names to handlers and runs them against a connected session.
 *
 * <p>Every failure after the tool lookup is returned as a {@link ToolResult} error envelope. Only
 * an unknown tool name throws. Handlers run at most once per invocation; nothing is retried.
 */
public final class ToolDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(ToolDispatcher.class);

  static final String INSUFFICIENT_PERMISSIONS_HINT =
      "The ServerQuery account lacks the permission for this command. Authentication falls back"
          + " to anonymous access when login fails, so check the reported authLevel first."
          + " Verify the configured password or privilege key; create a ServerQuery login with"
          + " 'serverqueryadd' and add it to the Server Admin group with"
          + " 'servergroupaddclient sgid=6 cldbid=<id>', or create an admin token with"
          + " 'tokenadd tokentype=0 tokenid1=6 tokenid2=0' and pass it as the password."
          + " Run server_info first to confirm basic access.";

  static final String CONNECTION_HINT =
      "Check that the TeamSpeak server is running, that ServerQuery is enabled, that no"
          + " firewall blocks the query port (default 10011), and that host, port, user and"
          + " password are correct.";

  private final ToolRegistry registry;
  private final ConnectionManager connections;
  private final Map<ToolKind, ToolHandler> handlers;

  public ToolDispatcher(
      ToolRegistry registry, ConnectionManager connections, Map<ToolKind, ToolHandler> handlers) {
    this.registry = registry;
    this.connections = connections;
    this.handlers = new EnumMap<>(handlers);
  }

  public ToolRegistry registry() {
    return registry;
  }

  /**
   * Invokes a tool.
   *
   * @param toolName registered tool name
   * @param arguments raw invocation arguments, may be {@code null}
   * @return success or error envelope
   * @throws UnknownToolException if the name is not registered
   */
  public ToolResult invoke(String toolName, Map<String, Object> arguments) {
    ToolSpec spec = registry.lookup(toolName).orElseThrow(() -> new UnknownToolException(toolName));
    Map<String, Object> raw = arguments == null ? Map.of() : arguments;

    ToolArguments args;
    try {
      args = bind(spec, raw);
    } catch (ToolValidationException e) {
      LOG.debug("Rejected {} invocation: {}", toolName, e.getMessage());
      return ToolResult.error(ErrorKind.VALIDATION, e.getMessage());
    }

    QuerySession session;
    try {
      session = connections.resolveSession(credentials(raw));
    } catch (IllegalArgumentException e) {
      return ToolResult.error(ErrorKind.VALIDATION, "Invalid credentials: " + e.getMessage());
    }

    ToolHandler handler = handlers.get(spec.kind());
    if (handler == null) {
      return ToolResult.error(ErrorKind.INTERNAL, "No handler bound for tool " + toolName);
    }

    session.lock().lock();
    try {
      if (!connections.isConnected(session) && !connections.connect(session)) {
        LOG.warn("Could not connect to {} for {}", session, toolName);
        return ToolResult.error(
                ErrorKind.CONNECTION,
                "Failed to connect to TeamSpeak server at "
                    + session.credentials().host()
                    + ":"
                    + session.credentials().port(),
                null,
                CONNECTION_HINT)
            .withDetails(session.toMap());
      }
      return run(handler, session, args);
    } finally {
      try {
        if (session.isEphemeral()) {
          connections.disconnect(session);
        }
      } finally {
        session.lock().unlock();
      }
    }
  }

  private ToolResult run(ToolHandler handler, QuerySession session, ToolArguments args) {
    String toolName = args.toolName();
    try {
      Map<String, Object> data = handler.handle(session, args);
      return ToolResult.success(data == null ? Map.of() : data);
    } catch (ToolValidationException e) {
      return ToolResult.error(ErrorKind.VALIDATION, e.getMessage());
    } catch (QueryException e) {
      LOG.info("{} rejected by server: {}", toolName, e.getMessage());
      String hint =
          e.getErrorId() == QueryErrorCodes.INSUFFICIENT_PERMISSIONS
              ? INSUFFICIENT_PERMISSIONS_HINT + " Current auth level: " + session.authLevel() + "."
              : null;
      return ToolResult.error(ErrorKind.REMOTE_PROTOCOL, e.getMessage(), e.getErrorId(), hint);
    } catch (IOException e) {
      LOG.warn("Connection lost during {}: {}", toolName, e.getMessage());
      connections.disconnect(session);
      return ToolResult.error(
          ErrorKind.CONNECTION, "Connection lost: " + e.getMessage(), null, CONNECTION_HINT);
    } catch (RuntimeException e) {
      LOG.error("Tool {} failed", toolName, e);
      return ToolResult.error(ErrorKind.INTERNAL, "Tool execution failed: " + e.getMessage());
    }
  }

  static ToolArguments bind(ToolSpec spec, Map<String, Object> raw) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (ArgSpec arg : spec.arguments()) {
      Object value = raw.get(arg.name());
      if (value == null) {
        if (arg.required()) {
          throw new ToolValidationException(
              "Missing required argument '" + arg.name() + "' for tool " + spec.name());
        }
        value = arg.defaultValue();
      }
      if (value != null) {
        values.put(arg.name(), value);
      }
    }
    return new ToolArguments(spec.name(), values);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> credentials(Map<String, Object> raw) {
    Object creds = raw.get(ToolRegistry.CREDENTIALS_ARGUMENT);
    if (creds == null) {
      return null;
    }
    if (creds instanceof Map<?, ?> map) {
      return (Map<String, ?>) map;
    }
    throw new IllegalArgumentException(ToolRegistry.CREDENTIALS_ARGUMENT + " must be an object");
  }
}
