package io.tsquery.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.tsquery.client.QueryClientFactory;
import io.tsquery.mcp.config.CliOptions;
import io.tsquery.mcp.config.McpServerConfig;
import io.tsquery.mcp.dispatch.ToolDispatcher;
import io.tsquery.mcp.handlers.ToolHandlers;
import io.tsquery.mcp.logs.LogPaginator;
import io.tsquery.mcp.session.ConnectionManager;
import io.tsquery.mcp.tools.ToolRegistry;
import io.tsquery.mcp.tools.ToolSpec;
import jakarta.servlet.Servlet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * MCP server for TeamSpeak administration.
 *
 * <p>Exposes every {@link io.tsquery.mcp.tools.ToolKind} as an MCP tool backed by a ServerQuery
 * session. Run with {@code --stdio} for stdio transport, otherwise HTTP/SSE on {@code mcp.port}.
 *
 * <p>Logging goes to stderr; stdout carries the stdio protocol.
 */
public final class TsQueryMcpServer {

  private static final Logger LOG = LoggerFactory.getLogger(TsQueryMcpServer.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String SERVER_NAME = "tsquery-mcp";
  static final String SERVER_VERSION = "0.1.0";

  private final McpServerConfig config;
  private final ConnectionManager connections;
  private final ToolDispatcher dispatcher;

  public TsQueryMcpServer(McpServerConfig config) {
    this(
        config,
        new ConnectionManager(
            config.credentials(),
            QueryClientFactory.socket(config.connectTimeout(), config.readTimeout())));
  }

  TsQueryMcpServer(McpServerConfig config, ConnectionManager connections) {
    this.config = config;
    this.connections = connections;
    this.dispatcher =
        new ToolDispatcher(
            ToolRegistry.standard(),
            connections,
            ToolHandlers.create(new LogPaginator(config.logPageDelay())));
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Launcher()).execute(args);
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  @CommandLine.Command(
      name = "tsquery-mcp",
      description = "MCP server for TeamSpeak ServerQuery administration",
      version = SERVER_VERSION,
      mixinStandardHelpOptions = true)
  static final class Launcher implements Callable<Integer> {

    @CommandLine.Mixin CliOptions options = new CliOptions();

    @Override
    public Integer call() {
      McpServerConfig config;
      try {
        config = McpServerConfig.load(options);
      } catch (IllegalArgumentException e) {
        LOG.error("Invalid configuration: {}", e.getMessage());
        return CommandLine.ExitCode.USAGE;
      }
      LOG.info("Using TeamSpeak server {}", config.credentials());

      var server = new TsQueryMcpServer(config);
      if (config.stdio()) {
        server.runStdio();
      } else {
        server.runSse();
      }
      return CommandLine.ExitCode.OK;
    }
  }

  /** Run server with stdio transport. */
  public void runStdio() {
    LOG.info("Starting TeamSpeak MCP Server with stdio transport");

    try {
      var transportProvider = new StdioServerTransportProvider(MAPPER);

      // the provider starts reading stdin as soon as the server is built
      McpSyncServer mcpServer =
          McpServer.sync(transportProvider)
              .serverInfo(SERVER_NAME, SERVER_VERSION)
              .capabilities(ServerCapabilities.builder().tools(true).logging().build())
              .tools(createToolSpecifications())
              .build();

      LOG.info("TeamSpeak MCP Server ready (stdio mode)");

      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    LOG.info("Shutting down...");
                    connections.shutdown();
                    mcpServer.close();
                  }));

      // exits on stdin EOF or SIGTERM
      new CountDownLatch(1).await();

    } catch (InterruptedException e) {
      LOG.info("Server interrupted, shutting down");
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  /** Run server with HTTP/SSE transport. */
  public void runSse() {
    int port = config.httpPort();
    LOG.info("Starting TeamSpeak MCP Server on port {}", port);

    try {
      var transportProvider =
          HttpServletSseServerTransportProvider.builder()
              .objectMapper(MAPPER)
              .messageEndpoint("/mcp/message")
              .build();

      McpSyncServer mcpServer =
          McpServer.sync(transportProvider)
              .serverInfo(SERVER_NAME, SERVER_VERSION)
              .capabilities(ServerCapabilities.builder().tools(true).logging().build())
              .tools(createToolSpecifications())
              .build();

      Server jettyServer = new Server(port);
      ServletContextHandler context = new ServletContextHandler(ServletContextHandler.SESSIONS);
      context.setContextPath("/");
      jettyServer.setHandler(context);
      context.addServlet(new ServletHolder((Servlet) transportProvider), "/mcp/*");

      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    LOG.info("Shutting down...");
                    connections.shutdown();
                    mcpServer.close();
                    try {
                      jettyServer.stop();
                    } catch (Exception e) {
                      LOG.warn("Error stopping Jetty: {}", e.getMessage());
                    }
                  }));

      jettyServer.start();
      LOG.info("TeamSpeak MCP Server started at http://localhost:{}/mcp", port);
      LOG.info("SSE endpoint: http://localhost:{}/mcp/sse", port);
      LOG.info("Message endpoint: http://localhost:{}/mcp/message", port);
      jettyServer.join();

    } catch (Exception e) {
      LOG.error("Failed to start server: {}", e.getMessage(), e);
      System.exit(1);
    }
  }

  List<McpServerFeatures.SyncToolSpecification> createToolSpecifications() {
    ToolRegistry registry = dispatcher.registry();
    List<McpServerFeatures.SyncToolSpecification> specs = new ArrayList<>();
    for (ToolSpec spec : registry.specs()) {
      Tool tool = new Tool(spec.name(), spec.description(), registry.inputSchema(spec));
      specs.add(
          new McpServerFeatures.SyncToolSpecification(
              tool, (exchange, args) -> handleToolCall(spec.name(), args)));
    }
    return specs;
  }

  CallToolResult handleToolCall(String name, Map<String, Object> args) {
    LOG.debug("Tool call {}", name);
    return dispatcher.invoke(name, args).toCallToolResult(MAPPER);
  }
}
