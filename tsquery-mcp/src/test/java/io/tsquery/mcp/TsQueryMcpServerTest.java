package io.tsquery.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.tsquery.mcp.config.McpServerConfig;
import io.tsquery.mcp.session.ConnectionManager;
import io.tsquery.mcp.session.ServerCredentials;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/** Exercises the MCP surface without starting a transport. */
@UnitTest
class TsQueryMcpServerTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private FakeQueryClient client;
  private TsQueryMcpServer server;

  @BeforeEach
  void setUp() {
    client = new FakeQueryClient();
    ConnectionManager connections =
        new ConnectionManager(
            new ServerCredentials("localhost", 10011, "serveradmin", "secret", 1),
            client.factory());
    server = new TsQueryMcpServer(McpServerConfig.defaults(), connections);
  }

  private static JsonNode body(CallToolResult result) throws Exception {
    return MAPPER.readTree(((TextContent) result.content().get(0)).text());
  }

  @Test
  void registersEveryTool() {
    List<McpServerFeatures.SyncToolSpecification> specs = server.createToolSpecifications();

    assertEquals(40, specs.size());
    List<String> names =
        specs.stream().map(s -> s.tool().name()).collect(Collectors.toList());
    assertTrue(names.contains("connect_to_server"));
    assertTrue(names.contains("view_server_logs"));
    assertEquals(names.size(), names.stream().distinct().count());
  }

  @Test
  void successfulCallReturnsJsonData() throws Exception {
    client.on("channellist", "cid=1 channel_name=Lobby");

    CallToolResult result = server.handleToolCall("list_channels", Map.of());

    assertNotEquals(Boolean.TRUE, result.isError());
    JsonNode body = body(result);
    assertEquals(1, body.get("count").asInt());
    assertEquals("Lobby", body.get("channels").get(0).get("channel_name").asText());
  }

  @Test
  void validationFailureIsToolError() throws Exception {
    CallToolResult result = server.handleToolCall("kick_client", Map.of());

    assertEquals(Boolean.TRUE, result.isError());
    JsonNode body = body(result);
    assertFalse(body.get("success").asBoolean());
    assertEquals("VALIDATION", body.get("kind").asText());
    assertTrue(body.get("error").asText().contains("client_id"));
  }

  @Test
  void remoteErrorCarriesErrorId() throws Exception {
    client.onError("serverinfo", 2568, "insufficient client permissions");

    CallToolResult result = server.handleToolCall("server_info", Map.of());

    assertEquals(Boolean.TRUE, result.isError());
    assertEquals(2568, body(result).get("errorId").asInt());
    assertTrue(body(result).get("hint").asText().contains("servergroupaddclient"));
  }

  @Test
  void launcherRejectsUnknownOptionsWithUsageCode() {
    CommandLine cmd = new CommandLine(new TsQueryMcpServer.Launcher());
    cmd.setErr(new PrintWriter(new StringWriter()));

    assertEquals(CommandLine.ExitCode.USAGE, cmd.execute("--no-such-option"));
  }

  @Test
  void launcherPrintsHelpWithoutStarting() {
    StringWriter out = new StringWriter();
    CommandLine cmd = new CommandLine(new TsQueryMcpServer.Launcher());
    cmd.setOut(new PrintWriter(out));

    assertEquals(CommandLine.ExitCode.OK, cmd.execute("--help"));
    assertTrue(out.toString().contains("--server-id"));
  }
}
