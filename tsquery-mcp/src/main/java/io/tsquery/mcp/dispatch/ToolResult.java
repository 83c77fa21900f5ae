package io.tsquery.mcp.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized outcome of a tool invocation: either result data or a categorized error.
 *
 * @param success whether the handler completed
 * @param data result data, empty for errors
 * @param errorKind error category, {@code null} on success
 * @param message error message, {@code null} on success
 * @param errorId remote status id when the server rejected a command
 * @param hint remediation advice for recognized failures
 */
public record ToolResult(
    boolean success,
    Map<String, Object> data,
    ErrorKind errorKind,
    String message,
    Integer errorId,
    String hint) {

  public ToolResult {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public static ToolResult success(Map<String, Object> data) {
    return new ToolResult(true, data, null, null, null, null);
  }

  public static ToolResult error(ErrorKind kind, String message) {
    return new ToolResult(false, null, kind, message, null, null);
  }

  public static ToolResult error(ErrorKind kind, String message, Integer errorId, String hint) {
    return new ToolResult(false, null, kind, message, errorId, hint);
  }

  public ToolResult withDetails(Map<String, Object> details) {
    return new ToolResult(success, details, errorKind, message, errorId, hint);
  }

  public boolean isError() {
    return !success;
  }

  /** Renders the envelope as a single JSON text content. */
  public CallToolResult toCallToolResult(ObjectMapper mapper) {
    return success ? successResult(mapper, data) : errorResult(mapper);
  }

  private static CallToolResult successResult(ObjectMapper mapper, Map<String, Object> data) {
    try {
      String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
      return new CallToolResult(List.of(new TextContent(json)), false);
    } catch (Exception e) {
      return new CallToolResult(List.of(new TextContent(data.toString())), false);
    }
  }

  private CallToolResult errorResult(ObjectMapper mapper) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("error", message);
    error.put("success", false);
    error.put("kind", errorKind.name());
    if (errorId != null) {
      error.put("errorId", errorId);
    }
    if (hint != null) {
      error.put("hint", hint);
    }
    if (!data.isEmpty()) {
      error.put("details", data);
    }
    try {
      String json = mapper.writeValueAsString(error);
      return new CallToolResult(List.of(new TextContent(json)), true);
    } catch (Exception e) {
      return new CallToolResult(List.of(new TextContent(message)), true);
    }
  }
}
