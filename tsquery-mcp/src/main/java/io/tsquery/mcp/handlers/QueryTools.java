package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.client.QueryResponse;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.dispatch.ToolValidationException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared helpers for tool families. */
abstract class QueryTools {

  /** Runs a listing command; an empty result set yields an empty list. */
  static List<Map<String, String>> list(QuerySession session, QueryCommand command)
      throws IOException, QueryException {
    try {
      return session.execute(command).records();
    } catch (QueryException e) {
      if (e.isEmptyResult()) {
        return List.of();
      }
      throw e;
    }
  }

  static Map<String, Object> listing(String key, List<Map<String, String>> records) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("count", records.size());
    data.put(key, records);
    return data;
  }

  static Map<String, Object> single(QueryResponse response) {
    return new LinkedHashMap<>(response.first());
  }

  static Map<String, Object> ok(String message) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("message", message);
    return data;
  }

  static String requireFor(ToolArguments args, String name, String action) {
    String value = args.string(name);
    if (value == null || value.isBlank()) {
      throw new ToolValidationException(
          "Argument '" + name + "' is required for action " + action);
    }
    return value;
  }

  static int requireIntegerFor(ToolArguments args, String name, String action) {
    Integer value = args.integer(name);
    if (value == null) {
      throw new ToolValidationException(
          "Argument '" + name + "' is required for action " + action);
    }
    return value;
  }

  static ToolValidationException unknownAction(ToolArguments args) {
    return new ToolValidationException(
        "Unknown action '" + args.string("action") + "' for " + args.toolName());
  }

  /** Client database id of a connected client. */
  static int databaseId(QuerySession session, int clientId) throws IOException, QueryException {
    String dbid =
        session
            .execute(QueryCommand.of("clientinfo").param("clid", clientId))
            .firstValue("client_database_id")
            .orElseThrow(
                () ->
                    new ToolValidationException(
                        "Could not get client database ID of client " + clientId));
    try {
      return Integer.parseInt(dbid);
    } catch (NumberFormatException e) {
      throw new ToolValidationException("Invalid client database ID: " + dbid);
    }
  }
}
