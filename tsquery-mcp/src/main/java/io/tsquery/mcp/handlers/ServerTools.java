package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.dispatch.ToolValidationException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Connection, server settings, diagnostics and snapshots. */
final class ServerTools extends QueryTools {

  Map<String, Object> connect(QuerySession session, ToolArguments args) throws IOException {
    Map<String, Object> data = session.toMap();
    try {
      data.put("whoami", session.client().whoami().first());
    } catch (QueryException e) {
      data.put("whoami_error", e.getMessage());
    }
    return data;
  }

  Map<String, Object> serverInfo(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    Map<String, String> info = session.execute(QueryCommand.of("serverinfo")).first();
    Map<String, Object> data = new LinkedHashMap<>();
    for (String key :
        List.of(
            "virtualserver_name",
            "virtualserver_version",
            "virtualserver_platform",
            "virtualserver_clientsonline",
            "virtualserver_maxclients",
            "virtualserver_uptime",
            "virtualserver_port",
            "virtualserver_created",
            "virtualserver_autostart",
            "virtualserver_machine_id",
            "virtualserver_unique_identifier")) {
      if (info.containsKey(key)) {
        data.put(key, info.get(key));
      }
    }
    return data;
  }

  Map<String, Object> connectionInfo(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return single(session.execute(QueryCommand.of("serverinfo")));
  }

  Map<String, Object> updateSettings(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    QueryCommand cmd =
        QueryCommand.of("serveredit")
            .param("virtualserver_name", args.string("name"))
            .param("virtualserver_welcomemessage", args.string("welcome_message"))
            .param("virtualserver_maxclients", args.integer("max_clients"))
            .param("virtualserver_password", args.string("password"))
            .param("virtualserver_hostmessage", args.string("hostmessage"))
            .param("virtualserver_hostmessage_mode", args.integer("hostmessage_mode"))
            .param("virtualserver_default_server_group", args.integer("default_server_group"))
            .param("virtualserver_default_channel_group", args.integer("default_channel_group"));
    if (cmd.params().isEmpty()) {
      throw new ToolValidationException("No settings given to update");
    }
    session.execute(cmd);
    Map<String, Object> data = ok("Server settings updated");
    data.put("updated", new ArrayList<>(cmd.params().keySet()));
    return data;
  }

  Map<String, Object> diagnose(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    Map<String, Object> data = new LinkedHashMap<>();
    Map<String, String> whoami = session.client().whoami().first();
    data.put("whoami", whoami);
    data.put("authLevel", session.authLevel().name());

    List<Map<String, Object>> probes = new ArrayList<>();
    probes.add(probe(session, "server_info", QueryCommand.of("serverinfo")));
    probes.add(probe(session, "list_clients", QueryCommand.of("clientlist")));
    probes.add(probe(session, "list_channels", QueryCommand.of("channellist")));
    String dbid = whoami.get("client_database_id");
    if (dbid != null && !dbid.isEmpty()) {
      probes.add(
          probe(
              session,
              "server_groups",
              QueryCommand.of("servergroupsbyclientid").param("cldbid", dbid)));
    }
    data.put("probes", probes);
    data.put("configuration", session.credentials().describe());
    return data;
  }

  private static Map<String, Object> probe(QuerySession session, String name, QueryCommand cmd)
      throws IOException {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("probe", name);
    try {
      List<Map<String, String>> records = list(session, cmd);
      result.put("ok", true);
      if (cmd.name().equals("servergroupsbyclientid")) {
        result.put("groups", records);
      }
    } catch (QueryException e) {
      result.put("ok", false);
      result.put("errorId", e.getErrorId());
      result.put("error", e.getMessage());
    }
    return result;
  }

  Map<String, Object> createSnapshot(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("snapshot", session.execute(QueryCommand.of("serversnapshotcreate")).records());
    return data;
  }

  Map<String, Object> deploySnapshot(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    session.execute(
        QueryCommand.of("serversnapshotdeploy")
            .param("virtualserver_snapshot", args.requireString("snapshot_data")));
    return ok("Server snapshot deployed");
  }
}
