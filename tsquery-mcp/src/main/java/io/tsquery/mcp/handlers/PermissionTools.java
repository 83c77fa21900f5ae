package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Server groups, group and client permissions, privilege keys. */
final class PermissionTools extends QueryTools {

  Map<String, Object> listServerGroups(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing("groups", list(session, QueryCommand.of("servergrouplist")));
  }

  Map<String, Object> createServerGroup(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String name = args.requireString("name");
    Map<String, Object> data =
        single(
            session.execute(
                QueryCommand.of("servergroupadd")
                    .param("name", name)
                    .param("type", args.integer("type", 1))));
    data.put("message", "Server group '" + name + "' created");
    return data;
  }

  Map<String, Object> assignClient(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int dbid = args.requireInteger("client_database_id");
    int groupId = args.requireInteger("group_id");
    String action = args.requireString("action");
    switch (action) {
      case "add" -> {
        session.execute(
            QueryCommand.of("servergroupaddclient").param("sgid", groupId).param("cldbid", dbid));
        return ok("Client " + dbid + " added to server group " + groupId);
      }
      case "remove" -> {
        session.execute(
            QueryCommand.of("servergroupdelclient").param("sgid", groupId).param("cldbid", dbid));
        return ok("Client " + dbid + " removed from server group " + groupId);
      }
      default -> throw unknownAction(args);
    }
  }

  Map<String, Object> manageGroupPermissions(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int groupId = args.requireInteger("group_id");
    String action = args.requireString("action");
    switch (action) {
      case "add" -> {
        String permission = requireFor(args, "permission", action);
        int value = requireIntegerFor(args, "value", action);
        session.execute(
            QueryCommand.of("servergroupaddperm")
                .param("sgid", groupId)
                .param("permsid", permission)
                .param("permvalue", value)
                .param("permnegated", args.bool("negate", false))
                .param("permskip", args.bool("skip", false)));
        return ok("Permission " + permission + " set to " + value + " on server group " + groupId);
      }
      case "remove" -> {
        String permission = requireFor(args, "permission", action);
        session.execute(
            QueryCommand.of("servergroupdelperm")
                .param("sgid", groupId)
                .param("permsid", permission));
        return ok("Permission " + permission + " removed from server group " + groupId);
      }
      case "list" -> {
        return listing(
            "permissions",
            list(
                session,
                QueryCommand.of("servergrouppermlist").param("sgid", groupId).option("permsid")));
      }
      default -> throw unknownAction(args);
    }
  }

  Map<String, Object> manageUserPermissions(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    String action = args.requireString("action");
    switch (action) {
      case "add_group" -> {
        int groupId = requireIntegerFor(args, "group_id", action);
        int dbid = databaseId(session, clientId);
        session.execute(
            QueryCommand.of("servergroupaddclient").param("sgid", groupId).param("cldbid", dbid));
        return ok("Client " + clientId + " added to server group " + groupId);
      }
      case "remove_group" -> {
        int groupId = requireIntegerFor(args, "group_id", action);
        int dbid = databaseId(session, clientId);
        session.execute(
            QueryCommand.of("servergroupdelclient").param("sgid", groupId).param("cldbid", dbid));
        return ok("Client " + clientId + " removed from server group " + groupId);
      }
      case "list_groups" -> {
        int dbid = databaseId(session, clientId);
        return listing(
            "groups",
            list(session, QueryCommand.of("servergroupsbyclientid").param("cldbid", dbid)));
      }
      case "add_permission" -> {
        String permission = requireFor(args, "permission", action);
        int value = requireIntegerFor(args, "value", action);
        int dbid = databaseId(session, clientId);
        session.execute(
            QueryCommand.of("clientaddperm")
                .param("cldbid", dbid)
                .param("permsid", permission)
                .param("permvalue", value)
                .param("permskip", args.bool("skip", false)));
        return ok("Permission " + permission + " set to " + value + " for client " + clientId);
      }
      case "remove_permission" -> {
        String permission = requireFor(args, "permission", action);
        int dbid = databaseId(session, clientId);
        session.execute(
            QueryCommand.of("clientdelperm").param("cldbid", dbid).param("permsid", permission));
        return ok("Permission " + permission + " removed from client " + clientId);
      }
      case "list_permissions" -> {
        int dbid = databaseId(session, clientId);
        QueryCommand cmd =
            QueryCommand.of("clientpermlist").param("cldbid", dbid).option("permsid");
        return listing("permissions", list(session, cmd));
      }
      default -> throw unknownAction(args);
    }
  }

  Map<String, Object> listTokens(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing("tokens", list(session, QueryCommand.of("privilegekeylist")));
  }

  Map<String, Object> createToken(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int tokenType = args.requireInteger("token_type");
    int groupId = args.requireInteger("group_id");
    Map<String, Object> data =
        single(
            session.execute(
                QueryCommand.of("privilegekeyadd")
                    .param("tokentype", tokenType)
                    .param("tokenid1", groupId)
                    .param("tokenid2", args.integer("channel_id", 0))
                    .param("tokendescription", args.string("description"))
                    .param("tokencustomset", args.string("custom_set"))));
    data.put("token_type", tokenType == 0 ? "server_group" : "channel_group");
    data.put("group_id", groupId);
    return data;
  }
}
