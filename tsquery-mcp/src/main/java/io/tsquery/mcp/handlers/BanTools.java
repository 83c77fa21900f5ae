package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.dispatch.ToolValidationException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Ban rules and complaints. */
final class BanTools extends QueryTools {

  Map<String, Object> listBans(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing("bans", list(session, QueryCommand.of("banlist")));
  }

  Map<String, Object> manageRules(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String action = args.requireString("action");
    switch (action) {
      case "add" -> {
        String ip = args.string("ip");
        String name = args.string("name");
        String uid = args.string("uid");
        if (ip == null && name == null && uid == null) {
          throw new ToolValidationException("At least one of ip, name or uid is required for add");
        }
        Map<String, Object> data =
            single(
                session.execute(
                    QueryCommand.of("banadd")
                        .param("ip", ip)
                        .param("name", name)
                        .param("uid", uid)
                        .param("time", args.integer("time", 0))
                        .param("banreason", args.string("reason"))));
        data.put("message", "Ban rule added");
        return data;
      }
      case "delete" -> {
        int banId = requireIntegerFor(args, "ban_id", action);
        session.execute(QueryCommand.of("bandel").param("banid", banId));
        return ok("Ban rule " + banId + " deleted");
      }
      case "delete_all" -> {
        session.execute(QueryCommand.of("bandelall"));
        return ok("All ban rules deleted");
      }
      default -> throw unknownAction(args);
    }
  }

  Map<String, Object> listComplaints(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing(
        "complaints",
        list(
            session,
            QueryCommand.of("complainlist")
                .param("tcldbid", args.integer("target_client_database_id"))));
  }
}
