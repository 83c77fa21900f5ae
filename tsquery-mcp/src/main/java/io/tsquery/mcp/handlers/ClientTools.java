package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Connected clients: listing, lookup, moves, kicks and bans. */
final class ClientTools extends QueryTools {

  static final int KICK_FROM_CHANNEL = 4;
  static final int KICK_FROM_SERVER = 5;

  Map<String, Object> listClients(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing("clients", list(session, QueryCommand.of("clientlist")));
  }

  Map<String, Object> info(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    return single(session.execute(QueryCommand.of("clientinfo").param("clid", clientId)));
  }

  Map<String, Object> search(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String pattern = args.requireString("pattern");
    QueryCommand cmd =
        args.bool("search_by_uid", false)
            ? QueryCommand.of("clientdbfind").param("pattern", pattern).option("uid")
            : QueryCommand.of("clientfind").param("pattern", pattern);
    return listing("clients", list(session, cmd));
  }

  Map<String, Object> move(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    int channelId = args.requireInteger("channel_id");
    session.execute(QueryCommand.of("clientmove").param("clid", clientId).param("cid", channelId));
    return ok("Client " + clientId + " moved to channel " + channelId);
  }

  Map<String, Object> kick(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    boolean fromServer = args.bool("from_server", false);
    String reason = args.string("reason");
    session.execute(
        QueryCommand.of("clientkick")
            .param("clid", clientId)
            .param("reasonid", fromServer ? KICK_FROM_SERVER : KICK_FROM_CHANNEL)
            .param("reasonmsg", reason));
    Map<String, Object> data =
        ok("Client " + clientId + " kicked from " + (fromServer ? "server" : "channel"));
    data.put("reason", reason);
    return data;
  }

  Map<String, Object> ban(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    int duration = args.integer("duration", 0);
    Map<String, Object> data =
        single(
            session.execute(
                QueryCommand.of("banclient")
                    .param("clid", clientId)
                    .param("time", duration)
                    .param("banreason", args.string("reason"))));
    String span = duration == 0 ? "permanently" : "for " + duration + " seconds";
    data.put("message", "Client " + clientId + " banned " + span);
    return data;
  }
}
