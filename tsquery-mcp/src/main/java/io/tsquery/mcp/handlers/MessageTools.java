package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Text messages and pokes. */
final class MessageTools extends QueryTools {

  static final int TARGET_CLIENT = 1;
  static final int TARGET_CHANNEL = 2;

  Map<String, Object> channelMessage(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.integer("channel_id", 0);
    session.execute(
        QueryCommand.of("sendtextmessage")
            .param("targetmode", TARGET_CHANNEL)
            .param("target", channelId)
            .param("msg", args.requireString("message")));
    return ok(channelId == 0 ? "Message sent to current channel" : "Message sent to " + channelId);
  }

  Map<String, Object> privateMessage(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    session.execute(
        QueryCommand.of("sendtextmessage")
            .param("targetmode", TARGET_CLIENT)
            .param("target", clientId)
            .param("msg", args.requireString("message")));
    return ok("Private message sent to client " + clientId);
  }

  Map<String, Object> poke(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int clientId = args.requireInteger("client_id");
    session.execute(
        QueryCommand.of("clientpoke")
            .param("clid", clientId)
            .param("msg", args.requireString("message")));
    return ok("Client " + clientId + " poked");
  }
}
