package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.Map;

/** Channel file repositories and file transfers. */
final class FileTools extends QueryTools {

  Map<String, Object> listFiles(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    String path = args.string("path", "/");
    Map<String, Object> data =
        listing(
            "files",
            list(
                session,
                QueryCommand.of("ftgetfilelist")
                    .param("cid", channelId)
                    .param("cpw", args.string("channel_password", ""))
                    .param("path", path)));
    data.put("path", path);
    return data;
  }

  Map<String, Object> fileInfo(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return single(
        session.execute(
            QueryCommand.of("ftgetfileinfo")
                .param("cid", args.requireInteger("channel_id"))
                .param("cpw", args.string("channel_password", ""))
                .param("name", args.requireString("file_path"))));
  }

  Map<String, Object> manageTransfers(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String action = args.requireString("action");
    switch (action) {
      case "list_transfers" -> {
        return listing("transfers", list(session, QueryCommand.of("ftlist")));
      }
      case "stop_transfer" -> {
        int transferId = requireIntegerFor(args, "transfer_id", action);
        session.execute(
            QueryCommand.of("ftstop")
                .param("serverftfid", transferId)
                .param("delete", args.bool("delete_partial", false)));
        return ok("File transfer " + transferId + " stopped");
      }
      default -> throw unknownAction(args);
    }
  }
}
