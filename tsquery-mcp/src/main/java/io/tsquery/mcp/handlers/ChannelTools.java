package io.tsquery.mcp.handlers;

import io.tsquery.client.QueryCommand;
import io.tsquery.client.QueryException;
import io.tsquery.mcp.dispatch.ToolArguments;
import io.tsquery.mcp.dispatch.ToolValidationException;
import io.tsquery.mcp.session.QuerySession;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;

/** Channel listing, lookup, lifecycle, properties and permissions. */
final class ChannelTools extends QueryTools {

  /** Needed talk power presets. */
  enum TalkPowerPreset {
    SILENT(999),
    MODERATED(50),
    NORMAL(0);

    final int talkPower;

    TalkPowerPreset(int talkPower) {
      this.talkPower = talkPower;
    }

    static TalkPowerPreset parse(String name) {
      try {
        return valueOf(name.trim().toUpperCase());
      } catch (IllegalArgumentException e) {
        throw new ToolValidationException(
            "Unknown preset '" + name + "', expected silent, moderated or normal");
      }
    }
  }

  Map<String, Object> listChannels(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    return listing("channels", list(session, QueryCommand.of("channellist")));
  }

  Map<String, Object> info(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    Map<String, Object> data =
        single(session.execute(QueryCommand.of("channelinfo").param("cid", channelId)));
    data.put("cid", String.valueOf(channelId));
    return data;
  }

  Map<String, Object> find(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String pattern = args.requireString("pattern");
    return listing(
        "channels", list(session, QueryCommand.of("channelfind").param("pattern", pattern)));
  }

  Map<String, Object> create(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    String name = args.requireString("name");
    Map<String, Object> data =
        single(
            session.execute(
                QueryCommand.of("channelcreate")
                    .param("channel_name", name)
                    .param("channel_flag_permanent", args.bool("permanent", false))
                    .param("cpid", args.integer("parent_id"))));
    data.put("message", "Channel '" + name + "' created");
    return data;
  }

  Map<String, Object> delete(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    session.execute(
        QueryCommand.of("channeldelete")
            .param("cid", channelId)
            .param("force", args.bool("force", false)));
    return ok("Channel " + channelId + " deleted");
  }

  Map<String, Object> update(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    QueryCommand cmd =
        QueryCommand.of("channeledit")
            .param("cid", channelId)
            .param("channel_name", args.string("name"))
            .param("channel_description", args.string("description"))
            .param("channel_password", args.string("password"))
            .param("channel_maxclients", args.integer("max_clients"))
            .param("channel_needed_talk_power", args.integer("talk_power"))
            .param("channel_codec_quality", args.integer("codec_quality"))
            .param("channel_flag_permanent", args.bool("permanent"));
    if (cmd.params().size() == 1) {
      throw new ToolValidationException("No channel properties given to update");
    }
    session.execute(cmd);
    Map<String, Object> data = ok("Channel " + channelId + " updated");
    ArrayList<String> updated = new ArrayList<>(cmd.params().keySet());
    updated.remove("cid");
    data.put("updated", updated);
    return data;
  }

  Map<String, Object> setTalkPower(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    Integer talkPower = args.integer("talk_power");
    String preset = args.string("preset");
    if (preset != null) {
      talkPower = TalkPowerPreset.parse(preset).talkPower;
    }
    if (talkPower == null) {
      throw new ToolValidationException("Either talk_power or preset is required");
    }
    session.execute(
        QueryCommand.of("channeledit")
            .param("cid", channelId)
            .param("channel_needed_talk_power", talkPower));
    Map<String, Object> data = ok("Talk power of channel " + channelId + " set to " + talkPower);
    data.put("talk_power", talkPower);
    return data;
  }

  Map<String, Object> managePermissions(QuerySession session, ToolArguments args)
      throws IOException, QueryException {
    int channelId = args.requireInteger("channel_id");
    String action = args.requireString("action");
    switch (action) {
      case "add" -> {
        String permission = requireFor(args, "permission", action);
        int value = requireIntegerFor(args, "value", action);
        session.execute(
            QueryCommand.of("channeladdperm")
                .param("cid", channelId)
                .param("permsid", permission)
                .param("permvalue", value));
        return ok("Permission " + permission + " set to " + value + " on channel " + channelId);
      }
      case "remove" -> {
        String permission = requireFor(args, "permission", action);
        session.execute(
            QueryCommand.of("channeldelperm").param("cid", channelId).param("permsid", permission));
        return ok("Permission " + permission + " removed from channel " + channelId);
      }
      case "list" -> {
        QueryCommand cmd =
            QueryCommand.of("channelpermlist").param("cid", channelId).option("permsid");
        return listing("permissions", list(session, cmd));
      }
      default -> throw unknownAction(args);
    }
  }
}
