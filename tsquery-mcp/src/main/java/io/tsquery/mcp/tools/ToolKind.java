package io.tsquery.mcp.tools;

import static io.tsquery.mcp.tools.ArgSpec.optional;
import static io.tsquery.mcp.tools.ArgSpec.required;
import static io.tsquery.mcp.tools.ArgSpec.withDefault;
import static io.tsquery.mcp.tools.ArgType.BOOLEAN;
import static io.tsquery.mcp.tools.ArgType.INTEGER;
import static io.tsquery.mcp.tools.ArgType.STRING;

import java.util.List;

/**
 * Every tool the server exposes. The enum is the compile-time catalog; {@link ToolRegistry} indexes
 * it by wire name.
 */
public enum ToolKind {

  // ─────────────────────────────────────────────────────────────────────────────
  // Connection and server
  // ─────────────────────────────────────────────────────────────────────────────

  CONNECT_TO_SERVER(
      "connect_to_server",
      "Connects to the configured TeamSpeak server (or the one given in teamspeak_credentials) "
          + "and reports the privilege level that authentication achieved."),

  SERVER_INFO("server_info", "Returns virtual server information."),

  GET_CONNECTION_INFO(
      "get_connection_info", "Returns every property of the virtual server, including traffic."),

  UPDATE_SERVER_SETTINGS(
      "update_server_settings",
      "Updates virtual server settings (name, welcome message, max clients, password, etc.).",
      optional("name", STRING, "Server name"),
      optional("welcome_message", STRING, "Server welcome message"),
      optional("max_clients", INTEGER, "Maximum number of clients"),
      optional("password", STRING, "Server password, empty string to remove"),
      optional("hostmessage", STRING, "Host message displayed in server info"),
      optional(
              "hostmessage_mode", INTEGER, "Host message mode: 0=none, 1=log, 2=modal, 3=modalquit")
          .oneOf(0, 1, 2, 3),
      optional("default_server_group", INTEGER, "Default server group ID for new clients"),
      optional("default_channel_group", INTEGER, "Default channel group ID for new clients")),

  DIAGNOSE_PERMISSIONS(
      "diagnose_permissions",
      "Probes commands of increasing privilege and reports which ones the session may run."),

  CREATE_SERVER_SNAPSHOT(
      "create_server_snapshot", "Creates a snapshot of the virtual server configuration."),

  DEPLOY_SERVER_SNAPSHOT(
      "deploy_server_snapshot",
      "Restores a virtual server configuration from a snapshot.",
      required("snapshot_data", STRING, "Snapshot data from create_server_snapshot")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Messaging
  // ─────────────────────────────────────────────────────────────────────────────

  SEND_CHANNEL_MESSAGE(
      "send_channel_message",
      "Sends a text message to a channel.",
      optional("channel_id", INTEGER, "Channel ID, current channel if not specified"),
      required("message", STRING, "Message to send")),

  SEND_PRIVATE_MESSAGE(
      "send_private_message",
      "Sends a private text message to a client.",
      required("client_id", INTEGER, "Target client ID"),
      required("message", STRING, "Message to send")),

  POKE_CLIENT(
      "poke_client",
      "Sends a poke (alert notification) to a client.",
      required("client_id", INTEGER, "Target client ID"),
      required("message", STRING, "Poke message")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Clients
  // ─────────────────────────────────────────────────────────────────────────────

  LIST_CLIENTS("list_clients", "Lists all clients connected to the virtual server."),

  CLIENT_INFO_DETAILED(
      "client_info_detailed",
      "Returns detailed information about a connected client.",
      required("client_id", INTEGER, "Client ID")),

  SEARCH_CLIENTS(
      "search_clients",
      "Searches clients by nickname pattern or by unique identifier.",
      required("pattern", STRING, "Nickname pattern or unique identifier"),
      withDefault("search_by_uid", BOOLEAN, false, "Search the client database by UID")),

  MOVE_CLIENT(
      "move_client",
      "Moves a client to another channel.",
      required("client_id", INTEGER, "Client ID"),
      required("channel_id", INTEGER, "Destination channel ID")),

  KICK_CLIENT(
      "kick_client",
      "Kicks a client from its channel or from the server.",
      required("client_id", INTEGER, "Client ID"),
      withDefault("reason", STRING, "Expelled by AI", "Kick reason"),
      withDefault("from_server", BOOLEAN, false, "Kick from server (true) or channel (false)")),

  BAN_CLIENT(
      "ban_client",
      "Bans a connected client.",
      required("client_id", INTEGER, "Client ID"),
      withDefault("reason", STRING, "Banned by AI", "Ban reason"),
      withDefault("duration", INTEGER, 0, "Ban duration in seconds, 0 = permanent")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Channels
  // ─────────────────────────────────────────────────────────────────────────────

  LIST_CHANNELS("list_channels", "Lists all channels of the virtual server."),

  CHANNEL_INFO(
      "channel_info",
      "Returns detailed information about a channel.",
      required("channel_id", INTEGER, "Channel ID")),

  FIND_CHANNELS(
      "find_channels",
      "Searches channels by name pattern.",
      required("pattern", STRING, "Channel name pattern")),

  CREATE_CHANNEL(
      "create_channel",
      "Creates a channel.",
      required("name", STRING, "Channel name"),
      optional("parent_id", INTEGER, "Parent channel ID"),
      withDefault("permanent", BOOLEAN, false, "Permanent (true) or temporary (false) channel")),

  DELETE_CHANNEL(
      "delete_channel",
      "Deletes a channel.",
      required("channel_id", INTEGER, "Channel ID"),
      withDefault("force", BOOLEAN, false, "Delete even if clients are in the channel")),

  UPDATE_CHANNEL(
      "update_channel",
      "Updates channel properties.",
      required("channel_id", INTEGER, "Channel ID"),
      optional("name", STRING, "New channel name"),
      optional("description", STRING, "New channel description"),
      optional("password", STRING, "New channel password, empty string to remove"),
      optional("max_clients", INTEGER, "Maximum number of clients"),
      optional("talk_power", INTEGER, "Talk power needed to speak"),
      optional("codec_quality", INTEGER, "Audio codec quality 1-10"),
      optional("permanent", BOOLEAN, "Make the channel permanent")),

  SET_CHANNEL_TALK_POWER(
      "set_channel_talk_power",
      "Sets the talk power needed to speak in a channel, directly or through a preset.",
      required("channel_id", INTEGER, "Channel ID"),
      optional("talk_power", INTEGER, "Needed talk power (0 = everyone, 999 = silent)"),
      optional("preset", STRING, "Preset: silent (999), moderated (50), normal (0)")
          .oneOf("silent", "moderated", "normal")),

  MANAGE_CHANNEL_PERMISSIONS(
      "manage_channel_permissions",
      "Adds, removes or lists permissions of a channel.",
      required("channel_id", INTEGER, "Channel ID"),
      required("action", STRING, "Action to perform").oneOf("add", "remove", "list"),
      optional("permission", STRING, "Permission name, required for add/remove"),
      optional("value", INTEGER, "Permission value, required for add")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Groups and permissions
  // ─────────────────────────────────────────────────────────────────────────────

  LIST_SERVER_GROUPS("list_server_groups", "Lists the server groups of the virtual server."),

  CREATE_SERVER_GROUP(
      "create_server_group",
      "Creates a server group.",
      required("name", STRING, "Group name"),
      withDefault("type", INTEGER, 1, "Group type: 0=template, 1=regular, 2=query")
          .oneOf(0, 1, 2)),

  ASSIGN_CLIENT_TO_GROUP(
      "assign_client_to_group",
      "Adds a client database entry to, or removes it from, a server group.",
      required("client_database_id", INTEGER, "Client database ID"),
      required("action", STRING, "Action to perform").oneOf("add", "remove"),
      required("group_id", INTEGER, "Server group ID")),

  MANAGE_SERVER_GROUP_PERMISSIONS(
      "manage_server_group_permissions",
      "Adds, removes or lists permissions of a server group.",
      required("group_id", INTEGER, "Server group ID"),
      required("action", STRING, "Action to perform").oneOf("add", "remove", "list"),
      optional("permission", STRING, "Permission name, required for add/remove"),
      optional("value", INTEGER, "Permission value, required for add"),
      withDefault("skip", BOOLEAN, false, "Skip flag"),
      withDefault("negate", BOOLEAN, false, "Negate flag")),

  MANAGE_USER_PERMISSIONS(
      "manage_user_permissions",
      "Manages server group membership and individual permissions of a connected client.",
      required("client_id", INTEGER, "Client ID"),
      required("action", STRING, "Action to perform")
          .oneOf(
              "add_group",
              "remove_group",
              "list_groups",
              "add_permission",
              "remove_permission",
              "list_permissions"),
      optional("group_id", INTEGER, "Server group ID, required for add_group/remove_group"),
      optional("permission", STRING, "Permission name, required for add/remove_permission"),
      optional("value", INTEGER, "Permission value, required for add_permission"),
      withDefault("skip", BOOLEAN, false, "Skip flag"),
      withDefault("negate", BOOLEAN, false, "Negate flag")),

  LIST_PRIVILEGE_TOKENS("list_privilege_tokens", "Lists the privilege keys of the virtual server."),

  CREATE_PRIVILEGE_TOKEN(
      "create_privilege_token",
      "Creates a privilege key granting a server group or channel group.",
      required("token_type", INTEGER, "0 = server group, 1 = channel group").oneOf(0, 1),
      required("group_id", INTEGER, "Server group ID or channel group ID"),
      withDefault("channel_id", INTEGER, 0, "Channel ID, required for channel group keys"),
      optional("description", STRING, "Key description"),
      optional("custom_set", STRING, "Custom client properties (ident=value|ident=value)")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Bans and complaints
  // ─────────────────────────────────────────────────────────────────────────────

  LIST_BANS("list_bans", "Lists the active ban rules."),

  MANAGE_BAN_RULES(
      "manage_ban_rules",
      "Adds a ban rule, deletes one or deletes all of them.",
      required("action", STRING, "Action to perform").oneOf("add", "delete", "delete_all"),
      optional("ban_id", INTEGER, "Ban ID, required for delete"),
      optional("ip", STRING, "IP address pattern"),
      optional("name", STRING, "Nickname pattern"),
      optional("uid", STRING, "Client unique identifier"),
      withDefault("time", INTEGER, 0, "Ban duration in seconds, 0 = permanent"),
      withDefault("reason", STRING, "Banned by AI", "Ban reason")),

  LIST_COMPLAINTS(
      "list_complaints",
      "Lists complaints, optionally only those about one client.",
      optional("target_client_database_id", INTEGER, "Target client database ID")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Files
  // ─────────────────────────────────────────────────────────────────────────────

  LIST_FILES(
      "list_files",
      "Lists files in a channel's file repository.",
      required("channel_id", INTEGER, "Channel ID"),
      withDefault("path", STRING, "/", "Directory path"),
      optional("channel_password", STRING, "Channel password if required")),

  GET_FILE_INFO(
      "get_file_info",
      "Returns information about a file in a channel's file repository.",
      required("channel_id", INTEGER, "Channel ID"),
      required("file_path", STRING, "Full path of the file"),
      optional("channel_password", STRING, "Channel password if required")),

  MANAGE_FILE_PERMISSIONS(
      "manage_file_permissions",
      "Lists running file transfers or stops one.",
      required("action", STRING, "Action to perform").oneOf("list_transfers", "stop_transfer"),
      optional("transfer_id", INTEGER, "Server file transfer ID, required for stop_transfer"),
      withDefault("delete_partial", BOOLEAN, false, "Delete the partial file when stopping")),

  // ─────────────────────────────────────────────────────────────────────────────
  // Logs
  // ─────────────────────────────────────────────────────────────────────────────

  VIEW_SERVER_LOGS(
      "view_server_logs",
      "Reads the virtual server log. complete_mode=true pages through the whole log.",
      withDefault("lines", INTEGER, 50, "Lines per page (1-100)"),
      withDefault("reverse", BOOLEAN, true, "Newest first"),
      withDefault("instance_log", BOOLEAN, false, "Read the instance log instead"),
      optional("begin_pos", INTEGER, "Start position in the log file"),
      optional("log_level", INTEGER, "1=ERROR, 2=WARNING, 3=DEBUG, 4=INFO").oneOf(1, 2, 3, 4),
      optional("timestamp_from", INTEGER, "Unix timestamp lower bound"),
      optional("timestamp_to", INTEGER, "Unix timestamp upper bound"),
      withDefault("complete_mode", BOOLEAN, false, "Page through the whole log"),
      withDefault("max_iterations", INTEGER, 1000, "Page limit in complete mode"),
      withDefault("enhanced_debug", BOOLEAN, false, "Include pagination diagnostics")),

  GET_INSTANCE_LOGS(
      "get_instance_logs",
      "Reads the server instance log.",
      withDefault("lines", INTEGER, 50, "Lines to read (1-100)"),
      withDefault("reverse", BOOLEAN, true, "Newest first"),
      optional("begin_pos", INTEGER, "Start position in the log file")),

  ADD_LOG_ENTRY(
      "add_log_entry",
      "Writes a custom entry to the virtual server log.",
      required("log_level", INTEGER, "1=ERROR, 2=WARNING, 3=DEBUG, 4=INFO").oneOf(1, 2, 3, 4),
      required("message", STRING, "Log message"));

  private final ToolSpec spec;

  ToolKind(String toolName, String description, ArgSpec... arguments) {
    this.spec = new ToolSpec(this, toolName, description, List.of(arguments));
  }

  public ToolSpec spec() {
    return spec;
  }

  public String toolName() {
    return spec.name();
  }
}
