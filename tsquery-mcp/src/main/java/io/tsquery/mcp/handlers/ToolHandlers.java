package io.tsquery.mcp.handlers;

import io.tsquery.mcp.dispatch.ToolHandler;
import io.tsquery.mcp.logs.LogPaginator;
import io.tsquery.mcp.tools.ToolKind;
import java.util.EnumMap;
import java.util.Map;

/** Binds every {@link ToolKind} to its implementation. */
public final class ToolHandlers {

  private ToolHandlers() {}

  public static Map<ToolKind, ToolHandler> create(LogPaginator paginator) {
    ServerTools server = new ServerTools();
    MessageTools messages = new MessageTools();
    ClientTools clients = new ClientTools();
    ChannelTools channels = new ChannelTools();
    PermissionTools permissions = new PermissionTools();
    BanTools bans = new BanTools();
    FileTools files = new FileTools();
    LogTools logs = new LogTools(paginator);

    Map<ToolKind, ToolHandler> handlers = new EnumMap<>(ToolKind.class);
    for (ToolKind kind : ToolKind.values()) {
      ToolHandler handler =
          switch (kind) {
            case CONNECT_TO_SERVER -> server::connect;
            case SERVER_INFO -> server::serverInfo;
            case GET_CONNECTION_INFO -> server::connectionInfo;
            case UPDATE_SERVER_SETTINGS -> server::updateSettings;
            case DIAGNOSE_PERMISSIONS -> server::diagnose;
            case CREATE_SERVER_SNAPSHOT -> server::createSnapshot;
            case DEPLOY_SERVER_SNAPSHOT -> server::deploySnapshot;
            case SEND_CHANNEL_MESSAGE -> messages::channelMessage;
            case SEND_PRIVATE_MESSAGE -> messages::privateMessage;
            case POKE_CLIENT -> messages::poke;
            case LIST_CLIENTS -> clients::listClients;
            case CLIENT_INFO_DETAILED -> clients::info;
            case SEARCH_CLIENTS -> clients::search;
            case MOVE_CLIENT -> clients::move;
            case KICK_CLIENT -> clients::kick;
            case BAN_CLIENT -> clients::ban;
            case LIST_CHANNELS -> channels::listChannels;
            case CHANNEL_INFO -> channels::info;
            case FIND_CHANNELS -> channels::find;
            case CREATE_CHANNEL -> channels::create;
            case DELETE_CHANNEL -> channels::delete;
            case UPDATE_CHANNEL -> channels::update;
            case SET_CHANNEL_TALK_POWER -> channels::setTalkPower;
            case MANAGE_CHANNEL_PERMISSIONS -> channels::managePermissions;
            case LIST_SERVER_GROUPS -> permissions::listServerGroups;
            case CREATE_SERVER_GROUP -> permissions::createServerGroup;
            case ASSIGN_CLIENT_TO_GROUP -> permissions::assignClient;
            case MANAGE_SERVER_GROUP_PERMISSIONS -> permissions::manageGroupPermissions;
            case MANAGE_USER_PERMISSIONS -> permissions::manageUserPermissions;
            case LIST_PRIVILEGE_TOKENS -> permissions::listTokens;
            case CREATE_PRIVILEGE_TOKEN -> permissions::createToken;
            case LIST_BANS -> bans::listBans;
            case MANAGE_BAN_RULES -> bans::manageRules;
            case LIST_COMPLAINTS -> bans::listComplaints;
            case LIST_FILES -> files::listFiles;
            case GET_FILE_INFO -> files::fileInfo;
            case MANAGE_FILE_PERMISSIONS -> files::manageTransfers;
            case VIEW_SERVER_LOGS -> logs::viewServerLogs;
            case GET_INSTANCE_LOGS -> logs::instanceLogs;
            case ADD_LOG_ENTRY -> logs::addEntry;
          };
      handlers.put(kind, handler);
    }
    return handlers;
  }
}
