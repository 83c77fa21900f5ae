package io.tsquery.mcp.config;

import java.util.HashMap;
import java.util.Map;
import picocli.CommandLine;

/** Command line options. Unset options fall back to the environment, then to defaults. */
public class CliOptions {

  @CommandLine.Option(names = "--stdio", description = "Use stdio transport instead of HTTP/SSE")
  boolean stdio;

  @CommandLine.Option(names = "--host", description = "ServerQuery host")
  String host;

  @CommandLine.Option(names = "--port", description = "ServerQuery port")
  Integer port;

  @CommandLine.Option(names = "--user", description = "ServerQuery login name")
  String user;

  @CommandLine.Option(names = "--password", description = "Login password or privilege key")
  String password;

  @CommandLine.Option(names = "--server-id", description = "Virtual server id")
  Integer serverId;

  /** Parses arguments; throws {@link CommandLine.ParameterException} on bad input. */
  public static CliOptions parse(String... args) {
    CliOptions options = new CliOptions();
    new CommandLine(options).parseArgs(args);
    return options;
  }

  public boolean stdio() {
    return stdio;
  }

  /** Options given on the command line, keyed like credential overrides. */
  Map<String, Object> credentialOverrides() {
    Map<String, Object> overrides = new HashMap<>();
    putIfSet(overrides, "host", host);
    putIfSet(overrides, "port", port);
    putIfSet(overrides, "user", user);
    putIfSet(overrides, "password", password);
    putIfSet(overrides, "server_id", serverId);
    return overrides;
  }

  private static void putIfSet(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }
}
