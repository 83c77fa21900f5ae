package io.tsquery.mcp.session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection parameters for one ServerQuery session.
 *
 * <p>Resolution order for every field: explicit value, then the process environment, then the
 * built-in default.
 *
 * @param host ServerQuery host
 * @param port ServerQuery port
 * @param user login name
 * @param password login password or privilege key, empty for anonymous access
 * @param serverId virtual server to select after connecting
 */
public record ServerCredentials(String host, int port, String user, String password, int serverId) {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 10011;
  public static final String DEFAULT_USER = "serveradmin";
  public static final int DEFAULT_SERVER_ID = 1;

  public static final String ENV_HOST = "TEAMSPEAK_HOST";
  public static final String ENV_PORT = "TEAMSPEAK_PORT";
  public static final String ENV_USER = "TEAMSPEAK_USER";
  public static final String ENV_PASSWORD = "TEAMSPEAK_PASSWORD";
  public static final String ENV_SERVER_ID = "TEAMSPEAK_SERVER_ID";

  public ServerCredentials {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Host must not be blank");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    if (serverId < 0) {
      throw new IllegalArgumentException("Server ID must not be negative: " + serverId);
    }
    user = user == null || user.isBlank() ? DEFAULT_USER : user;
    password = password == null ? "" : password;
  }

  /** Built-in defaults: {@code localhost:10011}, user {@code serveradmin}, no password. */
  public static ServerCredentials defaults() {
    return new ServerCredentials(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_USER, "", DEFAULT_SERVER_ID);
  }

  /**
   * Builds credentials from {@code TEAMSPEAK_*} environment variables over the defaults.
   *
   * @param env environment, usually {@link System#getenv()}
   * @return resolved credentials
   * @throws IllegalArgumentException if a numeric variable cannot be parsed
   */
  public static ServerCredentials fromEnvironment(Map<String, String> env) {
    ServerCredentials d = defaults();
    return new ServerCredentials(
        nonBlank(env.get(ENV_HOST), d.host()),
        toInt(env.get(ENV_PORT), d.port(), ENV_PORT),
        nonBlank(env.get(ENV_USER), d.user()),
        env.getOrDefault(ENV_PASSWORD, d.password()),
        toInt(env.get(ENV_SERVER_ID), d.serverId(), ENV_SERVER_ID));
  }

  /**
   * Applies a per-call credentials object on top of these credentials. Absent keys keep the
   * current values.
   *
   * @param overrides map with optional {@code host}, {@code port}, {@code user}, {@code password}
   *     and {@code server_id}; numeric values may be numbers or numeric strings
   * @return merged credentials, equal to {@code this} when nothing differs
   * @throws IllegalArgumentException if a numeric value cannot be parsed
   */
  public ServerCredentials withOverrides(Map<String, ?> overrides) {
    if (overrides == null || overrides.isEmpty()) {
      return this;
    }
    return new ServerCredentials(
        nonBlank(text(overrides.get("host")), host),
        toInt(overrides.get("port"), port, "port"),
        nonBlank(text(overrides.get("user")), user),
        overrides.containsKey("password") ? text(overrides.get("password")) : password,
        toInt(overrides.get("server_id"), serverId, "server_id"));
  }

  public boolean hasPassword() {
    return !password.isEmpty();
  }

  /** Returns a loggable description; the password is reduced to {@code [SET]}/{@code [NOT SET]}. */
  public Map<String, Object> describe() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("host", host);
    map.put("port", port);
    map.put("user", user);
    map.put("password", hasPassword() ? "[SET]" : "[NOT SET]");
    map.put("serverId", serverId);
    return map;
  }

  @Override
  public String toString() {
    return user + "@" + host + ":" + port + "/" + serverId;
  }

  private static String text(Object value) {
    return value == null ? null : String.valueOf(value);
  }

  private static String nonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static int toInt(Object value, int fallback, String name) {
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number n) {
      return n.intValue();
    }
    String s = value.toString().trim();
    if (s.isEmpty()) {
      return fallback;
    }
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + name + ": '" + s + "'");
    }
  }
}
