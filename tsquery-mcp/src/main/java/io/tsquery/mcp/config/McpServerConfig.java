package io.tsquery.mcp.config;

import io.tsquery.mcp.session.ServerCredentials;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import picocli.CommandLine;

/**
 * Process configuration. Sources in increasing precedence: built-in defaults, {@code TEAMSPEAK_*}
 * environment variables, command line options. Transport tuning comes from system properties.
 */
public record McpServerConfig(
    ServerCredentials credentials,
    boolean stdio,
    int httpPort,
    Duration connectTimeout,
    Duration readTimeout,
    Duration logPageDelay) {

  public static final String PROP_HTTP_PORT = "mcp.port";
  public static final String PROP_CONNECT_TIMEOUT = "tsquery.connectTimeoutMs";
  public static final String PROP_READ_TIMEOUT = "tsquery.readTimeoutMs";
  public static final String PROP_LOG_PAGE_DELAY = "tsquery.logPageDelayMs";

  /**
   * Creates default configuration: local server, HTTP/SSE transport.
   *
   * @return default configuration
   */
  public static McpServerConfig defaults() {
    return new McpServerConfig(
        ServerCredentials.defaults(),
        false,
        3000,
        Duration.ofSeconds(5),
        Duration.ofSeconds(10),
        Duration.ofMillis(100));
  }

  /**
   * Loads configuration for this process.
   *
   * @param options parsed command line options
   * @return loaded configuration
   * @throws IllegalArgumentException on malformed environment or property values
   */
  public static McpServerConfig load(CliOptions options) {
    return load(options, System.getenv(), System.getProperties());
  }

  /**
   * Parses the command line and loads configuration from explicit sources.
   *
   * @param args command line arguments
   * @param env environment variables
   * @param props system properties
   * @return loaded configuration
   * @throws CommandLine.ParameterException on unknown options or missing option values
   */
  public static McpServerConfig load(String[] args, Map<String, String> env, Properties props) {
    return load(CliOptions.parse(args), env, props);
  }

  /**
   * Loads configuration from explicit sources.
   *
   * @param options parsed command line options
   * @param env environment variables
   * @param props system properties
   * @return loaded configuration
   */
  public static McpServerConfig load(
      CliOptions options, Map<String, String> env, Properties props) {
    McpServerConfig defaults = defaults();
    ServerCredentials credentials =
        ServerCredentials.fromEnvironment(env).withOverrides(options.credentialOverrides());
    return new McpServerConfig(
        credentials,
        options.stdio(),
        intProperty(props, PROP_HTTP_PORT, defaults.httpPort()),
        millisProperty(props, PROP_CONNECT_TIMEOUT, defaults.connectTimeout()),
        millisProperty(props, PROP_READ_TIMEOUT, defaults.readTimeout()),
        millisProperty(props, PROP_LOG_PAGE_DELAY, defaults.logPageDelay()));
  }

  private static int intProperty(Properties props, String key, int fallback) {
    String v = props.getProperty(key);
    if (v == null || v.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
    }
  }

  private static Duration millisProperty(Properties props, String key, Duration fallback) {
    String v = props.getProperty(key);
    if (v == null || v.isBlank()) {
      return fallback;
    }
    try {
      long ms = Long.parseLong(v.trim());
      if (ms < 0) {
        throw new IllegalArgumentException("Negative value for " + key + ": " + v);
      }
      return Duration.ofMillis(ms);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + v, e);
    }
  }
}
