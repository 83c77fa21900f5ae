package io.tsquery.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single ServerQuery command with ordered parameters and {@code -option} flags.
 *
 * <p>Parameters with a {@code null} value are skipped, so optional arguments can be passed
 * through unconditionally. Booleans are sent as {@code 1}/{@code 0}.
 *
 * <pre>{@code
 * QueryCommand.of("clientkick").param("clid", 5).param("reasonid", 4).param("reasonmsg", "bye")
 * }</pre>
 */
public final class QueryCommand {

  private final String name;
  private final Map<String, String> params = new LinkedHashMap<>();
  private final List<String> options = new ArrayList<>();

  private QueryCommand(String name) {
    this.name = name;
  }

  public static QueryCommand of(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank() || name.contains(" ")) {
      throw new IllegalArgumentException("Invalid command name: '" + name + "'");
    }
    return new QueryCommand(name);
  }

  public QueryCommand param(String key, Object value) {
    if (value == null) {
      return this;
    }
    String text;
    if (value instanceof Boolean b) {
      text = b ? "1" : "0";
    } else {
      text = String.valueOf(value);
    }
    params.put(key, text);
    return this;
  }

  public QueryCommand option(String option) {
    options.add(option);
    return this;
  }

  public String name() {
    return name;
  }

  /** Returns the raw (unescaped) parameter values, in insertion order. */
  public Map<String, String> params() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public String param(String key) {
    return params.get(key);
  }

  public List<String> options() {
    return List.copyOf(options);
  }

  /** Encodes the command as a wire line, without the trailing newline. */
  public String encode() {
    StringBuilder sb = new StringBuilder(name);
    for (Map.Entry<String, String> e : params.entrySet()) {
      sb.append(' ').append(e.getKey()).append('=').append(QueryCodec.escape(e.getValue()));
    }
    for (String option : options) {
      sb.append(" -").append(option);
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    // never echo secrets into logs
    if ("login".equals(name) || "privilegekeyuse".equals(name) || "tokenuse".equals(name)) {
      return name + " [redacted]";
    }
    return encode();
  }
}
