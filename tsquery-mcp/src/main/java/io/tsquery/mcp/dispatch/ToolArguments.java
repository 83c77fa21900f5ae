package io.tsquery.mcp.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arguments of one invocation after required-argument checks and default application.
 *
 * <p>Typed accessors are lenient: numbers may arrive as strings, booleans as {@code "true"} or
 * {@code 1}. A value that cannot be read as the requested type is treated as absent.
 */
public final class ToolArguments {

  private final String toolName;
  private final Map<String, Object> values;

  public ToolArguments(String toolName, Map<String, Object> values) {
    this.toolName = toolName;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public String toolName() {
    return toolName;
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean has(String name) {
    return values.get(name) != null;
  }

  public Object raw(String name) {
    return values.get(name);
  }

  public Integer integer(String name) {
    Object v = values.get(name);
    if (v instanceof Number n) {
      return n.intValue();
    }
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  public Long longValue(String name) {
    Object v = values.get(name);
    if (v instanceof Number n) {
      return n.longValue();
    }
    if (v instanceof String s && !s.isBlank()) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  public int integer(String name, int fallback) {
    Integer v = integer(name);
    return v == null ? fallback : v;
  }

  public int requireInteger(String name) {
    Integer v = integer(name);
    if (v == null) {
      throw new ToolValidationException(
          "Argument '" + name + "' of " + toolName + " must be an integer");
    }
    return v;
  }

  public String string(String name) {
    Object v = values.get(name);
    return v == null ? null : String.valueOf(v);
  }

  public String string(String name, String fallback) {
    String v = string(name);
    return v == null ? fallback : v;
  }

  public String requireString(String name) {
    String v = string(name);
    if (v == null || v.isBlank()) {
      throw new ToolValidationException("Argument '" + name + "' of " + toolName + " is required");
    }
    return v;
  }

  public Boolean bool(String name) {
    Object v = values.get(name);
    if (v instanceof Boolean b) {
      return b;
    }
    if (v instanceof Number n) {
      return n.intValue() != 0;
    }
    if (v instanceof String s) {
      String t = s.trim().toLowerCase();
      if (t.equals("true") || t.equals("1") || t.equals("yes")) {
        return true;
      }
      if (t.equals("false") || t.equals("0") || t.equals("no")) {
        return false;
      }
    }
    return null;
  }

  public boolean bool(String name, boolean fallback) {
    Boolean v = bool(name);
    return v == null ? fallback : v;
  }

  @Override
  public String toString() {
    return toolName + values.keySet();
  }
}
