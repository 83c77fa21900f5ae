package io.tsquery.mcp.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Declared shape of one tool argument.
 *
 * @param name argument name as it appears in the invocation map
 * @param type declared type
 * @param required whether the invocation must supply it
 * @param defaultValue value applied when an optional argument is absent, or {@code null}
 * @param allowedValues closed set of accepted values, empty if unrestricted
 * @param description human readable description for the tool schema
 */
public record ArgSpec(
    String name,
    ArgType type,
    boolean required,
    Object defaultValue,
    List<Object> allowedValues,
    String description) {

  public ArgSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    allowedValues = List.copyOf(allowedValues);
    description = description == null ? "" : description;
  }

  public static ArgSpec required(String name, ArgType type, String description) {
    return new ArgSpec(name, type, true, null, List.of(), description);
  }

  public static ArgSpec optional(String name, ArgType type, String description) {
    return new ArgSpec(name, type, false, null, List.of(), description);
  }

  public static ArgSpec withDefault(
      String name, ArgType type, Object defaultValue, String description) {
    return new ArgSpec(name, type, false, defaultValue, List.of(), description);
  }

  /** Returns a copy restricted to the given values. */
  public ArgSpec oneOf(Object... values) {
    return new ArgSpec(name, type, required, defaultValue, Arrays.asList(values), description);
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }
}
