package io.tsquery.mcp.tools;

import java.util.List;
import java.util.Optional;

/**
 * Immutable description of one tool: name, purpose and argument shape.
 *
 * @param kind the tool this spec describes
 * @param name wire name of the tool
 * @param description description shown to clients
 * @param arguments declared arguments in schema order
 */
public record ToolSpec(ToolKind kind, String name, String description, List<ArgSpec> arguments) {

  public ToolSpec {
    arguments = List.copyOf(arguments);
  }

  public List<ArgSpec> requiredArguments() {
    return arguments.stream().filter(ArgSpec::required).toList();
  }

  public List<ArgSpec> optionalArguments() {
    return arguments.stream().filter(a -> !a.required()).toList();
  }

  public Optional<ArgSpec> argument(String argName) {
    return arguments.stream().filter(a -> a.name().equals(argName)).findFirst();
  }
}
