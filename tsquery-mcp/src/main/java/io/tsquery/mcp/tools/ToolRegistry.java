package io.tsquery.mcp.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Read-only table of tool specifications, keyed by wire name.
 *
 * <p>The table is validated once when built; a malformed spec is a programming error and fails
 * fast with {@link IllegalStateException}.
 */
public final class ToolRegistry {

  /** Name of the optional per-call credentials object every tool accepts. */
  public static final String CREDENTIALS_ARGUMENT = "teamspeak_credentials";

  private static final Pattern NAME_PATTERN = Pattern.compile("[a-z][a-z0-9_]*");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Map<String, ToolSpec> specsByName;

  private ToolRegistry(Collection<ToolKind> kinds) {
    Map<String, ToolSpec> specs = new LinkedHashMap<>();
    for (ToolKind kind : kinds) {
      ToolSpec spec = kind.spec();
      validate(spec);
      if (specs.putIfAbsent(spec.name(), spec) != null) {
        throw new IllegalStateException("Duplicate tool name: " + spec.name());
      }
    }
    this.specsByName = Collections.unmodifiableMap(specs);
  }

  /** Registry of every {@link ToolKind}. */
  public static ToolRegistry standard() {
    return new ToolRegistry(EnumSet.allOf(ToolKind.class));
  }

  /** Registry restricted to the given kinds. */
  public static ToolRegistry of(Collection<ToolKind> kinds) {
    return new ToolRegistry(kinds);
  }

  public Optional<ToolSpec> lookup(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(specsByName.get(name));
  }

  public boolean contains(String name) {
    return name != null && specsByName.containsKey(name);
  }

  public Collection<ToolSpec> specs() {
    return specsByName.values();
  }

  public int size() {
    return specsByName.size();
  }

  /**
   * Renders the JSON schema of a tool's arguments, including the optional credentials object.
   *
   * @param spec tool spec
   * @return schema as a JSON string
   */
  public String inputSchema(ToolSpec spec) {
    ObjectNode schema = MAPPER.createObjectNode();
    schema.put("type", "object");
    ObjectNode properties = schema.putObject("properties");
    ArrayNode required = MAPPER.createArrayNode();

    for (ArgSpec arg : spec.arguments()) {
      ObjectNode property = properties.putObject(arg.name());
      property.put("type", arg.type().jsonType());
      property.put("description", arg.description());
      if (arg.hasDefault()) {
        property.set("default", MAPPER.valueToTree(arg.defaultValue()));
      }
      if (!arg.allowedValues().isEmpty()) {
        property.set("enum", MAPPER.valueToTree(arg.allowedValues()));
      }
      if (arg.required()) {
        required.add(arg.name());
      }
    }
    properties.set(CREDENTIALS_ARGUMENT, credentialsSchema());
    schema.set("required", required);

    try {
      return MAPPER.writeValueAsString(schema);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render schema of " + spec.name(), e);
    }
  }

  private static ObjectNode credentialsSchema() {
    ObjectNode creds = MAPPER.createObjectNode();
    creds.put("type", "object");
    creds.put(
        "description",
        "Optional per-call server credentials; absent fields fall back to the configured defaults");
    ObjectNode props = creds.putObject("properties");
    props.putObject("host").put("type", "string");
    props.putObject("port").put("type", "integer");
    props.putObject("user").put("type", "string");
    props.putObject("password").put("type", "string");
    props.putObject("server_id").put("type", "integer");
    return creds;
  }

  static void validate(ToolSpec spec) {
    if (!NAME_PATTERN.matcher(spec.name()).matches()) {
      throw new IllegalStateException("Invalid tool name: " + spec.name());
    }
    Set<String> seen = new HashSet<>();
    for (ArgSpec arg : spec.arguments()) {
      String where = spec.name() + "." + arg.name();
      if (!NAME_PATTERN.matcher(arg.name()).matches()) {
        throw new IllegalStateException("Invalid argument name: " + where);
      }
      if (CREDENTIALS_ARGUMENT.equals(arg.name())) {
        throw new IllegalStateException("Reserved argument name: " + where);
      }
      if (!seen.add(arg.name())) {
        throw new IllegalStateException("Duplicate argument: " + where);
      }
      if (arg.required() && arg.hasDefault()) {
        throw new IllegalStateException("Required argument with default: " + where);
      }
      if (arg.hasDefault() && !arg.type().accepts(arg.defaultValue())) {
        throw new IllegalStateException("Default does not match type " + arg.type() + ": " + where);
      }
      for (Object allowed : arg.allowedValues()) {
        if (!arg.type().accepts(allowed)) {
          throw new IllegalStateException("Enum value does not match type: " + where);
        }
      }
      if (arg.hasDefault()
          && !arg.allowedValues().isEmpty()
          && !arg.allowedValues().contains(arg.defaultValue())) {
        throw new IllegalStateException("Default outside enum: " + where);
      }
    }
  }
}
