package io.tsquery.mcp.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tsquery.mcp.UnitTest;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Unit tests for the tool catalog and its schema rendering. */
@UnitTest
class ToolRegistryTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ToolRegistry registry = ToolRegistry.standard();

  @Test
  void standardRegistryCoversEveryKind() {
    assertEquals(ToolKind.values().length, registry.size());
    for (ToolKind kind : ToolKind.values()) {
      assertSame(kind.spec(), registry.lookup(kind.toolName()).orElseThrow());
    }
  }

  @Test
  void toolNamesAreUnique() {
    Set<String> names = new HashSet<>();
    for (ToolKind kind : ToolKind.values()) {
      assertTrue(names.add(kind.toolName()), "duplicate " + kind.toolName());
    }
  }

  @Test
  void unknownNameIsAbsent() {
    assertTrue(registry.lookup("format_hard_drive").isEmpty());
    assertTrue(registry.lookup(null).isEmpty());
    assertFalse(registry.contains("KICK_CLIENT"));
  }

  @Test
  void restrictedRegistryOnlyHoldsGivenKinds() {
    ToolRegistry small = ToolRegistry.of(EnumSet.of(ToolKind.SERVER_INFO, ToolKind.KICK_CLIENT));
    assertEquals(2, small.size());
    assertTrue(small.contains("kick_client"));
    assertFalse(small.contains("list_clients"));
  }

  @Test
  void kickClientDeclaresRequiredAndDefaults() {
    ToolSpec kick = registry.lookup("kick_client").orElseThrow();

    List<String> required = kick.requiredArguments().stream().map(ArgSpec::name).toList();
    assertEquals(List.of("client_id"), required);
    assertEquals("Expelled by AI", kick.argument("reason").orElseThrow().defaultValue());
    assertEquals(false, kick.argument("from_server").orElseThrow().defaultValue());
  }

  @Test
  void schemaListsPropertiesRequiredDefaultsAndEnums() throws Exception {
    JsonNode schema =
        MAPPER.readTree(registry.inputSchema(ToolKind.MANAGE_CHANNEL_PERMISSIONS.spec()));

    assertEquals("object", schema.get("type").asText());
    JsonNode props = schema.get("properties");
    assertEquals("integer", props.get("channel_id").get("type").asText());
    assertEquals(3, props.get("action").get("enum").size());
    assertTrue(props.has(ToolRegistry.CREDENTIALS_ARGUMENT));
    assertEquals("object", props.get(ToolRegistry.CREDENTIALS_ARGUMENT).get("type").asText());

    List<String> required = MAPPER.convertValue(schema.get("required"), List.class);
    assertEquals(List.of("channel_id", "action"), required);
  }

  @Test
  void schemaRendersDefaults() throws Exception {
    JsonNode props =
        MAPPER.readTree(registry.inputSchema(ToolKind.VIEW_SERVER_LOGS.spec())).get("properties");

    assertEquals(50, props.get("lines").get("default").asInt());
    assertTrue(props.get("reverse").get("default").asBoolean());
    assertEquals(1000, props.get("max_iterations").get("default").asInt());
  }

  @Test
  void toolWithoutArgumentsHasEmptyRequiredList() throws Exception {
    JsonNode schema = MAPPER.readTree(registry.inputSchema(ToolKind.LIST_CLIENTS.spec()));
    assertEquals(0, schema.get("required").size());
  }

  // ─────────────────────────────────────────────────────────────────────────────
  // table validation
  // ─────────────────────────────────────────────────────────────────────────────

  private static ToolSpec spec(String name, ArgSpec... args) {
    return new ToolSpec(ToolKind.SERVER_INFO, name, "test", List.of(args));
  }

  @Test
  void rejectsInvalidToolName() {
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("Bad-Name")));
  }

  @Test
  void rejectsReservedCredentialsArgument() {
    ArgSpec creds = ArgSpec.optional(ToolRegistry.CREDENTIALS_ARGUMENT, ArgType.STRING, "");
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("t", creds)));
  }

  @Test
  void rejectsDuplicateArguments() {
    ArgSpec a = ArgSpec.optional("a", ArgType.STRING, "");
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("t", a, a)));
  }

  @Test
  void rejectsRequiredArgumentWithDefault() {
    ArgSpec bad = new ArgSpec("a", ArgType.INTEGER, true, 1, List.of(), "");
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("t", bad)));
  }

  @Test
  void rejectsDefaultOfWrongType() {
    ArgSpec bad = ArgSpec.withDefault("a", ArgType.INTEGER, "one", "");
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("t", bad)));
  }

  @Test
  void rejectsDefaultOutsideEnum() {
    ArgSpec bad = ArgSpec.withDefault("a", ArgType.STRING, "x", "").oneOf("y", "z");
    assertThrows(IllegalStateException.class, () -> ToolRegistry.validate(spec("t", bad)));
  }

  @Test
  void acceptsWellFormedSpec() {
    ArgSpec ok = ArgSpec.withDefault("mode", ArgType.STRING, "y", "").oneOf("y", "z");
    assertDoesNotThrow(() -> ToolRegistry.validate(spec("good_tool", ok)));
  }
}
