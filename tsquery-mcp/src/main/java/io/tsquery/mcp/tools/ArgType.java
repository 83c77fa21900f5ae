package io.tsquery.mcp.tools;

/** JSON schema types a tool argument may declare. */
public enum ArgType {
  INTEGER("integer"),
  STRING("string"),
  BOOLEAN("boolean");

  private final String jsonType;

  ArgType(String jsonType) {
    this.jsonType = jsonType;
  }

  public String jsonType() {
    return jsonType;
  }

  /** Returns true if the value is acceptable for this type without coercion. */
  public boolean accepts(Object value) {
    return switch (this) {
      case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short;
      case STRING -> value instanceof String;
      case BOOLEAN -> value instanceof Boolean;
    };
  }
}
