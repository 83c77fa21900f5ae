package io.tsquery.mcp.dispatch;

import static org.junit.jupiter.api.Assertions.*;

import io.tsquery.mcp.UnitTest;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Unit tests for lenient argument access. */
@UnitTest
class ToolArgumentsTest {

  private final ToolArguments args =
      new ToolArguments(
          "t",
          Map.of(
              "n", 5,
              "s", "7",
              "bad", "seven",
              "flag", "true",
              "bit", 0,
              "big", 4_000_000_000L));

  @Test
  void integersAcceptNumbersAndNumericStrings() {
    assertEquals(5, args.integer("n"));
    assertEquals(7, args.integer("s"));
    assertNull(args.integer("bad"));
    assertEquals(3, args.integer("absent", 3));
    assertEquals(4_000_000_000L, args.longValue("big"));
  }

  @Test
  void requireIntegerRejectsUnreadableValues() {
    assertThrows(ToolValidationException.class, () -> args.requireInteger("bad"));
    assertThrows(ToolValidationException.class, () -> args.requireInteger("absent"));
  }

  @Test
  void booleansAcceptStringsAndDigits() {
    assertTrue(args.bool("flag"));
    assertFalse(args.bool("bit"));
    assertNull(args.bool("bad"));
    assertTrue(args.bool("absent", true));
  }

  @Test
  void stringsRenderAnyValue() {
    assertEquals("5", args.string("n"));
    assertEquals("x", args.string("absent", "x"));
    assertThrows(ToolValidationException.class, () -> args.requireString("absent"));
  }
}
