package io.tsquery.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Text codec for the ServerQuery line protocol.
 *
 * <p>Commands and responses are single lines. Records inside a response line are separated by
 * {@code |}, properties inside a record by a space, and every key/value is written as {@code
 * key=value} with the value escaped. A response is terminated by a status line of the form {@code
 * error id=0 msg=ok}.
 */
public final class QueryCodec {

  /** Parsed {@code error id=.. msg=..} status line. */
  public record Status(int id, String message, String extraMessage) {
    public boolean isOk() {
      return id == QueryErrorCodes.OK;
    }
  }

  private static final String STATUS_PREFIX = "error ";
  private static final String NOTIFY_PREFIX = "notify";

  private QueryCodec() {}

  /**
   * Escapes a value for transmission.
   *
   * @param value raw value
   * @return escaped value, never {@code null}
   */
  public static String escape(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '/' -> sb.append("\\/");
        case ' ' -> sb.append("\\s");
        case '|' -> sb.append("\\p");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\u000B' -> sb.append("\\v");
        case '\u0007' -> sb.append("\\a");
        case '\b' -> sb.append("\\b");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Reverses {@link #escape(String)}. Unknown escape sequences are kept verbatim.
   *
   * @param value escaped value
   * @return raw value, never {@code null}
   */
  public static String unescape(String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c != '\\' || i + 1 >= value.length()) {
        sb.append(c);
        continue;
      }
      char next = value.charAt(++i);
      switch (next) {
        case '\\' -> sb.append('\\');
        case '/' -> sb.append('/');
        case 's' -> sb.append(' ');
        case 'p' -> sb.append('|');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'v' -> sb.append('\u000B');
        case 'a' -> sb.append('\u0007');
        case 'b' -> sb.append('\b');
        default -> sb.append('\\').append(next);
      }
    }
    return sb.toString();
  }

  /**
   * Parses one data line into its records.
   *
   * @param line raw response line
   * @return records in wire order; keys without a value map to an empty string
   */
  public static List<Map<String, String>> parseRecords(String line) {
    List<Map<String, String>> records = new ArrayList<>();
    if (line == null || line.isBlank()) {
      return records;
    }
    for (String rawRecord : line.split("\\|")) {
      Map<String, String> record = new LinkedHashMap<>();
      for (String property : rawRecord.trim().split(" ")) {
        if (property.isEmpty()) {
          continue;
        }
        int eq = property.indexOf('=');
        if (eq < 0) {
          record.put(property, "");
        } else {
          record.put(property.substring(0, eq), unescape(property.substring(eq + 1)));
        }
      }
      if (!record.isEmpty()) {
        records.add(record);
      }
    }
    return records;
  }

  /** Returns true if the line terminates a response. */
  public static boolean isStatusLine(String line) {
    return line != null && line.startsWith(STATUS_PREFIX);
  }

  /** Returns true if the line is an unsolicited event notification. */
  public static boolean isNotification(String line) {
    return line != null && line.startsWith(NOTIFY_PREFIX);
  }

  /**
   * Parses a status line.
   *
   * @param line line starting with {@code error }
   * @return parsed status
   * @throws IllegalArgumentException if the line is not a status line
   */
  public static Status parseStatus(String line) {
    if (!isStatusLine(line)) {
      throw new IllegalArgumentException("Not a status line: " + line);
    }
    List<Map<String, String>> records = parseRecords(line.substring(STATUS_PREFIX.length()));
    Map<String, String> fields = records.isEmpty() ? Map.of() : records.get(0);
    int id;
    try {
      id = Integer.parseInt(fields.getOrDefault("id", "-1"));
    } catch (NumberFormatException e) {
      id = -1;
    }
    return new Status(id, fields.getOrDefault("msg", ""), fields.get("extra_msg"));
  }
}
