package io.tsquery.client;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Records returned by a successful command.
 *
 * @param records records in wire order, each an ordered key/value map
 */
public record QueryResponse(List<Map<String, String>> records) {

  private static final QueryResponse EMPTY = new QueryResponse(List.of());

  public QueryResponse {
    records = List.copyOf(records);
  }

  public static QueryResponse empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public int size() {
    return records.size();
  }

  /** Returns the first record, or an empty map for an empty response. */
  public Map<String, String> first() {
    return records.isEmpty() ? Map.of() : records.get(0);
  }

  /** Looks up a property of the first record. */
  public Optional<String> firstValue(String key) {
    return Optional.ofNullable(first().get(key));
  }
}
