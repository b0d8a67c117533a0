package io.b2mash.b2b.datasync.sync;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a sync job, stored as JSONB on the job row.
 *
 * @param since lower bound of the date range; incremental jobs default it to the last sync
 * @param until upper bound of the date range, null for open-ended
 * @param filters provider-specific filters; values may be null
 */
public record SyncParams(Instant since, Instant until, Map<String, Object> filters) {

  public SyncParams {
    filters =
        filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : Map.of();
  }

  public static SyncParams empty() {
    return new SyncParams(null, null, Map.of());
  }

  /** False when both bounds are set and {@code since} is after {@code until}. */
  public boolean hasValidRange() {
    return since == null || until == null || !since.isAfter(until);
  }

  public SyncParams withSince(Instant since) {
    return new SyncParams(since, until, filters);
  }

  public Map<String, Object> toMap() {
    var map = new HashMap<String, Object>();
    if (since != null) {
      map.put("since", since.toString());
    }
    if (until != null) {
      map.put("until", until.toString());
    }
    if (!filters.isEmpty()) {
      map.put("filters", filters);
    }
    return map;
  }

  @SuppressWarnings("unchecked")
  public static SyncParams fromMap(Map<String, Object> map) {
    if (map == null || map.isEmpty()) {
      return empty();
    }
    Object filters = map.get("filters");
    return new SyncParams(
        parseInstant(map.get("since")),
        parseInstant(map.get("until")),
        filters instanceof Map<?, ?> f ? (Map<String, Object>) f : Map.of());
  }

  private static Instant parseInstant(Object value) {
    return value != null ? Instant.parse(value.toString()) : null;
  }
}
