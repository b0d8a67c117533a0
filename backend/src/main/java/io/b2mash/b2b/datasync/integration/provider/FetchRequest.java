package io.b2mash.b2b.datasync.integration.provider;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a sync job asks a provider for.
 *
 * @param since lower bound on modification time; null for a full pull
 * @param until upper bound; null for "now"
 * @param filters provider-specific filters passed through from the job parameters
 */
public record FetchRequest(
    Instant since, Instant until, int pageSize, Map<String, Object> filters) {

  public FetchRequest {
    filters =
        filters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(filters)) : Map.of();
  }
}
