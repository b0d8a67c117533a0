package io.b2mash.b2b.datasync.integration.provider;

import java.util.List;

/** @param nextCursor opaque cursor for the next page; null on the last page */
public record FetchedPage(List<ProviderRecord> records, String nextCursor) {

  public FetchedPage {
    records = records != null ? List.copyOf(records) : List.of();
  }

  public boolean hasMore() {
    return nextCursor != null && !nextCursor.isBlank();
  }
}
