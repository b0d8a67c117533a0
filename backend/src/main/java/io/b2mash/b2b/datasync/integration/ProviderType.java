package io.b2mash.b2b.datasync.integration;

import java.util.Arrays;
import java.util.Optional;

/** Categories of external systems a tenant can connect. The slug is used in URLs and config. */
public enum ProviderType {
  ECOMMERCE("ecommerce"),
  ACCOUNTING("accounting"),
  PAYMENTS("payments"),
  SPREADSHEET("spreadsheet");

  private final String slug;

  ProviderType(String slug) {
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }

  /** Case-insensitive lookup by slug or enum name. */
  public static Optional<ProviderType> fromSlug(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(type -> type.slug.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
        .findFirst();
  }
}
