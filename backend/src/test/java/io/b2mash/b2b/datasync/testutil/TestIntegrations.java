package io.b2mash.b2b.datasync.testutil;

import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.ProviderType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.test.util.ReflectionTestUtils;

/** Builds detached {@link Integration} instances for unit tests. */
public final class TestIntegrations {

  private TestIntegrations() {}

  /** An active integration holding the given (already encrypted) tokens, at token version 1. */
  public static Integration connected(
      UUID id,
      UUID tenantId,
      ProviderType provider,
      String accessCiphertext,
      String refreshCiphertext,
      Instant expiresAt) {
    var integration = new Integration(tenantId, provider, "acct-" + id);
    integration.applyConnection(
        "Test Account",
        accessCiphertext,
        refreshCiphertext,
        "Bearer",
        List.of("read"),
        expiresAt,
        Instant.parse("2026-01-01T00:00:00Z"));
    ReflectionTestUtils.setField(integration, "id", id);
    return integration;
  }

  public static Integration withTokenVersion(Integration integration, long tokenVersion) {
    ReflectionTestUtils.setField(integration, "tokenVersion", tokenVersion);
    return integration;
  }

  public static Integration withExpiry(Integration integration, Instant expiresAt) {
    ReflectionTestUtils.setField(integration, "expiresAt", expiresAt);
    return integration;
  }
}
