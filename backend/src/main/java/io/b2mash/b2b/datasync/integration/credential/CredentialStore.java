package io.b2mash.b2b.datasync.integration.credential;

import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.integration.provider.TokenGrant;
import io.b2mash.b2b.datasync.integration.provider.TokenRefreshResult;
import java.util.Optional;
import java.util.UUID;

/** Persists integrations with their OAuth tokens encrypted at rest. */
public interface CredentialStore {

  /**
   * Creates or reactivates the integration for the grant's external account and stores the new
   * token pair. Reconnecting an existing account updates that row rather than adding one.
   */
  Integration connect(UUID tenantId, ProviderType provider, TokenGrant grant);

  TokenPair readTokens(Integration integration);

  /**
   * Replaces the tokens if they were not rotated since {@code expectedTokenVersion}. A null
   * refresh token in {@code result} keeps the stored one.
   *
   * @return the updated integration, or empty when another writer got there first
   */
  Optional<Integration> rotateTokens(
      UUID integrationId, long expectedTokenVersion, TokenRefreshResult result);

  /**
   * Deactivates the integration and wipes its tokens. The row itself is kept.
   *
   * @return true when this call performed the deactivation
   */
  boolean disconnect(UUID integrationId);
}
