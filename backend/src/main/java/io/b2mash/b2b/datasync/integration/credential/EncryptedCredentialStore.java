package io.b2mash.b2b.datasync.integration.credential;

import io.b2mash.b2b.datasync.exception.ResourceNotFoundException;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.IntegrationRepository;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.integration.provider.TokenGrant;
import io.b2mash.b2b.datasync.integration.provider.TokenRefreshResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class EncryptedCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(EncryptedCredentialStore.class);

  private final IntegrationRepository integrationRepository;
  private final TokenCipher tokenCipher;
  private final Clock clock;

  public EncryptedCredentialStore(
      IntegrationRepository integrationRepository, TokenCipher tokenCipher, Clock clock) {
    this.integrationRepository = integrationRepository;
    this.tokenCipher = tokenCipher;
    this.clock = clock;
  }

  /**
   * Two callbacks for the same account can race on the insert; the loser's unique-constraint
   * violation (or a version clash on the update path) is retried in a fresh transaction and then
   * finds the winner's row.
   */
  @Override
  @Retryable(
      retryFor = {
        DataIntegrityViolationException.class,
        ObjectOptimisticLockingFailureException.class
      },
      maxAttempts = 3,
      backoff = @Backoff(delay = 50))
  @Transactional
  public Integration connect(UUID tenantId, ProviderType provider, TokenGrant grant) {
    Instant now = clock.instant();
    var integration =
        integrationRepository
            .findByTenantIdAndProviderAndExternalAccountId(
                tenantId, provider, grant.externalAccountId())
            .orElseGet(() -> new Integration(tenantId, provider, grant.externalAccountId()));
    boolean reconnect = integration.getId() != null;

    integration.applyConnection(
        grant.externalAccountName(),
        tokenCipher.encrypt(grant.accessToken()),
        tokenCipher.encrypt(grant.refreshToken()),
        grant.tokenType(),
        grant.scopes(),
        expiryOf(grant.expiresIn(), now),
        now);
    var saved = integrationRepository.saveAndFlush(integration);
    log.info(
        "{} integration {} for tenant {} ({} account {})",
        reconnect ? "Reconnected" : "Connected",
        saved.getId(),
        tenantId,
        provider.getSlug(),
        grant.externalAccountId());
    return saved;
  }

  @Override
  public TokenPair readTokens(Integration integration) {
    return new TokenPair(
        tokenCipher.decrypt(integration.getAccessToken()),
        tokenCipher.decrypt(integration.getRefreshToken()));
  }

  @Override
  @Transactional
  public Optional<Integration> rotateTokens(
      UUID integrationId, long expectedTokenVersion, TokenRefreshResult result) {
    var current =
        integrationRepository
            .findById(integrationId)
            .orElseThrow(() -> new ResourceNotFoundException("Integration", integrationId));
    if (current.getTokenVersion() != expectedTokenVersion || !current.isActive()) {
      return Optional.empty();
    }

    Instant now = clock.instant();
    String refreshCiphertext =
        result.refreshToken() != null
            ? tokenCipher.encrypt(result.refreshToken())
            : current.getRefreshToken();
    int updated =
        integrationRepository.rotateTokens(
            integrationId,
            expectedTokenVersion,
            tokenCipher.encrypt(result.accessToken()),
            refreshCiphertext,
            expiryOf(result.expiresIn(), now),
            now);
    if (updated == 0) {
      log.debug("Token rotation for integration {} lost to a concurrent writer", integrationId);
      return Optional.empty();
    }
    return integrationRepository.findById(integrationId);
  }

  @Override
  @Transactional
  public boolean disconnect(UUID integrationId) {
    boolean deactivated = integrationRepository.deactivate(integrationId, clock.instant()) == 1;
    if (deactivated) {
      log.info("Disconnected integration {}; stored tokens wiped", integrationId);
    }
    return deactivated;
  }

  private static Instant expiryOf(Long expiresInSeconds, Instant now) {
    return expiresInSeconds != null ? now.plusSeconds(expiresInSeconds) : null;
  }
}
