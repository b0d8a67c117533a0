package io.b2mash.b2b.datasync.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.datasync.config.ProvidersProperties;
import io.b2mash.b2b.datasync.integration.Integration;
import io.b2mash.b2b.datasync.integration.ProviderType;
import io.b2mash.b2b.datasync.testutil.TestIntegrations;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateGovernorTest {

  private static final Instant NOW = Instant.parse("2026-05-10T08:17:42Z");
  private static final Instant HOUR_START = Instant.parse("2026-05-10T08:00:00Z");
  private static final Instant HOUR_END = Instant.parse("2026-05-10T09:00:00Z");

  @Mock private RateLimitWindowRepository windowRepository;

  private RateGovernor governor;
  private Integration ecommerce;

  @BeforeEach
  void setUp() {
    var providers =
        new ProvidersProperties(
            Map.of(
                ProviderType.ECOMMERCE,
                new ProvidersProperties.Provider(
                    "client",
                    "secret",
                    "https://shop.example.test/authorize",
                    "https://shop.example.test/token",
                    null,
                    List.of("read_orders"),
                    ",",
                    Map.of(),
                    new ProvidersProperties.RateLimit(5, Duration.ofHours(1)))));
    governor = new RateGovernor(windowRepository, providers, Clock.fixed(NOW, ZoneOffset.UTC));
    ecommerce =
        TestIntegrations.connected(
            UUID.randomUUID(), UUID.randomUUID(), ProviderType.ECOMMERCE, "a", "r", null);
  }

  @Test
  void windowStart_alignsToEpochMultiples() {
    assertThat(RateGovernor.windowStart(NOW, Duration.ofHours(1))).isEqualTo(HOUR_START);
    assertThat(RateGovernor.windowStart(NOW, Duration.ofMinutes(15)))
        .isEqualTo(Instant.parse("2026-05-10T08:15:00Z"));
    assertThat(RateGovernor.windowStart(HOUR_START, Duration.ofHours(1))).isEqualTo(HOUR_START);
  }

  @Test
  void tryAcquire_withinBudget_createsWindowAndGrants() {
    when(windowRepository.incrementWithinLimit(ecommerce.getId(), HOUR_START, 1)).thenReturn(1);

    assertThat(governor.tryAcquire(ecommerce)).isTrue();

    verify(windowRepository).insertIfAbsent(ecommerce.getId(), HOUR_START, HOUR_END, 5, NOW);
  }

  @Test
  void tryAcquire_budgetExhausted_denies() {
    when(windowRepository.incrementWithinLimit(ecommerce.getId(), HOUR_START, 2)).thenReturn(0);

    assertThat(governor.tryAcquire(ecommerce, 2)).isFalse();
  }

  @Test
  void tryAcquire_costAboveWindowLimit_isRejected() {
    assertThatThrownBy(() -> governor.tryAcquire(ecommerce, 6))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> governor.tryAcquire(ecommerce, 0))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(windowRepository);
  }

  @Test
  void tryAcquire_unconfiguredProvider_usesDefaultLimit() {
    var accounting =
        TestIntegrations.connected(
            UUID.randomUUID(), UUID.randomUUID(), ProviderType.ACCOUNTING, "a", "r", null);
    when(windowRepository.incrementWithinLimit(any(), any(), anyInt())).thenReturn(1);

    assertThat(governor.tryAcquire(accounting, 1000)).isTrue();
    verify(windowRepository)
        .insertIfAbsent(accounting.getId(), HOUR_START, HOUR_END, 1000, NOW);
  }

  @Test
  void waitTime_isTimeUntilWindowCloses() {
    assertThat(governor.waitTime(ecommerce)).isEqualTo(Duration.between(NOW, HOUR_END));
  }

  @Test
  void status_withoutWindowRow_reportsFullBudget() {
    when(windowRepository.findByIntegrationIdAndWindowStart(ecommerce.getId(), HOUR_START))
        .thenReturn(Optional.empty());

    var status = governor.status(ecommerce);

    assertThat(status.windowStart()).isEqualTo(HOUR_START);
    assertThat(status.windowEnd()).isEqualTo(HOUR_END);
    assertThat(status.requestsMade()).isZero();
    assertThat(status.remaining()).isEqualTo(5);
    verify(windowRepository, never()).insertIfAbsent(any(), any(), any(), anyInt(), any());
  }
}
