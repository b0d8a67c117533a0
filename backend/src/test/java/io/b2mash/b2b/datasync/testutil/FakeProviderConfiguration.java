package io.b2mash.b2b.datasync.testutil;

import io.b2mash.b2b.datasync.integration.ProviderType;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/** Registers {@link FakeProviderClient} as the storefront adapter. */
@TestConfiguration(proxyBeanMethods = false)
public class FakeProviderConfiguration {

  @Bean
  FakeProviderClient fakeEcommerceClient() {
    return new FakeProviderClient(ProviderType.ECOMMERCE);
  }
}
