package com.lookupgate.api.config;

import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.ports.impl.InMemoryApiKeyStore;
import com.lookupgate.application.ports.impl.InMemoryCustomerStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Store backend selection")
class StoreConfigTest {

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(LookupGateProperties.class)
  static class Support {
    @Bean
    Clock clock() {
      return Clock.systemUTC();
    }
  }

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(Support.class, StoreConfig.class);

  @Test
  @DisplayName("memory backend refuses to start unless ephemeral storage is allowed")
  void memoryNeedsOptIn() {
    runner.withPropertyValues("lookupgate.store.backend=memory")
        .run(ctx -> {
          assertThat(ctx).hasFailed();
          assertThat(ctx.getStartupFailure()).rootCause()
              .isInstanceOf(IllegalStateException.class)
              .hasMessageContaining("ephemeral-allowed");
        });
  }

  @Test
  @DisplayName("memory backend with opt-in wires the in-memory stores")
  void memoryWithOptIn() {
    runner.withPropertyValues("lookupgate.store.backend=memory", "lookupgate.store.ephemeral-allowed=true")
        .run(ctx -> {
          assertThat(ctx).hasNotFailed();
          assertThat(ctx.getBean(CustomerStore.class)).isInstanceOf(InMemoryCustomerStore.class);
          assertThat(ctx.getBean(ApiKeyStore.class)).isInstanceOf(InMemoryApiKeyStore.class);
        });
  }

  @Test
  @DisplayName("an unset backend defaults to the persistent one")
  void defaultsToJpa() {
    assertThat(new LookupGateProperties(null, null, null, null, null).store().backend())
        .isEqualTo(LookupGateProperties.Backend.JPA);
    assertThat(new LookupGateProperties(null, null, null, null, null).diagnostics().keyMatchEnabled()).isFalse();
  }
}
