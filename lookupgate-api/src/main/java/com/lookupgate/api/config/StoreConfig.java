package com.lookupgate.api.config;

import com.lookupgate.application.ports.AdministratorStore;
import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.ports.impl.InMemoryAdministratorStore;
import com.lookupgate.application.ports.impl.InMemoryApiKeyStore;
import com.lookupgate.application.ports.impl.InMemoryCustomerStore;
import com.lookupgate.infrastructure.administrator.AdministratorRepository;
import com.lookupgate.infrastructure.administrator.JpaAdministratorStore;
import com.lookupgate.infrastructure.apikey.ApiKeyRepository;
import com.lookupgate.infrastructure.apikey.JpaApiKeyStore;
import com.lookupgate.infrastructure.customer.CustomerRepository;
import com.lookupgate.infrastructure.customer.JpaCustomerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

/**
 * Store backend selection. Exactly one of the nested configurations is active, chosen once at
 * startup from {@code lookupgate.store.backend}.
 */
@Configuration
public class StoreConfig {

  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = "lookupgate.store.backend", havingValue = "memory")
  static class MemoryStores {

    MemoryStores(LookupGateProperties props) {
      if (!props.store().ephemeralAllowed()) {
        throw new IllegalStateException(
            "lookupgate.store.backend=memory loses every account and key on restart. "
                + "Set lookupgate.store.ephemeral-allowed=true to accept this (development and tests only).");
      }
      log.warn("Using the in-memory store backend: all credential state is lost on restart");
    }

    @Bean
    AdministratorStore administratorStore(Clock clock) {
      return new InMemoryAdministratorStore(clock);
    }

    @Bean
    CustomerStore customerStore(Clock clock) {
      return new InMemoryCustomerStore(clock);
    }

    @Bean
    ApiKeyStore apiKeyStore(Clock clock) {
      return new InMemoryApiKeyStore(clock);
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = "lookupgate.store.backend", havingValue = "jpa", matchIfMissing = true)
  @EnableJpaRepositories(basePackages = "com.lookupgate.infrastructure")
  @EntityScan(basePackages = "com.lookupgate.infrastructure")
  static class JpaStores {

    JpaStores() {
      log.info("Using the JPA store backend");
    }

    @Bean
    AdministratorStore administratorStore(AdministratorRepository repository, Clock clock) {
      return new JpaAdministratorStore(repository, clock);
    }

    @Bean
    CustomerStore customerStore(CustomerRepository repository, Clock clock) {
      return new JpaCustomerStore(repository, clock);
    }

    @Bean
    ApiKeyStore apiKeyStore(ApiKeyRepository repository, Clock clock) {
      return new JpaApiKeyStore(repository, clock);
    }
  }
}
