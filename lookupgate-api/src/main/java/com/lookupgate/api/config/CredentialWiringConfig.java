package com.lookupgate.api.config;

import com.lookupgate.application.account.AdministratorService;
import com.lookupgate.application.account.CustomerService;
import com.lookupgate.application.ports.AdministratorStore;
import com.lookupgate.application.ports.ApiKeyStore;
import com.lookupgate.application.ports.CustomerStore;
import com.lookupgate.application.ports.PrincipalDirectory;
import com.lookupgate.application.security.ApiKeyIssuer;
import com.lookupgate.application.security.SecretHasher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CredentialWiringConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Cost factor is fixed here and embedded in every hash; existing hashes keep verifying after a change.
   */
  @Bean
  public SecretHasher secretHasher(LookupGateProperties props) {
    return new SecretHasher(props.hashing().costFactor());
  }

  @Bean
  public PrincipalDirectory principalDirectory(AdministratorStore administrators, CustomerStore customers) {
    return new PrincipalDirectory(administrators, customers);
  }

  @Bean
  public AdministratorService administratorService(AdministratorStore administrators, SecretHasher hasher) {
    return new AdministratorService(administrators, hasher);
  }

  @Bean
  public CustomerService customerService(CustomerStore customers, SecretHasher hasher) {
    return new CustomerService(customers, hasher);
  }

  @Bean
  public ApiKeyIssuer apiKeyIssuer(ApiKeyStore keys, CustomerStore customers, SecretHasher hasher, Clock clock) {
    return new ApiKeyIssuer(keys, customers, hasher, clock);
  }
}
