package com.lookupgate.api.config;

import com.lookupgate.application.account.AdministratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the first super admin from {@code lookupgate.bootstrap.*} when no administrator exists.
 */
@Component
public class AdministratorSeeder implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(AdministratorSeeder.class);

  private final AdministratorService administrators;
  private final LookupGateProperties props;

  public AdministratorSeeder(AdministratorService administrators, LookupGateProperties props) {
    this.administrators = administrators;
    this.props = props;
  }

  @Override
  public void run(ApplicationArguments args) {
    var bootstrap = props.bootstrap();
    if (!bootstrap.configured()) {
      log.debug("No bootstrap administrator configured");
      return;
    }
    administrators.seed(bootstrap.adminEmail(), bootstrap.adminPassword())
        .ifPresentOrElse(
            a -> log.info("Seeded bootstrap super admin: adminId={}", a.id()),
            () -> log.info("Administrators already present; bootstrap seeding skipped")
        );
  }
}
