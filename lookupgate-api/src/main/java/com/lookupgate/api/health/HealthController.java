package com.lookupgate.api.health;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

@RestController
public class HealthController {

  private final Clock clock;

  public HealthController(Clock clock) {
    this.clock = clock;
  }

  @GetMapping("/api/v1/health")
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "lookupgate-api",
        "ts", clock.instant().toString()
    );
  }
}
