/*
 * Where: Cooldown configuration binding
 * What: poll interval and batch limit of the due-timer poller
 * Why: POLL_SECONDS / POLL_LIMIT are tuned per environment and checked at startup
 */
package com.example.cooldown.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cooldown.delivery")
@Validated
public record TimerDeliveryProperties(
    boolean enabled, Duration pollInterval, @Positive Integer batchSize) {

  public TimerDeliveryProperties {
    pollInterval = pollInterval == null ? Duration.ofSeconds(30) : pollInterval;
    batchSize = batchSize == null ? 50 : batchSize;
  }

  @AssertTrue(message = "cooldown.delivery.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    return !pollInterval.isZero() && !pollInterval.isNegative();
  }
}
