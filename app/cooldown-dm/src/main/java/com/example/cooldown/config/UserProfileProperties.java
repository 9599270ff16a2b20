/*
 * Where: Cooldown configuration
 * What: default timezone applied when a user has none stored
 * Why: Reject an unparseable default zone at startup
 */
package com.example.cooldown.config;

import jakarta.validation.constraints.AssertTrue;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Profile defaults. {@code defaultTimezone} is used whenever a user's own zone is unusable. */
@ConfigurationProperties(prefix = "cooldown.profile")
@Validated
public record UserProfileProperties(String defaultTimezone) {

  public UserProfileProperties {
    defaultTimezone =
        defaultTimezone == null || defaultTimezone.isBlank() ? "Asia/Seoul" : defaultTimezone;
  }

  @AssertTrue(message = "cooldown.profile.default-timezone must be a valid zone id")
  public boolean isDefaultTimezoneValid() {
    try {
      ZoneId.of(defaultTimezone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }
}
