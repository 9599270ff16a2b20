/*
 * Where: Cooldown service layer
 * What: renders instants as "MM/dd HH:mm" in a user's IANA zone
 * Why: DMs and status responses show local times; bad zone ids fall back to the default zone
 */
package com.example.cooldown.service;

import com.example.cooldown.config.UserProfileProperties;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LocalTimeFormatter {

  private static final Logger logger = LoggerFactory.getLogger(LocalTimeFormatter.class);
  private static final DateTimeFormatter LOCAL_PATTERN = DateTimeFormatter.ofPattern("MM/dd HH:mm");

  private final UserProfileProperties properties;

  public ZoneId resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return defaultZone();
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      logger.debug("unknown timezone tz={}; fallback to {}", timezone, properties.defaultTimezone());
      return defaultZone();
    }
  }

  public String format(Instant instant, String timezone) {
    if (instant == null) {
      return null;
    }
    return LOCAL_PATTERN.format(instant.atZone(resolveZone(timezone)));
  }

  private ZoneId defaultZone() {
    return ZoneId.of(properties.defaultTimezone());
  }
}
