package com.example.cooldown.api.response;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Timers keyed by timer_type; a kind that was never armed maps to {@code null}. */
public record TimerStatusResponse(
    Instant serverNow, String serverNowLocal, String tz, Map<String, TimerView> timers) {

  public TimerStatusResponse {
    timers = timers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(timers));
  }
}
