/*
 * Where: Cooldown domain model
 * What: lifecycle states of a user_timers row
 * Why: keep DB values and poller transitions aligned
 */
package com.example.cooldown.model;

public enum TimerStatus {
  SCHEDULED("scheduled"),
  SENT("sent"),
  // user stop or failed delivery; fail_reason tells them apart
  CANCELED("canceled");

  private final String value;

  TimerStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static TimerStatus fromValue(String raw) {
    for (TimerStatus status : values()) {
      if (status.value.equals(raw)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown timer status: " + raw);
  }
}
