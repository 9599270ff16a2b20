/*
 * Where: Cooldown domain model
 * What: DM delivery status codes stored on discord_users
 * Why: Keep stored dm_status values in one place
 */
package com.example.cooldown.model;

public enum DeliveryStatus {
  OK("ok"),
  FAIL("fail"),
  UNKNOWN("unknown");

  private final String value;

  DeliveryStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static DeliveryStatus fromValue(String raw) {
    for (DeliveryStatus status : values()) {
      if (status.value.equals(raw)) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
