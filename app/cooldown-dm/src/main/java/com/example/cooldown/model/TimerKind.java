/*
 * Where: Cooldown domain model
 * What: the two cooldown timer kinds with their duration and DM template
 * Why: keep the stored timer_type value, cooldown and message text in one place
 */
package com.example.cooldown.model;

import java.time.Duration;

public enum TimerKind {
  RUDOLPH("rudolph", "루돌프 코", Duration.ofHours(3), "🦌 루돌프 코 쿨타임 끝! (%s)"),
  BANDAGE("bandage", "반창고", Duration.ofHours(1), "🩹 반창고 쿨타임 끝! (%s)");

  private final String value;
  private final String label;
  private final Duration cooldown;
  private final String messageTemplate;

  TimerKind(String value, String label, Duration cooldown, String messageTemplate) {
    this.value = value;
    this.label = label;
    this.cooldown = cooldown;
    this.messageTemplate = messageTemplate;
  }

  public String value() {
    return value;
  }

  public String label() {
    return label;
  }

  public Duration cooldown() {
    return cooldown;
  }

  /** Label with the cooldown in hours, e.g. {@code 루돌프 코(3시간)}. */
  public String displayLabel() {
    return label + "(" + cooldown.toHours() + "시간)";
  }

  public String formatMessage(String localDueAt) {
    return String.format(messageTemplate, localDueAt);
  }

  public static TimerKind fromValue(String raw) {
    if (raw == null) {
      throw new UnknownTimerKindException(null);
    }
    for (TimerKind kind : values()) {
      if (kind.value.equals(raw)) {
        return kind;
      }
    }
    throw new UnknownTimerKindException(raw);
  }
}
