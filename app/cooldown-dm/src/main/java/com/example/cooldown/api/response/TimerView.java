package com.example.cooldown.api.response;

import java.time.Instant;

public record TimerView(
    String timerType,
    String status,
    Instant lastSetAt,
    Instant dueAt,
    String lastSetAtLocal,
    String dueAtLocal,
    String failReason) {}
