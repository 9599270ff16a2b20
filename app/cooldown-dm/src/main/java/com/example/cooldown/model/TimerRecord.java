/*
 * Where: Cooldown domain model
 * What: snapshot of one user_timers row
 * Why: shared by the poller and the status API
 */
package com.example.cooldown.model;

import java.time.Instant;

public record TimerRecord(
    String discordUserId,
    TimerKind kind,
    TimerStatus status,
    Instant dueAt,
    Instant lastSetAt,
    Instant updatedAt,
    String failReason) {}
