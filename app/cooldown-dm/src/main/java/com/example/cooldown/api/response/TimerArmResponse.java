package com.example.cooldown.api.response;

import java.time.Instant;

public record TimerArmResponse(
    String timerType, String label, Instant dueAt, String dueAtLocal, String tz) {}
