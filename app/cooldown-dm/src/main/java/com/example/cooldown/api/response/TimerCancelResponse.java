package com.example.cooldown.api.response;

public record TimerCancelResponse(String timerType, String label, String status) {}
