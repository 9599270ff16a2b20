package com.example.cooldown.api.response;

public record AckResponse(boolean ok) {}
