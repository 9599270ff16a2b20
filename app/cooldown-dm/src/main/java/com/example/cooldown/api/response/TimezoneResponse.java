package com.example.cooldown.api.response;

public record TimezoneResponse(boolean ok, String tz) {}
