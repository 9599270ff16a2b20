package com.example.cooldown.api.request;

public record TimezoneRequest(String tz) {}
