package com.example.cooldown.api.response;

public record MeResponse(String discordUserId, String username) {}
