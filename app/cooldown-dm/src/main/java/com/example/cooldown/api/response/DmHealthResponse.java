package com.example.cooldown.api.response;

import java.time.Instant;

public record DmHealthResponse(
    String discordUserId, String dmStatus, String dmLastError, Instant dmOkAt, String tz) {}
