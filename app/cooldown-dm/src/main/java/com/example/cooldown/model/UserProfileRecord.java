/*
 * Where: Cooldown domain model
 * What: snapshot of one discord_users row
 * Why: DM health and timezone lookups read the same profile
 */
package com.example.cooldown.model;

import java.time.Instant;

public record UserProfileRecord(
    String discordUserId,
    DeliveryStatus dmStatus,
    String dmLastError,
    Instant dmOkAt,
    String timezone,
    Instant updatedAt) {

  public boolean deliveryReady() {
    return dmStatus == DeliveryStatus.OK;
  }
}
