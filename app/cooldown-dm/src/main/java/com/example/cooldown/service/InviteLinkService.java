/*
 * Where: Cooldown service layer
 * What: builds the Discord bot invite URL
 * Why: The bot must share a server with the user before DMs work
 */
package com.example.cooldown.service;

import com.example.cooldown.config.DiscordClientProperties;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InviteLinkService {

  // the bot only opens DM channels, so no guild permission is requested
  private static final String BOT_PERMISSIONS = "0";

  private final DiscordClientProperties properties;

  public String botInviteUrl() {
    return properties.authorizeUrl()
        + "?client_id="
        + encode(properties.clientId())
        + "&scope=bot"
        + "&permissions="
        + BOT_PERMISSIONS;
  }

  private String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
