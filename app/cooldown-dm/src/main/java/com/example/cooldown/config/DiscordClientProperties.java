/*
 * Where: Cooldown configuration
 * What: Discord REST base URL, bot token, endpoint paths and call timeout
 * Why: Keep the Discord boundary configurable per environment
 */
package com.example.cooldown.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cooldown.discord")
public record DiscordClientProperties(
    String apiBaseUrl,
    String botToken,
    String clientId,
    String authorizeUrl,
    String createChannelPath,
    String createMessagePath,
    Duration timeout) {

  public DiscordClientProperties {
    apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://discord.com/api" : apiBaseUrl;
    botToken = botToken == null ? "" : botToken;
    clientId = clientId == null ? "" : clientId;
    authorizeUrl =
        authorizeUrl == null || authorizeUrl.isBlank()
            ? "https://discord.com/oauth2/authorize"
            : authorizeUrl;
    createChannelPath =
        createChannelPath == null || createChannelPath.isBlank()
            ? "/users/@me/channels"
            : createChannelPath;
    createMessagePath =
        createMessagePath == null || createMessagePath.isBlank()
            ? "/channels/{channelId}/messages"
            : createMessagePath;
    timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
  }
}
