/*
 * Where: Cooldown service layer
 * What: sends a Discord direct message with the bot token
 * Why: the poller and the test-DM endpoint share one Discord boundary
 */
package com.example.cooldown.service;

import com.example.cooldown.config.DiscordClientProperties;
import com.example.cooldown.service.dto.CreateDmChannelRequest;
import com.example.cooldown.service.dto.CreateMessageRequest;
import com.example.cooldown.service.dto.DiscordChannelResponse;
import java.net.SocketTimeoutException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Two sequential calls: open (or fetch) the DM channel for the recipient, then post the text
 * into it. No retry here; the caller owns the retry policy.
 */
@Service
@RequiredArgsConstructor
public class DiscordDmClient {

  private final RestClient discordRestClient;
  private final DiscordClientProperties properties;

  public void sendDirectMessage(String recipientId, String text) {
    if (recipientId == null || recipientId.isBlank()) {
      throw new IllegalArgumentException("recipientId is required");
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text is required");
    }
    final String channelId = openDmChannel(recipientId);
    postMessage(channelId, text);
  }

  private String openDmChannel(String recipientId) {
    try {
      final DiscordChannelResponse response =
          discordRestClient
              .post()
              .uri(properties.createChannelPath())
              .header(HttpHeaders.AUTHORIZATION, botAuthorization())
              .contentType(MediaType.APPLICATION_JSON)
              .body(new CreateDmChannelRequest(recipientId))
              .retrieve()
              .body(DiscordChannelResponse.class);
      if (response == null || response.id() == null || response.id().isBlank()) {
        throw new DiscordDeliveryException(
            DiscordDeliveryException.Reason.INVALID_RESPONSE, "discord channel response has no id");
      }
      return response.id();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (DiscordDeliveryException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new DiscordDeliveryException(
          DiscordDeliveryException.Reason.INVALID_RESPONSE,
          "discord channel response parse failed",
          ex);
    }
  }

  private void postMessage(String channelId, String text) {
    try {
      discordRestClient
          .post()
          .uri(properties.createMessagePath(), channelId)
          .header(HttpHeaders.AUTHORIZATION, botAuthorization())
          .contentType(MediaType.APPLICATION_JSON)
          .body(new CreateMessageRequest(text))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    }
  }

  private String botAuthorization() {
    return "Bot " + properties.botToken();
  }

  private DiscordTransportException mapResponseException(RestClientResponseException ex) {
    return new DiscordTransportException(
        ex.getStatusCode().value(), ex.getResponseBodyAsString(), ex);
  }

  private DiscordDeliveryException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      return new DiscordDeliveryException(
          DiscordDeliveryException.Reason.TIMEOUT, "discord request timeout: " + ex.getMessage(), ex);
    }
    return new DiscordDeliveryException(
        DiscordDeliveryException.Reason.CONNECTION,
        "discord connection failed: " + ex.getMessage(),
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
