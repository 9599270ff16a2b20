/*
 * Where: Cooldown service layer
 * What: failure of a Discord DM attempt that did not get an HTTP error response
 * Why: the poller records the message as the failure reason and moves on
 */
package com.example.cooldown.service;

public class DiscordDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    REJECTED,
    TIMEOUT,
    CONNECTION,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public DiscordDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DiscordDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
