/*
 * Where: Cooldown Discord client
 * What: non-2xx Discord response with its status code and body
 * Why: The status and body become the stored failure reason
 */
package com.example.cooldown.service;

/** Discord answered with a non-2xx status. The message is {@code "<status> <body>"}. */
public class DiscordTransportException extends DiscordDeliveryException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String responseBody;

  public DiscordTransportException(int statusCode, String responseBody, Throwable cause) {
    super(Reason.REJECTED, statusCode + " " + responseBody, cause);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int statusCode() {
    return statusCode;
  }

  public String responseBody() {
    return responseBody;
  }
}
