package com.example.cooldown.service;

public class DiscordLoginRequiredException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public DiscordLoginRequiredException(String message) {
    super(message);
  }
}
