package com.example.cooldown.api;

public class UnknownAckKindException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public UnknownAckKindException(String message) {
    super(message);
  }
}
