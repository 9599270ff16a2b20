package com.example.cooldown.service;

/** Arming is refused until a DM to the user has succeeded at least once. */
public class DmNotReadyException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public DmNotReadyException(String message) {
    super(message);
  }
}
