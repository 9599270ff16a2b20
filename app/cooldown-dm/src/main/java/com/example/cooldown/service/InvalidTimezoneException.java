package com.example.cooldown.service;

public class InvalidTimezoneException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidTimezoneException(String message) {
    super(message);
  }
}
