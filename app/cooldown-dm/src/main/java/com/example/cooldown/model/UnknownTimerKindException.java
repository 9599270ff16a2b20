package com.example.cooldown.model;

public class UnknownTimerKindException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public UnknownTimerKindException(String value) {
    super("unknown timer_type: " + value);
  }
}
