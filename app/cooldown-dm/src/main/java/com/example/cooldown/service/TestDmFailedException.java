package com.example.cooldown.service;

public class TestDmFailedException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TestDmFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
