package com.example.crons.api;

public class CheckInConflictException extends RuntimeException {

  public CheckInConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
