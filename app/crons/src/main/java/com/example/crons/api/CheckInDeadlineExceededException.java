package com.example.crons.api;

public class CheckInDeadlineExceededException extends RuntimeException {

  public CheckInDeadlineExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
