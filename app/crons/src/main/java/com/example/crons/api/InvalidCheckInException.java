package com.example.crons.api;

public class InvalidCheckInException extends RuntimeException {

  public InvalidCheckInException(String message) {
    super(message);
  }

  public InvalidCheckInException(String message, Throwable cause) {
    super(message, cause);
  }
}
