package com.example.crons.schedule;

public class InvalidScheduleException extends IllegalArgumentException {

  public InvalidScheduleException(String message) {
    super(message);
  }

  public InvalidScheduleException(String message, Throwable cause) {
    super(message, cause);
  }
}
