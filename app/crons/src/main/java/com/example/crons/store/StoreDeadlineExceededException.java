package com.example.crons.store;

public class StoreDeadlineExceededException extends RuntimeException {

  public StoreDeadlineExceededException(String message) {
    super(message);
  }

  public StoreDeadlineExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
