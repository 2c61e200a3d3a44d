package com.example.crons.api;

public class InvalidMonitorConfigException extends RuntimeException {

  public InvalidMonitorConfigException(String message) {
    super(message);
  }

  public InvalidMonitorConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
