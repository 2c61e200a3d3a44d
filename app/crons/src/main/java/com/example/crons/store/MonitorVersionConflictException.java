package com.example.crons.store;

public class MonitorVersionConflictException extends RuntimeException {

  public MonitorVersionConflictException(String slug, String environment, long expectedVersion) {
    super(
        "monitor version conflict slug="
            + slug
            + " environment="
            + environment
            + " expectedVersion="
            + expectedVersion);
  }
}
