package com.example.crons.api;

public class CheckInRateLimitedException extends RuntimeException {

  public CheckInRateLimitedException(String slug, String environment) {
    super("check-in rate limit exceeded slug=" + slug + " environment=" + environment);
  }
}
