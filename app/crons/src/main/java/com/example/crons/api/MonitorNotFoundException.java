package com.example.crons.api;

public class MonitorNotFoundException extends RuntimeException {

  public MonitorNotFoundException(String slug, String environment) {
    super("monitor not found slug=" + slug + " environment=" + environment);
  }
}
