package com.example.crons.model;

public enum TransitionType {
  DEGRADED,
  RECOVERED
}
