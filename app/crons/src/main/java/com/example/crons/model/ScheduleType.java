package com.example.crons.model;

public enum ScheduleType {
  CRONTAB,
  INTERVAL
}
