package com.example.crons.schedule;

/** 予定時刻と猶予に対する現在時刻の位置。 */
public enum WindowState {
  ON_TIME,
  LATE,
  MISSED
}
