package com.example.crons.service;

/** 1 回のスイープパスの集計。リースを取れなかったパスは leaseAcquired = false。 */
public record SweepSummary(
    boolean leaseAcquired, int scanned, int missed, int timedOut, int failed) {

  static SweepSummary skipped() {
    return new SweepSummary(false, 0, 0, 0, 0);
  }
}
