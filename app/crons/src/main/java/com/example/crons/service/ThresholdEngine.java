/*
 * どこで: Crons サービス層
 * 何を: Run の終端結果から連続回数を進め、UP/DOWN の遷移を判定する
 * なぜ: 単発の失敗/成功でアラートが揺れないようヒステリシスを持たせるため
 */
package com.example.crons.service;

import com.example.crons.model.MonitorState;
import com.example.crons.model.MonitorStatus;
import com.example.crons.model.RunStatus;
import com.example.crons.model.TransitionType;
import org.springframework.stereotype.Component;

@Component
public class ThresholdEngine {

  public ThresholdDecision apply(
      MonitorState state, int failureThreshold, int recoveryThreshold, RunStatus outcome) {
    if (outcome.isFailure()) {
      final int failures = state.consecutiveFailures() + 1;
      if (state.status() == MonitorStatus.UP && failures >= failureThreshold) {
        return new ThresholdDecision(
            state.withCounters(MonitorStatus.DOWN, failures, 0), TransitionType.DEGRADED, failures);
      }
      return new ThresholdDecision(state.withCounters(state.status(), failures, 0), null, failures);
    }
    final int successes = state.consecutiveSuccesses() + 1;
    if (state.status() == MonitorStatus.DOWN && successes >= recoveryThreshold) {
      return new ThresholdDecision(
          state.withCounters(MonitorStatus.UP, 0, successes), TransitionType.RECOVERED, successes);
    }
    return new ThresholdDecision(state.withCounters(state.status(), 0, successes), null, successes);
  }
}
