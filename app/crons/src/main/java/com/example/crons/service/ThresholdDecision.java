package com.example.crons.service;

import com.example.crons.model.MonitorState;
import com.example.crons.model.TransitionType;
import org.springframework.lang.Nullable;

/**
 * 閾値判定の結果。
 *
 * @param transition 状態が切り替わった場合のみ非 null
 * @param consecutiveCount 判定に使った連続回数
 */
public record ThresholdDecision(
    MonitorState state, @Nullable TransitionType transition, int consecutiveCount) {

  public boolean hasTransition() {
    return transition != null;
  }
}
