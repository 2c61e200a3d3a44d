package com.example.crons.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunsResponse(String slug, String environment, List<RunSummary> runs) {
  public RunsResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (runs != null) {
      runs = Collections.unmodifiableList(new ArrayList<>(runs));
    }
  }

  @Override
  public List<RunSummary> runs() {
    if (runs == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(runs));
  }
}
