package com.example.crons.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** status は終端前なら in_progress、未開始なら pending。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummary(
    String runId, Instant expectedAt, Instant startedAt, Instant finishedAt, String status) {}
