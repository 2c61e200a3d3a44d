package com.example.crons.api;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.crons.api.request.IntervalScheduleRequest;
import com.example.crons.api.response.MonitorResponse;
import com.example.crons.api.response.RunSummary;
import com.example.crons.api.response.RunsResponse;
import com.example.crons.service.MonitorQueryService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MonitorController.class)
@Import(ApiExceptionHandler.class)
class MonitorControllerTest {

  private static final Instant CREATED_AT = Instant.parse("2024-01-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MonitorQueryService queryService;

  @Test
  void getReturnsConfigAndState() throws Exception {
    when(queryService.getMonitor("hourly-sync", "staging"))
        .thenReturn(
            new MonitorResponse(
                "hourly-sync",
                "staging",
                new IntervalScheduleRequest(2, "hour"),
                "Europe/Berlin",
                5,
                30,
                2,
                1,
                "DOWN",
                2,
                0,
                Instant.parse("2024-01-01T04:00:00Z"),
                "run-9",
                CREATED_AT,
                CREATED_AT));

    mockMvc
        .perform(get("/monitors/hourly-sync").param("environment", "staging"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.slug").value("hourly-sync"))
        .andExpect(jsonPath("$.schedule.type").value("interval"))
        .andExpect(jsonPath("$.schedule.value").value(2))
        .andExpect(jsonPath("$.schedule.unit").value("hour"))
        .andExpect(jsonPath("$.failure_issue_threshold").value(2))
        .andExpect(jsonPath("$.status").value("DOWN"))
        .andExpect(jsonPath("$.consecutive_failures").value(2))
        .andExpect(jsonPath("$.last_run_id").value("run-9"));
  }

  @Test
  void getUnknownMonitorIsNotFound() throws Exception {
    when(queryService.getMonitor("ghost", null))
        .thenThrow(new MonitorNotFoundException("ghost", "production"));

    mockMvc
        .perform(get("/monitors/ghost"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("MONITOR_NOT_FOUND"));
  }

  @Test
  void runsUsesDefaultLimit() throws Exception {
    when(queryService.listRuns(eq("nightly-report"), isNull(), eq(20)))
        .thenReturn(
            new RunsResponse(
                "nightly-report",
                "production",
                List.of(
                    new RunSummary(
                        "run-1",
                        Instant.parse("2024-01-10T02:00:00Z"),
                        null,
                        Instant.parse("2024-01-10T02:11:00Z"),
                        "missed"))));

    mockMvc
        .perform(get("/monitors/nightly-report/runs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.runs[0].run_id").value("run-1"))
        .andExpect(jsonPath("$.runs[0].status").value("missed"));

    verify(queryService).listRuns(eq("nightly-report"), isNull(), eq(20));
  }

  @Test
  void runsRejectsOutOfRangeLimit() throws Exception {
    mockMvc
        .perform(get("/monitors/nightly-report/runs").param("limit", "101"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be <= 100"));
    mockMvc
        .perform(get("/monitors/nightly-report/runs").param("limit", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit is invalid"));

    verifyNoInteractions(queryService);
  }

  @Test
  void runsForUnknownMonitorIsNotFound() throws Exception {
    when(queryService.listRuns(anyString(), anyString(), anyInt()))
        .thenThrow(new MonitorNotFoundException("ghost", "staging"));

    mockMvc
        .perform(get("/monitors/ghost/runs").param("environment", "staging"))
        .andExpect(status().isNotFound());
  }
}
