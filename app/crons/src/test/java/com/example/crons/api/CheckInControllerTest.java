/*
 * どこで: Crons API のWeb層テスト
 * 何を: チェックイン受付の 202 応答と、各例外の HTTP ステータス/エラーコードへの変換を検証する
 * なぜ: SDK が再送判断に使う 400/404/409/429/503/504 の契約を固定するため
 */
package com.example.crons.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.crons.api.request.CrontabScheduleRequest;
import com.example.crons.api.request.MonitorConfigRequest;
import com.example.crons.model.CheckInOutcome;
import com.example.crons.model.CheckInStatus;
import com.example.crons.model.MonitorConfig;
import com.example.crons.service.CheckInCommand;
import com.example.crons.service.CheckInIngestService;
import com.example.crons.service.CheckInResult;
import com.example.crons.service.MonitorConfigFactory;
import com.example.crons.store.MonitorVersionConflictException;
import com.example.crons.store.StoreDeadlineExceededException;
import com.example.crons.store.StoreUnavailableException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@WebMvcTest(CheckInController.class)
@Import(ApiExceptionHandler.class)
class CheckInControllerTest {

  private static final MonitorConfig NIGHTLY =
      MonitorConfig.crontab("0 2 * * *", ZoneOffset.UTC, 5, 30, 1, 1);

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CheckInIngestService ingestService;

  @MockitoBean private MonitorConfigFactory monitorConfigFactory;

  @Test
  void acceptedCheckInReturnsCheckInId() throws Exception {
    when(monitorConfigFactory.create(any(MonitorConfigRequest.class))).thenReturn(NIGHTLY);
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenReturn(new CheckInResult("run-1", UUID.randomUUID(), CheckInOutcome.STARTED));
    final String body =
        """
        {
          "status": "in_progress",
          "environment": "production",
          "check_in_id": "run-1",
          "monitor_config": {
            "schedule": {"type": "crontab", "value": "0 2 * * *"},
            "timezone": "UTC",
            "checkin_margin": 5,
            "max_runtime": 30
          }
        }
        """;

    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.check_in_id").value("run-1"));

    final ArgumentCaptor<CheckInCommand> commandCaptor =
        ArgumentCaptor.forClass(CheckInCommand.class);
    verify(ingestService).ingest(commandCaptor.capture(), isNull());
    final CheckInCommand command = commandCaptor.getValue();
    assertThat(command.slug()).isEqualTo("nightly-report");
    assertThat(command.environment()).isEqualTo("production");
    assertThat(command.status()).isEqualTo(CheckInStatus.IN_PROGRESS);
    assertThat(command.checkInId()).isEqualTo("run-1");
    assertThat(command.config()).isEqualTo(NIGHTLY);

    final ArgumentCaptor<MonitorConfigRequest> configCaptor =
        ArgumentCaptor.forClass(MonitorConfigRequest.class);
    verify(monitorConfigFactory).create(configCaptor.capture());
    assertThat(configCaptor.getValue().schedule())
        .isEqualTo(new CrontabScheduleRequest("0 2 * * *"));
    assertThat(configCaptor.getValue().checkinMargin()).isEqualTo(5);
  }

  @Test
  void requestTimeoutHeaderIsPassedAsDeadline() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), any(Duration.class)))
        .thenReturn(new CheckInResult("hb-1", UUID.randomUUID(), CheckInOutcome.HEARTBEAT));

    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .header("X-Request-Timeout-Ms", "250")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"ok\", \"duration_seconds\": 12.5}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.check_in_id").value("hb-1"));

    verify(ingestService).ingest(any(CheckInCommand.class), eq(Duration.ofMillis(250)));
    verifyNoInteractions(monitorConfigFactory);
  }

  @Test
  void missingStatusIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"check_in_id\": \"run-1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("status is required"));
    verifyNoInteractions(ingestService);
  }

  @Test
  void unknownStatusIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"running\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("unsupported status: running"));
  }

  @Test
  void negativeDurationIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"ok\", \"duration_seconds\": -1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("duration_seconds must be >= 0"));
  }

  @Test
  void overflowingDurationIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"ok\", \"duration_seconds\": 1e400}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("duration_seconds must be <= 31536000"));
  }

  @Test
  void invalidSlugIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/monitors/-nightly/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"ok\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
        .andExpect(jsonPath("$.message").value("slug is invalid"));
    verifyNoInteractions(ingestService);
  }

  @Test
  void unknownScheduleTypeIsBadRequest() throws Exception {
    final String body =
        """
        {
          "status": "ok",
          "monitor_config": {"schedule": {"type": "solar", "value": "noon"}}
        }
        """;

    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void invalidMonitorConfigIsBadRequest() throws Exception {
    when(monitorConfigFactory.create(any(MonitorConfigRequest.class)))
        .thenThrow(new InvalidMonitorConfigException("unknown timezone: Mars/Olympus"));
    final String body =
        """
        {
          "status": "ok",
          "monitor_config": {
            "schedule": {"type": "crontab", "value": "0 2 * * *"},
            "timezone": "Mars/Olympus"
          }
        }
        """;

    mockMvc
        .perform(
            post("/monitors/nightly-report/checkins")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("unknown timezone: Mars/Olympus"));
    verifyNoInteractions(ingestService);
  }

  @Test
  void unknownMonitorIsNotFound() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenThrow(new MonitorNotFoundException("nightly-report", "production"));

    performOk()
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("MONITOR_NOT_FOUND"));
  }

  @Test
  void rateLimitedIsTooManyRequests() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenThrow(new CheckInRateLimitedException("nightly-report", "production"));

    performOk()
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
  }

  @Test
  void exhaustedCasRetriesAreConflict() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenThrow(
            new CheckInConflictException(
                "check-in conflicted with concurrent updates",
                new MonitorVersionConflictException("nightly-report", "production", 3L)));

    performOk().andExpect(status().isConflict()).andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void storeOutageIsServiceUnavailableWithoutInternals() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenThrow(
            new StoreUnavailableException(
                "store unavailable after 3 attempts",
                new DataAccessResourceFailureException("jdbc:postgresql://db:5432 refused")));

    performOk()
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("store is unavailable"));
  }

  @Test
  void deadlineIsGatewayTimeout() throws Exception {
    when(ingestService.ingest(any(CheckInCommand.class), isNull()))
        .thenThrow(
            new CheckInDeadlineExceededException(
                "check-in deadline exceeded",
                new StoreDeadlineExceededException("deadline exceeded before store call")));

    performOk()
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("DEADLINE_EXCEEDED"));
  }

  private ResultActions performOk() throws Exception {
    return mockMvc.perform(
        post("/monitors/nightly-report/checkins")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"status\": \"ok\"}"));
  }
}
