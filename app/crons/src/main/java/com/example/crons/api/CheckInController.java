/*
 * どこで: Crons API
 * 何を: ジョブ SDK からのチェックインを受け付けるエンドポイントを提供する
 * なぜ: 受付の成否を 202 と定義済みのエラーコードだけで返すため
 */
package com.example.crons.api;

import com.example.crons.api.request.CheckInRequest;
import com.example.crons.api.response.CheckInAcceptedResponse;
import com.example.crons.model.CheckInStatus;
import com.example.crons.model.MonitorConfig;
import com.example.crons.service.CheckInCommand;
import com.example.crons.service.CheckInIngestService;
import com.example.crons.service.CheckInResult;
import com.example.crons.service.MonitorConfigFactory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Validated
public class CheckInController {

  static final String SLUG_PATTERN = "^[a-zA-Z0-9][a-zA-Z0-9_-]{0,63}$";
  private static final String HEADER_REQUEST_TIMEOUT = "X-Request-Timeout-Ms";

  private final CheckInIngestService ingestService;
  private final MonitorConfigFactory monitorConfigFactory;

  @PostMapping("/monitors/{slug}/checkins")
  public ResponseEntity<CheckInAcceptedResponse> checkIn(
      @PathVariable("slug") @Pattern(regexp = SLUG_PATTERN, message = "slug is invalid")
          String slug,
      @RequestHeader(value = HEADER_REQUEST_TIMEOUT, required = false)
          @Positive(message = "X-Request-Timeout-Ms must be positive")
          Long timeoutMillis,
      @Valid @RequestBody CheckInRequest request) {
    final CheckInStatus status = parseStatus(request.status());
    final MonitorConfig config =
        request.monitorConfig() == null ? null : monitorConfigFactory.create(request.monitorConfig());
    final CheckInCommand command =
        new CheckInCommand(
            slug,
            request.environment(),
            status,
            request.checkInId(),
            request.durationSeconds(),
            config);
    final Duration timeout = timeoutMillis == null ? null : Duration.ofMillis(timeoutMillis);
    final CheckInResult result = ingestService.ingest(command, timeout);
    return ResponseEntity.accepted().body(new CheckInAcceptedResponse(result.checkInId()));
  }

  private CheckInStatus parseStatus(String status) {
    try {
      return CheckInStatus.fromValue(status);
    } catch (IllegalArgumentException ex) {
      throw new InvalidCheckInException(ex.getMessage(), ex);
    }
  }
}
