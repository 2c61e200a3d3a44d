/*
 * どこで: Crons API
 * 何を: モニター状態と直近の Run の参照エンドポイントを提供する
 * なぜ: 取り込み結果とスイープ結果を外から確認できるようにするため
 */
package com.example.crons.api;

import com.example.crons.api.response.MonitorResponse;
import com.example.crons.api.response.RunsResponse;
import com.example.crons.service.MonitorQueryService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Validated
public class MonitorController {

  private final MonitorQueryService queryService;

  @GetMapping("/monitors/{slug}")
  public MonitorResponse get(
      @PathVariable("slug")
          @Pattern(regexp = CheckInController.SLUG_PATTERN, message = "slug is invalid")
          String slug,
      @RequestParam(value = "environment", required = false) String environment) {
    return queryService.getMonitor(slug, environment);
  }

  @GetMapping("/monitors/{slug}/runs")
  public RunsResponse runs(
      @PathVariable("slug")
          @Pattern(regexp = CheckInController.SLUG_PATTERN, message = "slug is invalid")
          String slug,
      @RequestParam(value = "environment", required = false) String environment,
      @RequestParam(value = "limit", defaultValue = "20")
          @Min(value = 1, message = "limit must be >= 1")
          @Max(value = 100, message = "limit must be <= 100")
          int limit) {
    return queryService.listRuns(slug, environment, limit);
  }
}
