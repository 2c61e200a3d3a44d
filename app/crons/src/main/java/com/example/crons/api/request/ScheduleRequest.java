/*
 * どこで: Crons API
 * 何を: monitor_config.schedule の crontab / interval を type で振り分ける
 * なぜ: 形の違う 2 種類のスケジュールを Map に落とさず型で受けるため
 */
package com.example.crons.api.request;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = CrontabScheduleRequest.class, name = "crontab"),
  @JsonSubTypes.Type(value = IntervalScheduleRequest.class, name = "interval")
})
public interface ScheduleRequest {}
