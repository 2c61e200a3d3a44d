package com.example.crons.api.request;

import jakarta.validation.constraints.NotBlank;

public record CrontabScheduleRequest(
    @NotBlank(message = "crontab schedule value is required") String value)
    implements ScheduleRequest {}
