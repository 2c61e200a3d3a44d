package com.example.crons.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record IntervalScheduleRequest(
    @NotNull(message = "interval schedule value is required")
        @Positive(message = "interval schedule value must be >= 1")
        Integer value,
    @NotBlank(message = "interval schedule unit is required") String unit)
    implements ScheduleRequest {}
