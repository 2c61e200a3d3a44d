package com.example.crons.service;

import com.example.crons.model.CheckInOutcome;
import java.util.UUID;

public record CheckInResult(String checkInId, UUID runRef, CheckInOutcome outcome) {}
