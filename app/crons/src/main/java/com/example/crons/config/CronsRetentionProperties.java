package com.example.crons.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crons.retention")
public record CronsRetentionProperties(boolean enabled, Duration cleanupInterval) {}
