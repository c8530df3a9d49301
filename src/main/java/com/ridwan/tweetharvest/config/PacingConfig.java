package com.ridwan.tweetharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.pacing")
public class PacingConfig {
  private long initialDelayMs = 1000;
  private long minDelayMs = 200;
  private long maxDelayMs = 10_000;
  private long fastResponseThresholdMs = 500;
  private long slowResponseThresholdMs = 3000;
  private long speedUpAmountMs = 100;
  private long slowDownAmountMs = 500;
}
