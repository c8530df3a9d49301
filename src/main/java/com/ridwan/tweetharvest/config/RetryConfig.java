package com.ridwan.tweetharvest.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.retry")
public class RetryConfig {

  /** Delay after each failed network attempt; the last entry repeats if attempts outnumber entries. */
  private List<Integer> networkDelaysSeconds = new ArrayList<>(List.of(30, 60, 120, 300, 600));

  /** Total calls, including the first, before a network failure is given up on. */
  private int networkMaxAttempts = 5;

  /** Failed attempt number from which the caller is told the network looks degraded. */
  private int networkDegradedAfter = 3;

  private int rateLimitWaitSeconds = 900;
  private int rateLimitNotifySeconds = 30;
  private int glitchMaxRetries = 3;
  private int glitchDelaySeconds = 5;
  private int maxCredentialRefreshes = 3;

  public int networkDelaySeconds(int failedAttempts) {
    if (networkDelaysSeconds == null || networkDelaysSeconds.isEmpty()) {
      return 0;
    }
    int index = Math.min(Math.max(failedAttempts, 1), networkDelaysSeconds.size()) - 1;
    return networkDelaysSeconds.get(index);
  }
}
