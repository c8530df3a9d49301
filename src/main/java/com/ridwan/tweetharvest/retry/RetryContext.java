package com.ridwan.tweetharvest.retry;

import java.time.Duration;
import lombok.Data;

/** Attempt bookkeeping for one guarded operation. Discarded when the operation completes. */
@Data
public class RetryContext {

  private final String operation;
  private FailureClass lastFailure;
  private Duration nextDelay = Duration.ZERO;
  private int networkRetries;
  private int glitchRetries;
  private int rateLimitWaits;
  private int credentialRefreshes;

  public int getTotalRetries() {
    return networkRetries + glitchRetries + rateLimitWaits + credentialRefreshes;
  }
}
