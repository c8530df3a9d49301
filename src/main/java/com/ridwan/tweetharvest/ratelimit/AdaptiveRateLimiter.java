package com.ridwan.tweetharvest.ratelimit;

import com.ridwan.tweetharvest.config.PacingConfig;
import com.ridwan.tweetharvest.retry.CancellableWaiter;
import com.ridwan.tweetharvest.retry.CancellationToken;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Paces upstream page requests, adapting the gap between calls to how the upstream behaves.
 *
 * <p>Strategy:
 *
 * <ul>
 *   <li>Fast responses: gradually speed up (reduce delay)
 *   <li>Slow responses: gradually slow down (increase delay)
 *   <li>Rate limit hit: back off aggressively (double delay)
 *   <li>Network or server errors: back off moderately
 * </ul>
 *
 * <p>Bounds and step sizes come from {@code harvest.pacing.*}. One instance serves the single
 * session a process runs; {@link #reset()} at session start.
 */
@Slf4j
@Component
public class AdaptiveRateLimiter {

  private final PacingConfig config;
  private final CancellableWaiter waiter;

  private long currentDelayMs;

  public AdaptiveRateLimiter(PacingConfig config, CancellableWaiter waiter) {
    this.config = config;
    this.waiter = waiter;
    this.currentDelayMs = config.getInitialDelayMs();
  }

  /** Waits the current delay before the next upstream call; cancellable. */
  public void waitBeforeNextCall(CancellationToken token) {
    if (currentDelayMs > 0) {
      log.debug("Waiting {}ms before next upstream call", currentDelayMs);
      waiter.await(Duration.ofMillis(currentDelayMs), token);
    }
  }

  public void recordSuccess(long responseTimeMs) {
    long previousDelay = currentDelayMs;

    if (responseTimeMs < config.getFastResponseThresholdMs()) {
      currentDelayMs = Math.max(config.getMinDelayMs(), currentDelayMs - config.getSpeedUpAmountMs());
      log.debug(
          "Fast response ({}ms) - reducing delay from {}ms to {}ms",
          responseTimeMs,
          previousDelay,
          currentDelayMs);
    } else if (responseTimeMs > config.getSlowResponseThresholdMs()) {
      currentDelayMs = Math.min(config.getMaxDelayMs(), currentDelayMs + config.getSlowDownAmountMs());
      log.debug(
          "Slow response ({}ms) - increasing delay from {}ms to {}ms",
          responseTimeMs,
          previousDelay,
          currentDelayMs);
    }
  }

  public void recordRateLimitHit() {
    long previousDelay = currentDelayMs;
    currentDelayMs = Math.min(config.getMaxDelayMs(), Math.max(currentDelayMs, 1) * 2);
    log.warn("Rate limit hit - pacing from {}ms to {}ms", previousDelay, currentDelayMs);
  }

  public void recordServerError() {
    long previousDelay = currentDelayMs;
    currentDelayMs = Math.min(config.getMaxDelayMs(), currentDelayMs + config.getSlowDownAmountMs());
    log.warn("Upstream error - pacing from {}ms to {}ms", previousDelay, currentDelayMs);
  }

  public void reset() {
    log.debug("Resetting pacing from {}ms to {}ms", currentDelayMs, config.getInitialDelayMs());
    currentDelayMs = config.getInitialDelayMs();
  }

  public long getCurrentDelayMs() {
    return currentDelayMs;
  }
}
