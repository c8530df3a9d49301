package com.ridwan.tweetharvest.cooldown;

import com.ridwan.tweetharvest.config.CooldownConfig;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.retry.CancellableWaiter;
import com.ridwan.tweetharvest.retry.CancellationToken;
import java.time.Duration;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Preventive breaks: after every {@code tweet-interval} accepted records, pauses for a random
 * whole number of minutes between the configured bounds.
 */
@Slf4j
@Component
public class CooldownScheduler {

  private static final Duration STATUS_INTERVAL = Duration.ofSeconds(30);

  private final CooldownConfig config;
  private final CancellableWaiter waiter;
  private final Random random;

  @Autowired
  public CooldownScheduler(CooldownConfig config, CancellableWaiter waiter) {
    this(config, waiter, new Random());
  }

  CooldownScheduler(CooldownConfig config, CancellableWaiter waiter, Random random) {
    this.config = config;
    this.waiter = waiter;
    this.random = random;
  }

  public boolean isDue(int acceptedCount) {
    return config.isEnabled()
        && config.getTweetInterval() > 0
        && acceptedCount > 0
        && acceptedCount % config.getTweetInterval() == 0;
  }

  /**
   * Takes a break if one is due at {@code acceptedCount}.
   *
   * @return the break length, zero when none was taken
   */
  public Duration maybePause(int acceptedCount, CancellationToken token, HarvestListener listener) {
    if (!isDue(acceptedCount)) {
      return Duration.ZERO;
    }

    int min = Math.max(0, config.getMinBreakMinutes());
    int max = Math.max(min, config.getMaxBreakMinutes());
    Duration pause = Duration.ofMinutes(min + random.nextInt(max - min + 1));

    String message =
        String.format("Taking a %d-minute break after %d tweets", pause.toMinutes(), acceptedCount);
    log.info(message);
    listener.onStatus(message);
    waiter.await(pause, token, listener, "On break.", STATUS_INTERVAL);
    listener.onStatus("Break complete, resuming");
    return pause;
  }
}
