package com.ridwan.tweetharvest.retry;

import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import com.ridwan.tweetharvest.progress.HarvestListener;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;

/**
 * Sleeps in ticks of at most one second, checking the cancellation token before each tick.
 * Every wait in the harvester goes through here.
 */
@Slf4j
@Component
public class CancellableWaiter {

  private static final long TICK_MS = 1000;

  private final Sleeper sleeper;

  public CancellableWaiter(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  public void await(Duration duration, CancellationToken token) {
    await(duration, token, HarvestListener.NONE, null, null);
  }

  /**
   * Waits for {@code duration}, reporting the remaining time to the listener every {@code
   * notifyEvery} when both it and {@code statusPrefix} are set.
   *
   * @throws HarvestCancelledException as soon as the token is observed set
   */
  public void await(
      Duration duration,
      CancellationToken token,
      HarvestListener listener,
      String statusPrefix,
      Duration notifyEvery) {
    long remainingMs = duration.toMillis();
    long notifyMs = notifyEvery == null ? 0 : notifyEvery.toMillis();
    long sinceNotifyMs = 0;

    if (remainingMs > 0) {
      log.debug("Waiting {}", mmss(remainingMs));
    }

    while (remainingMs > 0) {
      token.throwIfCancelled();
      long tick = Math.min(TICK_MS, remainingMs);
      try {
        sleeper.sleep(tick);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new HarvestCancelledException("Interrupted while waiting");
      }
      remainingMs -= tick;
      sinceNotifyMs += tick;

      if (notifyMs > 0 && statusPrefix != null && remainingMs > 0 && sinceNotifyMs >= notifyMs) {
        listener.onStatus(statusPrefix + " Resuming in " + mmss(remainingMs));
        sinceNotifyMs = 0;
      }
    }
    token.throwIfCancelled();
  }

  static String mmss(long millis) {
    long totalSeconds = (millis + 999) / 1000;
    return String.format("%d:%02d", totalSeconds / 60, totalSeconds % 60);
  }
}
