package com.ridwan.tweetharvest.progress;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs harvesting progress for one run: count, rate and, when a target is known, percentage and
 * ETA. Logs every 10 records or every 30 seconds, whichever comes first.
 */
@Slf4j
public class ProgressTracker {

  private static final int LOG_INTERVAL_TWEETS = 10;
  private static final long LOG_INTERVAL_SECONDS = 30;

  private final Clock clock;
  private String label;
  private Integer target;
  private int harvested;
  private int startCount;
  private Instant startTime;
  private Instant lastLogTime;

  public ProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Starts tracking.
   *
   * @param label what is being harvested, for log lines
   * @param target max records, or null when open-ended
   * @param alreadyHarvested count carried over from a resumed session
   */
  public void start(String label, Integer target, int alreadyHarvested) {
    this.label = label;
    this.target = target;
    this.harvested = alreadyHarvested;
    this.startCount = alreadyHarvested;
    this.startTime = clock.instant();
    this.lastLogTime = startTime;

    log.info("=== Harvest Started: {} ===", label);
    if (target != null) {
      log.info("Target: {} tweets ({} already harvested)", target, alreadyHarvested);
    }
  }

  public void increment() {
    harvested++;
    if (shouldLog()) {
      logProgress();
      lastLogTime = clock.instant();
    }
  }

  public void complete(String stopReason) {
    logProgress();
    log.info("=== Harvest Finished: {} ===", label);
    log.info("Stop reason: {}", stopReason);
    log.info("Total time: {}", formatDuration(Duration.between(startTime, clock.instant())));
  }

  private boolean shouldLog() {
    if (harvested % LOG_INTERVAL_TWEETS == 0) {
      return true;
    }
    return Duration.between(lastLogTime, clock.instant()).getSeconds() >= LOG_INTERVAL_SECONDS;
  }

  private void logProgress() {
    Duration elapsed = Duration.between(startTime, clock.instant());
    double rate = ratePerMinute(elapsed);

    if (target == null || target <= 0) {
      log.info(
          "Progress: {} tweets | Rate: {} tweets/min | Elapsed: {}",
          harvested,
          String.format("%.1f", rate),
          formatDuration(elapsed));
      return;
    }

    double percentComplete = Math.min(100.0, (harvested * 100.0) / target);
    log.info(
        "Progress: {}/{} tweets ({}%) | Rate: {} tweets/min | ETA: {}",
        harvested,
        target,
        String.format("%.1f", percentComplete),
        String.format("%.1f", rate),
        calculateEta(target - harvested, rate));
  }

  private double ratePerMinute(Duration elapsed) {
    double elapsedMinutes = elapsed.getSeconds() / 60.0;
    return elapsedMinutes > 0 ? (harvested - startCount) / elapsedMinutes : 0;
  }

  private String calculateEta(int remaining, double rate) {
    if (rate <= 0 || remaining <= 0) {
      return "calculating...";
    }
    return formatDuration(Duration.ofSeconds((long) (remaining / rate * 60)));
  }

  static String formatDuration(Duration duration) {
    long hours = duration.toHours();
    long minutes = duration.toMinutesPart();
    long seconds = duration.toSecondsPart();

    if (hours > 0) {
      return String.format("%dh %dm %ds", hours, minutes, seconds);
    } else if (minutes > 0) {
      return String.format("%dm %ds", minutes, seconds);
    } else {
      return String.format("%ds", seconds);
    }
  }

  public int getHarvestedCount() {
    return harvested;
  }
}
