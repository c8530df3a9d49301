package com.ridwan.tweetharvest.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.tweetharvest.checkpoint.CheckpointStore;
import com.ridwan.tweetharvest.config.CheckpointConfig;
import com.ridwan.tweetharvest.config.CooldownConfig;
import com.ridwan.tweetharvest.config.PacingConfig;
import com.ridwan.tweetharvest.config.PaginationConfig;
import com.ridwan.tweetharvest.config.RetryConfig;
import com.ridwan.tweetharvest.cooldown.CooldownScheduler;
import com.ridwan.tweetharvest.normalize.TimestampNormalizer;
import com.ridwan.tweetharvest.normalize.TweetNormalizer;
import com.ridwan.tweetharvest.pagination.PaginationEngine;
import com.ridwan.tweetharvest.ratelimit.AdaptiveRateLimiter;
import com.ridwan.tweetharvest.retry.CancellableWaiter;
import com.ridwan.tweetharvest.retry.RetryPolicy;
import java.nio.file.Path;
import java.time.Clock;

/** Real engine components wired by hand, with instant waits and a checkpoint under a temp dir. */
public class EngineFixture {

  public final RecordingSleeper sleeper = new RecordingSleeper();
  public final CancellableWaiter waiter = new CancellableWaiter(sleeper);
  public final PacingConfig pacingConfig = new PacingConfig();
  public final RetryConfig retryConfig = new RetryConfig();
  public final CooldownConfig cooldownConfig = new CooldownConfig();
  public final PaginationConfig paginationConfig = new PaginationConfig();
  public final Clock clock = Clock.systemUTC();
  public final TweetNormalizer normalizer = new TweetNormalizer(new TimestampNormalizer());
  public final AdaptiveRateLimiter rateLimiter;
  public final RetryPolicy retryPolicy;
  public final CooldownScheduler cooldownScheduler;
  public final CheckpointStore checkpointStore;
  public final PaginationEngine engine;

  public EngineFixture(Path workDir) {
    pacingConfig.setInitialDelayMs(0);
    pacingConfig.setMinDelayMs(0);
    rateLimiter = new AdaptiveRateLimiter(pacingConfig, waiter);
    retryPolicy = new RetryPolicy(retryConfig, waiter, rateLimiter);
    cooldownScheduler = new CooldownScheduler(cooldownConfig, waiter);

    CheckpointConfig checkpointConfig = new CheckpointConfig();
    checkpointConfig.setFilePath(workDir.resolve("state/scraper_state.json").toString());
    checkpointStore = new CheckpointStore(new ObjectMapper(), checkpointConfig, clock);

    engine =
        new PaginationEngine(
            normalizer,
            retryPolicy,
            rateLimiter,
            cooldownScheduler,
            checkpointStore,
            paginationConfig,
            waiter,
            clock);
  }
}
