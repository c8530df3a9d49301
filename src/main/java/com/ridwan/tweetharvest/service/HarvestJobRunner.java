package com.ridwan.tweetharvest.service;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.ridwan.tweetharvest.checkpoint.CheckpointResult;
import com.ridwan.tweetharvest.checkpoint.CheckpointStore;
import com.ridwan.tweetharvest.config.JobConfig;
import com.ridwan.tweetharvest.links.LinkFileReader;
import com.ridwan.tweetharvest.model.BatchResult;
import com.ridwan.tweetharvest.model.HarvestResult;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.LinkHarvestResult;
import com.ridwan.tweetharvest.model.SessionMode;
import com.ridwan.tweetharvest.model.SessionState;
import com.ridwan.tweetharvest.progress.HarvestListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs the harvest described by {@code harvest.job.*} at startup, resuming a matching saved
 * session when {@code harvest.job.resume} is set. Headless: expired credentials cannot be
 * refreshed interactively, so they end the run with the state saved.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "harvest.job", name = "enabled", havingValue = "true")
public class HarvestJobRunner implements CommandLineRunner {

  private final SessionOrchestrator orchestrator;
  private final CheckpointStore checkpointStore;
  private final LinkFileReader linkFileReader;
  private final JobConfig jobConfig;

  public HarvestJobRunner(
      SessionOrchestrator orchestrator,
      CheckpointStore checkpointStore,
      LinkFileReader linkFileReader,
      JobConfig jobConfig) {
    this.orchestrator = orchestrator;
    this.checkpointStore = checkpointStore;
    this.linkFileReader = linkFileReader;
    this.jobConfig = jobConfig;
  }

  @Override
  public void run(String... args) {
    SessionMode mode = jobConfig.getMode();
    log.info("Starting {} harvest job...", mode.getValue());

    HarvestControls controls = HarvestControls.builder().listener(new LoggingListener()).build();
    SessionState resumeFrom = findResumableState(mode);

    switch (mode) {
      case BATCH:
        BatchResult batch =
            orchestrator.runBatch(jobConfig.getUsernames(), settings(), controls, resumeFrom);
        log.info("=== Batch Harvest Complete ===");
        log.info("Users succeeded: {}", batch.getSuccessCount());
        log.info("Users failed: {}", batch.getFailureCount());
        log.info("Total tweets: {}", batch.getTotalTweets());
        break;
      case LINKS:
        List<String> links =
            resumeFrom != null ? List.of() : linkFileReader.readLinks(Paths.get(jobConfig.getLinksFile()));
        LinkHarvestResult linkResult =
            orchestrator.runLinks(links, jobConfig.getFormat(), controls, resumeFrom);
        log.info("=== Link Harvest Complete ===");
        log.info("Scraped: {}, failed: {}, skipped: {}",
            linkResult.getScraped(), linkResult.getFailed(), linkResult.getSkipped());
        log.info("Output: {}", linkResult.getOutputPath());
        break;
      default:
        HarvestResult result = orchestrator.runSingle(settings(), controls, resumeFrom);
        log.info("=== Harvest Complete ===");
        log.info("Tweets: {} ({})", result.getCount(), result.getStopReason());
        log.info("Output: {}", result.getOutputPath());
    }
  }

  SessionState findResumableState(SessionMode mode) {
    if (!jobConfig.isResume() || !checkpointStore.hasSavedState()) {
      return null;
    }

    CheckpointResult loaded = checkpointStore.load();
    if (!loaded.isSuccess() || loaded.getState() == null) {
      log.warn("Ignoring saved state: {}", loaded.getMessage());
      return null;
    }
    SessionState state = loaded.getState();
    if (state.getMode() != mode) {
      log.info("Saved state is a {} session, starting a fresh {} run", state.getMode().getValue(), mode.getValue());
      return null;
    }

    CheckpointResult integrity = checkpointStore.validateIntegrity(state);
    if (!integrity.isSuccess()) {
      log.info("Saved state not resumable: {}", integrity.getMessage());
      return null;
    }

    checkpointStore.summarize().ifPresent(summary -> log.info("Resuming saved session:\n{}", summary));
    return state;
  }

  private HarvestSettings settings() {
    return HarvestSettings.builder()
        .username(jobConfig.getUsername())
        .keywords(new ArrayList<>(jobConfig.getKeywords()))
        .operator(jobConfig.getOperator())
        .since(jobConfig.getSince())
        .until(jobConfig.getUntil())
        .maxTweets(jobConfig.getMaxTweets())
        .format(jobConfig.getFormat())
        .build();
  }

  private static class LoggingListener implements HarvestListener {

    @Override
    public void onStatus(String message) {
      log.info("[status] {}", message);
    }

    @Override
    public boolean onCredentialsExpired(String reason) {
      log.error("[auth] {}. Update harvest.upstream.cookie and rerun to resume.", reason);
      return false;
    }

    @Override
    public void onNetworkDegraded(String reason) {
      log.warn("[network] {}", reason);
    }
  }
}
