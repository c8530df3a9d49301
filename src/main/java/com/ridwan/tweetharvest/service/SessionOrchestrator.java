package com.ridwan.tweetharvest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ridwan.tweetharvest.checkpoint.CheckpointResult;
import com.ridwan.tweetharvest.checkpoint.CheckpointStore;
import com.ridwan.tweetharvest.client.UpstreamClient;
import com.ridwan.tweetharvest.client.UpstreamSession;
import com.ridwan.tweetharvest.config.ExportConfig;
import com.ridwan.tweetharvest.cooldown.CooldownScheduler;
import com.ridwan.tweetharvest.dedup.Deduplicator;
import com.ridwan.tweetharvest.exception.AuthExpiredException;
import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import com.ridwan.tweetharvest.exception.HarvestException;
import com.ridwan.tweetharvest.exception.MalformedInputException;
import com.ridwan.tweetharvest.exception.NetworkUnavailableException;
import com.ridwan.tweetharvest.links.TweetLinkParser;
import com.ridwan.tweetharvest.model.AuthorOutcome;
import com.ridwan.tweetharvest.model.BatchResult;
import com.ridwan.tweetharvest.model.ExportFormat;
import com.ridwan.tweetharvest.model.HarvestResult;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.LinkHarvestResult;
import com.ridwan.tweetharvest.model.SessionMode;
import com.ridwan.tweetharvest.model.SessionState;
import com.ridwan.tweetharvest.model.TweetRecord;
import com.ridwan.tweetharvest.normalize.TweetNormalizer;
import com.ridwan.tweetharvest.output.ExportSink;
import com.ridwan.tweetharvest.output.ExportSinkFactory;
import com.ridwan.tweetharvest.pagination.EngineState;
import com.ridwan.tweetharvest.pagination.PaginationEngine;
import com.ridwan.tweetharvest.pagination.TimelineRun;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.retry.CancellableWaiter;
import com.ridwan.tweetharvest.retry.CancellationToken;
import com.ridwan.tweetharvest.retry.RetryPolicy;
import com.ridwan.tweetharvest.retry.RetryScope;
import com.ridwan.tweetharvest.validation.HarvestRequestValidator;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs harvest sessions in one of three modes:
 *
 * <ul>
 *   <li>single: one author timeline or keyword search
 *   <li>batch: several authors in sequence, one output file each
 *   <li>links: individual tweets fetched by URL
 * </ul>
 *
 * Each mode can start fresh or resume from a saved {@link SessionState}.
 */
@Slf4j
@Service
public class SessionOrchestrator {

  private final UpstreamClient upstreamClient;
  private final PaginationEngine paginationEngine;
  private final CheckpointStore checkpointStore;
  private final ExportSinkFactory sinkFactory;
  private final HarvestRequestValidator validator;
  private final SearchQueryBuilder queryBuilder;
  private final TweetNormalizer normalizer;
  private final RetryPolicy retryPolicy;
  private final CancellableWaiter waiter;
  private final CooldownScheduler cooldownScheduler;
  private final TweetLinkParser linkParser;
  private final ExportConfig exportConfig;

  public SessionOrchestrator(
      UpstreamClient upstreamClient,
      PaginationEngine paginationEngine,
      CheckpointStore checkpointStore,
      ExportSinkFactory sinkFactory,
      HarvestRequestValidator validator,
      SearchQueryBuilder queryBuilder,
      TweetNormalizer normalizer,
      RetryPolicy retryPolicy,
      CancellableWaiter waiter,
      CooldownScheduler cooldownScheduler,
      TweetLinkParser linkParser,
      ExportConfig exportConfig) {
    this.upstreamClient = upstreamClient;
    this.paginationEngine = paginationEngine;
    this.checkpointStore = checkpointStore;
    this.sinkFactory = sinkFactory;
    this.validator = validator;
    this.queryBuilder = queryBuilder;
    this.normalizer = normalizer;
    this.retryPolicy = retryPolicy;
    this.waiter = waiter;
    this.cooldownScheduler = cooldownScheduler;
    this.linkParser = linkParser;
    this.exportConfig = exportConfig;
  }

  /**
   * Harvests one author timeline or keyword search.
   *
   * @param resumeFrom saved single-mode state to continue, or null for a fresh run; its settings
   *     take precedence over {@code settings}
   */
  public HarvestResult runSingle(
      HarvestSettings settings, HarvestControls controls, SessionState resumeFrom) {
    HarvestSettings effective =
        resumeFrom != null && resumeFrom.getSettings() != null ? resumeFrom.getSettings() : settings;
    validator.validateTimelineRequest(effective);

    SessionState state;
    ExportSink sink;
    if (resumeFrom != null) {
      requireMode(resumeFrom, SessionMode.SINGLE);
      state = resumeFrom;
      sink = reopen(state.getOutputPath());
      log.info("Resuming single session: {} tweets already harvested", state.getTweetsScraped());
    } else {
      ExportFormat format = formatOf(effective);
      Path outputPath = sinkFactory.newOutputPath(effective.getOutputLabel(), format);
      sink = sinkFactory.create(outputPath, format, effective.getOutputLabel());
      state =
          SessionState.builder()
              .mode(SessionMode.SINGLE)
              .settings(effective)
              .currentUsername(effective.getUsername())
              .outputPath(outputPath.toString())
              .build();
      checkpointStore.save(state);
    }

    try (ExportSink output = sink) {
      return paginationEngine.run(timelineRun(effective, state, output, controls));
    }
  }

  /**
   * Harvests several authors one after another. A failing author is recorded and skipped; expired
   * credentials and network exhaustion save the batch state and propagate.
   */
  public BatchResult runBatch(
      List<String> usernames,
      HarvestSettings settings,
      HarvestControls controls,
      SessionState resumeFrom) {
    SessionState state;
    if (resumeFrom != null) {
      requireMode(resumeFrom, SessionMode.BATCH);
      state = resumeFrom;
      log.info(
          "Resuming batch at user {}/{}", state.getCurrentIndex() + 1, state.getUsernames().size());
    } else {
      validator.validateBatchRequest(usernames, settings);
      state =
          SessionState.builder()
              .mode(SessionMode.BATCH)
              .usernames(HarvestRequestValidator.cleanUsernames(usernames))
              .settings(settings == null ? new HarvestSettings() : settings)
              .build();
      checkpointStore.save(state);
    }

    List<String> names = state.getUsernames();
    HarvestSettings base = state.getSettings() == null ? new HarvestSettings() : state.getSettings();
    HarvestListener listener = controls.getListener();
    int startIndex = state.getCurrentIndex();
    boolean completed = true;

    for (int i = startIndex; i < names.size(); i++) {
      if (controls.getCancellationToken().isCancellationRequested()) {
        completed = false;
        break;
      }

      String username = names.get(i);
      boolean resumingAuthor =
          resumeFrom != null
              && i == startIndex
              && state.getOutputPath() != null
              && username.equals(state.getCurrentUsername());
      if (!resumingAuthor) {
        resetAuthorProgress(state);
      }
      state.setCurrentIndex(i);
      state.setCurrentUsername(username);
      listener.onStatus(String.format("User %d/%d: @%s", i + 1, names.size(), username));

      HarvestSettings authorSettings =
          base.toBuilder().username(username).keywords(new ArrayList<>()).build();
      try {
        HarvestResult result = harvestAuthor(authorSettings, state, resumingAuthor, controls);
        if (result.isCancelled()) {
          completed = false;
          break;
        }
        recordOutcome(
            state,
            result.isFailed()
                ? AuthorOutcome.failure(username, result.getCount(), result.getError())
                : AuthorOutcome.success(username, result.getCount(), result.getOutputPath()));
      } catch (AuthExpiredException | NetworkUnavailableException e) {
        log.error("Batch interrupted at @{}: {}", username, e.getMessage());
        checkpointStore.save(state);
        throw e;
      } catch (HarvestException | UncheckedIOException e) {
        log.error("Failed to harvest @{}: {}", username, e.getMessage());
        listener.onStatus("Failed @" + username + ": " + e.getMessage());
        recordOutcome(state, AuthorOutcome.failure(username, state.getTweetsScraped(), e.getMessage()));
      }

      resetAuthorProgress(state);
      state.setCurrentIndex(i + 1);
      checkpointStore.save(state);
    }

    BatchResult result =
        BatchResult.builder()
            .outcomes(List.copyOf(state.getBatchResults()))
            .totalTweets(state.getBatchTotalTweets())
            .completed(completed)
            .build();
    log.info(
        "Batch {}: {} succeeded, {} failed, {} tweets",
        completed ? "complete" : "paused",
        result.getSuccessCount(),
        result.getFailureCount(),
        result.getTotalTweets());
    return result;
  }

  /**
   * Fetches individual tweets by URL into one output file. Malformed and duplicate links are
   * dropped up front; links already processed in {@code resumeFrom} are skipped.
   */
  public LinkHarvestResult runLinks(
      List<String> links, ExportFormat format, HarvestControls controls, SessionState resumeFrom) {
    SessionState state;
    ExportSink sink;
    if (resumeFrom != null) {
      requireMode(resumeFrom, SessionMode.LINKS);
      state = resumeFrom;
      sink = reopen(state.getOutputPath());
      log.info(
          "Resuming link session: {}/{} links processed",
          state.getProcessedLinks().size(),
          state.getTotalLinks());
    } else {
      validator.validateLinks(links);
      List<String> valid = linkParser.filterValid(links);
      if (valid.isEmpty()) {
        throw new MalformedInputException("No valid tweet links found");
      }
      ExportFormat effectiveFormat = format != null ? format : exportConfig.getFormat();
      Path outputPath = sinkFactory.newOutputPath("tweet_links", effectiveFormat);
      sink = sinkFactory.create(outputPath, effectiveFormat, "Tweet Links");
      state =
          SessionState.builder()
              .mode(SessionMode.LINKS)
              .links(valid)
              .totalLinks(valid.size())
              .outputPath(outputPath.toString())
              .settings(HarvestSettings.builder().format(effectiveFormat).build())
              .build();
      checkpointStore.save(state);
    }

    HarvestListener listener = controls.getListener();
    CancellationToken token = controls.getCancellationToken();
    Deduplicator deduplicator = new Deduplicator(state.getSeenTweetIds());
    AtomicReference<UpstreamSession> session = new AtomicReference<>();
    RetryScope authScope = RetryScope.of(listener, token);
    RetryScope scope =
        authScope.toBuilder()
            .reauthenticator(
                () -> {
                  closeQuietly(session.getAndSet(null));
                  session.set(retryPolicy.execute("re-authenticate", upstreamClient::authenticate, authScope));
                })
            .build();
    Duration linkDelay = Duration.ofSeconds(exportConfig.getLinkDelaySeconds());
    List<String> pending = state.getLinks();
    EngineState terminalState = EngineState.DONE;
    int lastSaved = state.getTweetsScraped();

    try (ExportSink output = sink) {
      session.set(retryPolicy.execute("authenticate", upstreamClient::authenticate, authScope));

      for (int i = state.getCurrentIndex(); i < pending.size(); i++) {
        token.throwIfCancelled();
        String link = pending.get(i);
        if (state.getProcessedLinks().contains(link)) {
          state.setCurrentIndex(i + 1);
          continue;
        }
        listener.onStatus(String.format("Link %d/%d", i + 1, pending.size()));

        boolean scraped = fetchLink(link, output, deduplicator, session, scope, state, listener);
        state.getProcessedLinks().add(link);
        state.setCurrentIndex(i + 1);

        if (state.getTweetsScraped() - lastSaved >= exportConfig.getLinksSaveInterval()) {
          saveLinkState(state, output, deduplicator);
          lastSaved = state.getTweetsScraped();
        }
        if (i < pending.size() - 1) {
          waiter.await(linkDelay, token);
          if (scraped) {
            cooldownScheduler.maybePause(state.getTweetsScraped(), token, listener);
          }
        }
      }
      state.setHasMore(false);
    } catch (HarvestCancelledException e) {
      terminalState = EngineState.ABORTED;
      log.info("Link session cancelled after {} links", state.getProcessedLinks().size());
    } finally {
      state.setSeenTweetIds(deduplicator.snapshot());
      checkpointStore.save(state);
      closeQuietly(session.get());
    }

    log.info(
        "Link session {}: {} scraped, {} failed, {} skipped",
        terminalState == EngineState.DONE ? "complete" : "paused",
        state.getTweetsScraped(),
        state.getFailedCount(),
        state.getSkippedCount());
    return LinkHarvestResult.builder()
        .outputPath(state.getOutputPath())
        .scraped(state.getTweetsScraped())
        .failed(state.getFailedCount())
        .skipped(state.getSkippedCount())
        .processedLinks(state.getProcessedLinks().size())
        .totalLinks(state.getTotalLinks())
        .terminalState(terminalState)
        .build();
  }

  /** @return true when the link produced an exported row */
  private boolean fetchLink(
      String link,
      ExportSink output,
      Deduplicator deduplicator,
      AtomicReference<UpstreamSession> session,
      RetryScope scope,
      SessionState state,
      HarvestListener listener) {
    String tweetId =
        linkParser
            .extractTweetId(link)
            .orElseThrow(() -> new MalformedInputException("Not a tweet link: " + link));
    try {
      Optional<JsonNode> payload =
          retryPolicy.executeUntilExhausted(
              "fetch tweet " + tweetId, () -> session.get().fetchById(tweetId), scope);
      if (payload.isEmpty()) {
        log.warn("Tweet {} not found", tweetId);
        state.setFailedCount(state.getFailedCount() + 1);
        return false;
      }

      Optional<TweetRecord> record = normalizer.normalize(payload.get());
      if (record.isEmpty() || !deduplicator.markSeen(record.get().getId())) {
        log.warn("Skipping tweet {}: unusable or duplicate payload", tweetId);
        state.setSkippedCount(state.getSkippedCount() + 1);
        return false;
      }

      output.append(record.get());
      state.setTweetsScraped(state.getTweetsScraped() + 1);
      listener.onProgress(state.getTweetsScraped());
      return true;
    } catch (AuthExpiredException | NetworkUnavailableException | HarvestCancelledException e) {
      throw e;
    } catch (HarvestException e) {
      log.error("Failed to fetch tweet {}: {}", tweetId, e.getMessage());
      listener.onStatus("Failed " + link + ": " + e.getMessage());
      state.setFailedCount(state.getFailedCount() + 1);
      return false;
    }
  }

  private void saveLinkState(SessionState state, ExportSink output, Deduplicator deduplicator) {
    output.flush();
    state.setSeenTweetIds(deduplicator.snapshot());
    CheckpointResult saved = checkpointStore.save(state);
    if (!saved.isSuccess()) {
      log.warn("Checkpoint not saved: {}", saved.getMessage());
    }
  }

  private HarvestResult harvestAuthor(
      HarvestSettings authorSettings,
      SessionState state,
      boolean resumingAuthor,
      HarvestControls controls) {
    validator.validateTimelineRequest(authorSettings);

    ExportSink sink;
    if (resumingAuthor) {
      sink = reopen(state.getOutputPath());
    } else {
      ExportFormat format = formatOf(authorSettings);
      Path outputPath = sinkFactory.newOutputPath(authorSettings.getOutputLabel(), format);
      sink = sinkFactory.create(outputPath, format, authorSettings.getUsername());
      state.setOutputPath(outputPath.toString());
    }

    try (ExportSink output = sink) {
      return paginationEngine.run(timelineRun(authorSettings, state, output, controls));
    }
  }

  private TimelineRun timelineRun(
      HarvestSettings settings, SessionState state, ExportSink sink, HarvestControls controls) {
    return TimelineRun.builder()
        .client(upstreamClient)
        .query(queryBuilder.build(settings))
        .settings(settings)
        .sink(sink)
        .state(state)
        .saveInterval(exportConfig.getTimelineSaveInterval())
        .listener(controls.getListener())
        .cancellationToken(controls.getCancellationToken())
        .promptHandler(controls.getPromptHandler())
        .refreshQuery(until -> queryBuilder.build(settings.toBuilder().until(until.toString()).build()))
        .build();
  }

  private static void recordOutcome(SessionState state, AuthorOutcome outcome) {
    state.getBatchResults().add(outcome);
    state.setBatchTotalTweets(state.getBatchTotalTweets() + outcome.getTweetCount());
  }

  private static void resetAuthorProgress(SessionState state) {
    state.setOutputPath(null);
    state.setTweetsScraped(0);
    state.setSeenTweetIds(new LinkedHashSet<>());
    state.setNextCursor(null);
    state.setRefreshUntil(null);
    state.setCursorRefreshes(0);
    state.setOldestTweetDate(null);
    state.setNewestTweetDate(null);
    state.setHasMore(true);
    state.setStopReason(null);
  }

  private ExportSink reopen(String outputPath) {
    if (outputPath == null) {
      throw new MalformedInputException("Saved state has no output file");
    }
    Path path = Paths.get(outputPath);
    return sinkFactory.reopen(path, sinkFactory.formatOf(path));
  }

  private ExportFormat formatOf(HarvestSettings settings) {
    return settings.getFormat() != null ? settings.getFormat() : exportConfig.getFormat();
  }

  private static void closeQuietly(UpstreamSession session) {
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close upstream session: {}", e.getMessage());
    }
  }

  private static void requireMode(SessionState state, SessionMode expected) {
    if (state.getMode() != expected) {
      throw new MalformedInputException(
          "Cannot resume a " + state.getMode() + " session as " + expected.getValue());
    }
  }
}
