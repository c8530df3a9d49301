package com.ridwan.tweetharvest.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.ridwan.tweetharvest.checkpoint.CheckpointResult;
import com.ridwan.tweetharvest.checkpoint.CheckpointStore;
import com.ridwan.tweetharvest.client.UpstreamPage;
import com.ridwan.tweetharvest.client.UpstreamSession;
import com.ridwan.tweetharvest.config.PaginationConfig;
import com.ridwan.tweetharvest.cooldown.CooldownScheduler;
import com.ridwan.tweetharvest.dedup.Deduplicator;
import com.ridwan.tweetharvest.exception.AuthExpiredException;
import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import com.ridwan.tweetharvest.exception.HarvestException;
import com.ridwan.tweetharvest.exception.NetworkUnavailableException;
import com.ridwan.tweetharvest.model.HarvestResult;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.SessionState;
import com.ridwan.tweetharvest.model.TweetRecord;
import com.ridwan.tweetharvest.normalize.TweetNormalizer;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.progress.ProgressTracker;
import com.ridwan.tweetharvest.ratelimit.AdaptiveRateLimiter;
import com.ridwan.tweetharvest.retry.CancellableWaiter;
import com.ridwan.tweetharvest.retry.CancellationToken;
import com.ridwan.tweetharvest.retry.RetryPolicy;
import com.ridwan.tweetharvest.retry.RetryScope;
import com.ridwan.tweetharvest.validation.HarvestRequestValidator;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drives one paginated harvest from authentication to a terminal state:
 *
 * <pre>
 * AUTHENTICATING -> SEARCHING -> CONSUMING_PAGE -> ADVANCING_PAGE
 *     -> { CONSUMING_PAGE | PROMPT_NEEDED | DONE | ABORTED }
 * </pre>
 *
 * <p>Every upstream call goes through {@link RetryPolicy}, and every page is requested through the
 * session that is live at the time of the call, so a re-authentication mid-run continues from the
 * same cursor. When a run with a start date stalls, either on a streak of empty pages or at the
 * end of results, the search is re-issued bounded by the oldest record collected (see {@link
 * RefreshStrategy}). Both terminal states flush the sink and save the session state before
 * returning. Authentication and network exhaustion propagate after that save; every other failure
 * ends the run as {@code ABORTED} with the error recorded on the result.
 */
@Slf4j
@Component
public class PaginationEngine {

  private final TweetNormalizer normalizer;
  private final RetryPolicy retryPolicy;
  private final AdaptiveRateLimiter rateLimiter;
  private final CooldownScheduler cooldownScheduler;
  private final CheckpointStore checkpointStore;
  private final PaginationConfig paginationConfig;
  private final CancellableWaiter waiter;
  private final Clock clock;

  public PaginationEngine(
      TweetNormalizer normalizer,
      RetryPolicy retryPolicy,
      AdaptiveRateLimiter rateLimiter,
      CooldownScheduler cooldownScheduler,
      CheckpointStore checkpointStore,
      PaginationConfig paginationConfig,
      CancellableWaiter waiter,
      Clock clock) {
    this.normalizer = normalizer;
    this.retryPolicy = retryPolicy;
    this.rateLimiter = rateLimiter;
    this.cooldownScheduler = cooldownScheduler;
    this.checkpointStore = checkpointStore;
    this.paginationConfig = paginationConfig;
    this.waiter = waiter;
    this.clock = clock;
  }

  public HarvestResult run(TimelineRun timelineRun) {
    return new Run(timelineRun).execute();
  }

  /** Mutable bookkeeping for a single invocation of {@link #run}. */
  private class Run {

    private final TimelineRun timeline;
    private final SessionState state;
    private final HarvestListener listener;
    private final CancellationToken token;
    private final Deduplicator deduplicator;
    private final KeywordFilter keywordFilter;
    private final EmptyPageTracker emptyPages;
    private final ProgressTracker progress;
    private final LocalDateTime startBoundary;
    private final LocalDateTime endBoundary;
    private final Integer maxTweets;

    private UpstreamSession session;
    private String activeQuery;
    private boolean refreshRequested;
    private boolean reachedStart;
    private EngineState engineState = EngineState.AUTHENTICATING;
    private int count;
    private int lastSavedCount;
    private int pagesRead;
    private int unusableRecords;
    private int duplicates;
    private boolean hasMore = true;
    private String stopReason;
    private String error;

    Run(TimelineRun timeline) {
      this.timeline = timeline;
      this.state = timeline.getState();
      this.listener = timeline.getListener();
      this.token = timeline.getCancellationToken();
      this.deduplicator = new Deduplicator(state.getSeenTweetIds());
      HarvestSettings settings = timeline.getSettings();
      this.keywordFilter = new KeywordFilter(settings.getCleanKeywords(), settings.getOperator());
      this.emptyPages = new EmptyPageTracker(paginationConfig);
      this.progress = new ProgressTracker(clock);
      this.startBoundary = boundary(settings.getSince(), 0);
      this.endBoundary = boundary(settings.getUntil(), 1);
      this.maxTweets = settings.getMaxTweets();
      this.count = state.getTweetsScraped();
      this.lastSavedCount = count;
      this.activeQuery =
          state.getRefreshUntil() != null && timeline.getRefreshQuery() != null
              ? timeline.getRefreshQuery().apply(state.getRefreshUntil())
              : timeline.getQuery();
    }

    HarvestResult execute() {
      RetryScope authScope = RetryScope.of(listener, token);
      RetryScope scope = authScope.toBuilder().reauthenticator(() -> reauthenticate(authScope)).build();

      rateLimiter.reset();
      progress.start(timeline.getQuery(), maxTweets, count);

      try {
        token.throwIfCancelled();
        if (limitReached()) {
          finish("Reached max tweets limit (" + maxTweets + ")");
          return result();
        }

        listener.onStatus("Authenticating...");
        session = retryPolicy.execute("authenticate", timeline.getClient()::authenticate, authScope);

        engineState = EngineState.SEARCHING;
        String resumeCursor = state.getNextCursor();
        listener.onStatus(
            resumeCursor == null ? "Searching: " + activeQuery : "Resuming search from saved page");
        Optional<UpstreamPage> page =
            retryPolicy.executeUntilExhausted(
                "search", () -> session.search(activeQuery, resumeCursor), scope);

        while (!engineState.isTerminal()) {
          if (page.isEmpty()) {
            page = refreshUntilExhausted(scope);
            if (page.isEmpty()) {
              finish(endOfResultsReason());
              break;
            }
          }
          consume(page.get());
          if (engineState.isTerminal()) {
            break;
          }
          Optional<UpstreamPage> refreshed = Optional.empty();
          if (refreshRequested) {
            refreshRequested = false;
            refreshed = refreshCursor(scope);
          }
          page = refreshed.isPresent() ? refreshed : advance(page.get(), scope);
        }
      } catch (HarvestCancelledException e) {
        engineState = EngineState.ABORTED;
        stopReason = "Stopped by user";
        log.info("Harvest cancelled after {} tweets", count);
      } catch (AuthExpiredException | NetworkUnavailableException e) {
        engineState = EngineState.ABORTED;
        stopReason = e.getMessage();
        log.error("Harvest interrupted after {} tweets: {}", count, e.getMessage());
        throw e;
      } catch (HarvestException | UncheckedIOException e) {
        engineState = EngineState.ABORTED;
        error = e.getMessage();
        stopReason = "Error: " + e.getMessage();
        log.error("Harvest aborted after {} tweets: {}", count, e.getMessage());
        listener.onStatus(stopReason);
      } finally {
        persist();
        closeSession();
        progress.complete(stopReason);
        reportDateRange();
      }

      return result();
    }

    private HarvestResult result() {
      return HarvestResult.builder()
          .outputPath(timeline.getSink().getOutputPath().toString())
          .count(count)
          .seenTweetIds(deduplicator.snapshot())
          .hasMore(hasMore)
          .terminalState(engineState)
          .stopReason(stopReason)
          .pagesRead(pagesRead)
          .unusableRecords(unusableRecords)
          .error(error)
          .cursorRefreshes(state.getCursorRefreshes())
          .oldestTweetDate(state.getOldestTweetDate())
          .newestTweetDate(state.getNewestTweetDate())
          .targetStartDate(startBoundary == null ? null : startBoundary.toLocalDate())
          .build();
    }

    private boolean limitReached() {
      return maxTweets != null && count >= maxTweets;
    }

    private void consume(UpstreamPage page) {
      engineState = EngineState.CONSUMING_PAGE;
      token.throwIfCancelled();
      pagesRead++;
      state.setNextCursor(page.cursor().orElse(null));

      int accepted = 0;
      boolean pageReachedStart = false;

      for (JsonNode raw : page.records()) {
        token.throwIfCancelled();

        Optional<TweetRecord> normalized = normalizer.normalize(raw);
        if (normalized.isEmpty()) {
          unusableRecords++;
          continue;
        }
        TweetRecord record = normalized.get();
        if (!deduplicator.markSeen(record.getId())) {
          duplicates++;
          continue;
        }
        trackDate(record.getCreatedAt());
        if (!keywordFilter.matches(record.getText())) {
          continue;
        }
        if (record.getCreatedAt() != null) {
          if (startBoundary != null && record.getCreatedAt().isBefore(startBoundary)) {
            pageReachedStart = true;
            continue;
          }
          if (endBoundary != null && !record.getCreatedAt().isBefore(endBoundary)) {
            continue;
          }
        }

        timeline.getSink().append(record);
        count++;
        accepted++;
        progress.increment();
        listener.onProgress(count);
        log.debug("Accepted tweet {} ({} total)", record.getId(), count);

        if (count - lastSavedCount >= timeline.getSaveInterval()) {
          persist();
        }
        if (limitReached()) {
          finish("Reached max tweets limit (" + maxTweets + ")");
          return;
        }
        cooldownScheduler.maybePause(count, token, listener);
      }

      log.info(
          "Page {}: {} accepted, {} total ({} duplicates, {} unusable so far)",
          pagesRead,
          accepted,
          count,
          duplicates,
          unusableRecords);

      if (accepted > 0) {
        emptyPages.reset();
      } else {
        onEmptyPage();
      }
      if (!engineState.isTerminal() && pageReachedStart) {
        reachedStart = true;
        finish("Reached start date");
      }
    }

    private void trackDate(LocalDateTime createdAt) {
      if (createdAt == null) {
        return;
      }
      LocalDate day = createdAt.toLocalDate();
      if (state.getOldestTweetDate() == null || day.isBefore(state.getOldestTweetDate())) {
        state.setOldestTweetDate(day);
      }
      if (state.getNewestTweetDate() == null || day.isAfter(state.getNewestTweetDate())) {
        state.setNewestTweetDate(day);
      }
    }

    private void onEmptyPage() {
      EmptyPageTracker.Verdict verdict = emptyPages.recordEmptyPage(count > 0);
      int streak = emptyPages.getConsecutiveEmpty();
      log.debug("Empty page streak: {} ({})", streak, verdict);

      switch (verdict) {
        case NO_RESULTS:
          finish("No matching tweets found");
          break;
        case REFRESH_CURSOR:
          refreshRequested = canRefresh();
          break;
        case FORCE_STOP:
          finish("No new tweets in " + streak + " consecutive pages");
          break;
        case PROMPT:
          engineState = EngineState.PROMPT_NEEDED;
          listener.onStatus("No new tweets in " + streak + " consecutive pages");
          PromptDecision decision = timeline.getPromptHandler().onEmptyPages(streak, count);
          log.info("Empty page prompt after {} pages answered: {}", streak, decision);
          if (decision == PromptDecision.STOP) {
            finish("Stopped after " + streak + " empty pages");
          } else if (decision == PromptDecision.CONTINUE) {
            emptyPages.reset();
          }
          break;
        default:
          break;
      }
    }

    private Optional<UpstreamPage> advance(UpstreamPage current, RetryScope scope) {
      engineState = EngineState.ADVANCING_PAGE;
      token.throwIfCancelled();
      rateLimiter.waitBeforeNextCall(token);

      long startTime = clock.millis();
      Optional<UpstreamPage> next =
          retryPolicy
              .executeUntilExhausted("next page", () -> fetchFollowing(current), scope)
              .flatMap(Function.identity());
      rateLimiter.recordSuccess(clock.millis() - startTime);
      return next;
    }

    /** Requests the page after {@code current} through the session live at call time. */
    private Optional<UpstreamPage> fetchFollowing(UpstreamPage current) {
      Optional<String> nextCursor = current.nextCursor();
      if (nextCursor.isPresent()) {
        return Optional.of(session.search(activeQuery, nextCursor.get()));
      }
      return current.next();
    }

    private boolean canRefresh() {
      return timeline.getRefreshQuery() != null
          && startBoundary != null
          && !reachedStart
          && state.getOldestTweetDate() != null
          && state.getOldestTweetDate().isAfter(startBoundary.toLocalDate())
          && state.getCursorRefreshes() < paginationConfig.getMaxCursorRefreshes();
    }

    private Optional<UpstreamPage> refreshUntilExhausted(RetryScope scope) {
      while (canRefresh()) {
        Optional<UpstreamPage> refreshed = refreshCursor(scope);
        if (refreshed.isPresent()) {
          return refreshed;
        }
      }
      return Optional.empty();
    }

    /**
     * One cursor refresh: tries each {@link RefreshStrategy} until one returns a non-empty page.
     * Counts as a single refresh whether or not a strategy succeeds.
     */
    private Optional<UpstreamPage> refreshCursor(RetryScope scope) {
      if (!canRefresh()) {
        return Optional.empty();
      }
      engineState = EngineState.SEARCHING;
      int attempt = state.getCursorRefreshes() + 1;
      LocalDate oldest = state.getOldestTweetDate();
      LocalDate start = startBoundary.toLocalDate();
      listener.onStatus(
          String.format(
              "Cursor refresh %d/%d: ~%d days remaining before %s",
              attempt,
              paginationConfig.getMaxCursorRefreshes(),
              ChronoUnit.DAYS.between(start, oldest),
              oldest));

      try {
        for (RefreshStrategy strategy : RefreshStrategy.values()) {
          LocalDate until = strategy.untilFor(oldest);
          if (!until.isAfter(start)) {
            continue;
          }
          Duration delay =
              Duration.ofSeconds(paginationConfig.cursorRefreshDelaySeconds(state.getCursorRefreshes()));
          waiter.await(delay, token);

          String query = timeline.getRefreshQuery().apply(until);
          log.info("Cursor refresh {} ({}): {}", attempt, strategy.getLabel(), query);
          Optional<UpstreamPage> page =
              retryPolicy.executeUntilExhausted(
                  "cursor refresh", () -> session.search(query, null), scope);
          if (page.isPresent() && !page.get().records().isEmpty()) {
            activeQuery = query;
            state.setRefreshUntil(until);
            state.setNextCursor(null);
            emptyPages.reset();
            listener.onStatus("Cursor refresh succeeded (" + strategy.getLabel() + "), continuing");
            return page;
          }
          log.info("Cursor refresh {} ({}) returned no records", attempt, strategy.getLabel());
        }
      } finally {
        state.setCursorRefreshes(attempt);
      }
      listener.onStatus("Cursor refresh " + attempt + " found nothing new");
      return Optional.empty();
    }

    private String endOfResultsReason() {
      if (count == 0) {
        return "No results found";
      }
      if (state.getCursorRefreshes() > 0 && !reachedStart && startBoundary != null
          && state.getOldestTweetDate() != null
          && state.getOldestTweetDate().isAfter(startBoundary.toLocalDate())) {
        return String.format(
            "Exhausted %d cursor refreshes with ~%d days remaining",
            state.getCursorRefreshes(),
            ChronoUnit.DAYS.between(startBoundary.toLocalDate(), state.getOldestTweetDate()));
      }
      return "End of results";
    }

    private void reportDateRange() {
      if (startBoundary == null || state.getOldestTweetDate() == null) {
        return;
      }
      LocalDate target = startBoundary.toLocalDate();
      LocalDate oldest = state.getOldestTweetDate();
      String message;
      if (oldest.isAfter(target)) {
        message =
            String.format(
                "Date range incomplete: missing ~%d days (oldest: %s, target: %s)",
                ChronoUnit.DAYS.between(target, oldest), oldest, target);
        log.warn(message);
      } else {
        message = String.format("Date range complete: %s to %s", oldest, state.getNewestTweetDate());
        log.info(message);
      }
      listener.onStatus(message);
    }

    private void finish(String reason) {
      engineState = EngineState.DONE;
      hasMore = false;
      stopReason = reason;
      listener.onStatus(reason);
      log.info("Harvest done: {} ({} tweets, {} pages)", reason, count, pagesRead);
    }

    private void reauthenticate(RetryScope authScope) {
      closeSession();
      session = retryPolicy.execute("re-authenticate", timeline.getClient()::authenticate, authScope);
    }

    private void persist() {
      try {
        timeline.getSink().flush();
      } catch (UncheckedIOException e) {
        log.error("Failed to flush export {}: {}", timeline.getSink().getOutputPath(), e.getMessage());
      }

      state.setTweetsScraped(count);
      state.setSeenTweetIds(deduplicator.snapshot());
      state.setHasMore(hasMore);
      state.setStopReason(stopReason);
      state.setOutputPath(timeline.getSink().getOutputPath().toString());

      CheckpointResult saved = checkpointStore.save(state);
      if (!saved.isSuccess()) {
        log.warn("Checkpoint not saved: {}", saved.getMessage());
      }
      lastSavedCount = count;
    }

    private void closeSession() {
      if (session == null) {
        return;
      }
      try {
        session.close();
      } catch (RuntimeException e) {
        log.warn("Failed to close upstream session: {}", e.getMessage());
      }
      session = null;
    }
  }

  private static LocalDateTime boundary(String date, int plusDays) {
    if (date == null || date.isBlank()) {
      return null;
    }
    LocalDate parsed = HarvestRequestValidator.parseDate(date);
    return parsed.plusDays(plusDays).atStartOfDay();
  }
}
