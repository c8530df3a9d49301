package com.ridwan.tweetharvest.model;

import com.ridwan.tweetharvest.pagination.EngineState;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/** Outcome of one timeline run. */
@Value
@Builder
public class HarvestResult {

  String outputPath;
  int count;
  Set<String> seenTweetIds;
  boolean hasMore;
  EngineState terminalState;
  String stopReason;
  int pagesRead;
  int unusableRecords;

  /** Set when the run ended on an error that was not retried; null otherwise. */
  String error;

  int cursorRefreshes;

  /** Date of the oldest record seen in the session, accepted or past the start date. */
  LocalDate oldestTweetDate;

  LocalDate newestTweetDate;

  /** Requested start date; null when the search is open-ended. */
  LocalDate targetStartDate;

  /** True when the harvest reached back to the requested start date. */
  public boolean isDateRangeComplete() {
    if (targetStartDate == null) {
      return true;
    }
    return oldestTweetDate != null && !oldestTweetDate.isAfter(targetStartDate);
  }

  /** Days between the oldest record seen and the requested start date; zero when complete. */
  public long getDaysMissing() {
    if (targetStartDate == null || oldestTweetDate == null || isDateRangeComplete()) {
      return 0;
    }
    return ChronoUnit.DAYS.between(targetStartDate, oldestTweetDate);
  }

  public boolean isFailed() {
    return error != null;
  }

  public boolean isCancelled() {
    return terminalState == EngineState.ABORTED && error == null;
  }
}
