package com.ridwan.tweetharvest.pagination;

import com.ridwan.tweetharvest.config.PaginationConfig;

/**
 * Counts consecutive pages that yielded no accepted record. Separate from retry attempts: a page
 * that loads fine but contributes nothing still counts here.
 */
public class EmptyPageTracker {

  public enum Verdict {
    KEEP_GOING,
    NO_RESULTS,
    REFRESH_CURSOR,
    PROMPT,
    FORCE_STOP
  }

  private final PaginationConfig config;
  private int consecutiveEmpty = 0;
  private boolean promptedThisStreak = false;
  private boolean refreshedThisStreak = false;

  public EmptyPageTracker(PaginationConfig config) {
    this.config = config;
  }

  /**
   * Records an empty page.
   *
   * @param anyAccepted whether the session has accepted at least one record so far
   */
  public Verdict recordEmptyPage(boolean anyAccepted) {
    consecutiveEmpty++;

    if (!anyAccepted) {
      return consecutiveEmpty >= config.getNoResultsThreshold() ? Verdict.NO_RESULTS : Verdict.KEEP_GOING;
    }
    if (consecutiveEmpty >= config.getForceStopThreshold()) {
      return Verdict.FORCE_STOP;
    }
    if (consecutiveEmpty >= config.getPromptThreshold() && !promptedThisStreak) {
      promptedThisStreak = true;
      return Verdict.PROMPT;
    }
    if (consecutiveEmpty >= config.getRefreshThreshold() && !refreshedThisStreak) {
      refreshedThisStreak = true;
      return Verdict.REFRESH_CURSOR;
    }
    return Verdict.KEEP_GOING;
  }

  /** A page yielded records, or the caller chose to continue: start a new streak. */
  public void reset() {
    consecutiveEmpty = 0;
    promptedThisStreak = false;
    refreshedThisStreak = false;
  }

  public int getConsecutiveEmpty() {
    return consecutiveEmpty;
  }
}
