package com.ridwan.tweetharvest.pagination;

import java.time.LocalDate;

/**
 * Ways to restart a search that stalled before reaching its start date. Each bounds the new search
 * to end before a date derived from the oldest record collected so far; they are tried in order.
 */
public enum RefreshStrategy {
  STANDARD("standard", 0),
  DAY_BEFORE("day before", 1),
  WEEK_CHUNK("week chunk", 7);

  private final String label;
  private final int daysBack;

  RefreshStrategy(String label, int daysBack) {
    this.label = label;
    this.daysBack = daysBack;
  }

  /** Exclusive end date of the refreshed search. */
  public LocalDate untilFor(LocalDate oldestCollected) {
    return oldestCollected.minusDays(daysBack);
  }

  public String getLabel() {
    return label;
  }
}
