package com.ridwan.tweetharvest.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.pagination")
public class PaginationConfig {
  /** Consecutive empty pages that end a run which never accepted a record. */
  private int noResultsThreshold = 3;

  /** Consecutive empty pages, after at least one accepted record, that trigger the caller prompt. */
  private int promptThreshold = 5;

  /** Consecutive empty pages that end the run when the prompt went unanswered. */
  private int forceStopThreshold = 10;

  /** Consecutive empty pages, after at least one accepted record, that trigger a cursor refresh. */
  private int refreshThreshold = 3;

  /** Cursor refreshes allowed per run. */
  private int maxCursorRefreshes = 20;

  /** Wait before each refresh strategy, indexed by refreshes so far; the last entry repeats. */
  private List<Integer> cursorRefreshDelaysSeconds = new ArrayList<>(List.of(5, 15, 30, 60, 120));

  public int cursorRefreshDelaySeconds(int refreshesSoFar) {
    if (cursorRefreshDelaysSeconds == null || cursorRefreshDelaysSeconds.isEmpty()) {
      return 0;
    }
    int index = Math.min(Math.max(refreshesSoFar, 0), cursorRefreshDelaysSeconds.size() - 1);
    return cursorRefreshDelaysSeconds.get(index);
  }
}
