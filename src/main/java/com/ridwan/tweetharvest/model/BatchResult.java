package com.ridwan.tweetharvest.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchResult {

  List<AuthorOutcome> outcomes;
  int totalTweets;

  /** False when the batch was cancelled before every author was attempted. */
  boolean completed;

  public long getSuccessCount() {
    return outcomes.stream().filter(AuthorOutcome::isSuccess).count();
  }

  public long getFailureCount() {
    return outcomes.size() - getSuccessCount();
  }
}
