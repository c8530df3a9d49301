package com.ridwan.tweetharvest.service;

import com.ridwan.tweetharvest.pagination.EmptyPagePromptHandler;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.retry.CancellationToken;
import lombok.Builder;
import lombok.Value;

/** Caller hooks shared by every run mode. */
@Value
@Builder
public class HarvestControls {

  @Builder.Default HarvestListener listener = HarvestListener.NONE;

  @Builder.Default CancellationToken cancellationToken = CancellationToken.none();

  @Builder.Default EmptyPagePromptHandler promptHandler = EmptyPagePromptHandler.UNRESOLVED;

  public static HarvestControls defaults() {
    return HarvestControls.builder().build();
  }
}
