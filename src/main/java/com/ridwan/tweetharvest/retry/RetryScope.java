package com.ridwan.tweetharvest.retry;

import com.ridwan.tweetharvest.progress.HarvestListener;
import lombok.Builder;
import lombok.Value;

/** Caller-side hooks a guarded operation needs while retrying. */
@Value
@Builder(toBuilder = true)
public class RetryScope {

  @Builder.Default HarvestListener listener = HarvestListener.NONE;

  @Builder.Default CancellationToken cancellationToken = CancellationToken.none();

  /**
   * Invoked after the listener confirms refreshed credentials and before the operation is
   * re-attempted, typically to open a new upstream session. May be null.
   */
  Runnable reauthenticator;

  public static RetryScope of(HarvestListener listener, CancellationToken token) {
    return RetryScope.builder().listener(listener).cancellationToken(token).build();
  }
}
