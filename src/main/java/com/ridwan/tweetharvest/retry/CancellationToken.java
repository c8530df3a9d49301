package com.ridwan.tweetharvest.retry;

import com.ridwan.tweetharvest.exception.HarvestCancelledException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Cooperative stop signal. Set it from any thread with {@link #cancel()}, or wrap a caller-owned
 * predicate with {@link #polling(BooleanSupplier)}; the harvesting thread polls it at every yield
 * point.
 */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final BooleanSupplier externalSignal;

  public CancellationToken() {
    this(() -> false);
  }

  private CancellationToken(BooleanSupplier externalSignal) {
    this.externalSignal = externalSignal;
  }

  public static CancellationToken polling(BooleanSupplier stopRequested) {
    return new CancellationToken(stopRequested);
  }

  /** A token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get() || externalSignal.getAsBoolean();
  }

  public void throwIfCancelled() {
    if (isCancellationRequested()) {
      throw new HarvestCancelledException("Stop requested");
    }
  }
}
