package com.ridwan.tweetharvest.progress;

/**
 * Callbacks a caller receives while a session runs. All methods are invoked on the harvesting
 * thread and should return quickly.
 */
public interface HarvestListener {

  HarvestListener NONE = new HarvestListener() {};

  /** Running count of accepted records for the current run. */
  default void onProgress(int count) {}

  default void onStatus(String message) {}

  /**
   * Upstream rejected the credentials.
   *
   * @return true once fresh credentials are in place and the operation should be re-attempted
   */
  default boolean onCredentialsExpired(String reason) {
    return false;
  }

  default void onNetworkDegraded(String reason) {}
}
