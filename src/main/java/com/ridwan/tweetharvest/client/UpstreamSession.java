package com.ridwan.tweetharvest.client;

import com.fasterxml.jackson.databind.JsonNode;

/** An authenticated conversation with the upstream. Not thread-safe. */
public interface UpstreamSession extends AutoCloseable {

  /**
   * Runs a search.
   *
   * @param query upstream search expression
   * @param cursor page token to start from, or null for the first page
   */
  UpstreamPage search(String query, String cursor);

  /**
   * Fetches a single tweet payload.
   *
   * @throws com.ridwan.tweetharvest.exception.RecordNotFoundException when no such tweet exists
   */
  JsonNode fetchById(String tweetId);

  @Override
  void close();
}
