package com.ridwan.tweetharvest.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;

/** One page of search results. */
public interface UpstreamPage {

  List<JsonNode> records();

  /** Fetches the following page; empty when there are no more results. */
  Optional<UpstreamPage> next();

  /** Token that re-fetches this page through {@link UpstreamSession#search}, when supported. */
  Optional<String> cursor();

  /**
   * Token of the following page, usable with any open session's {@link UpstreamSession#search}.
   * Empty when there is no following page or the page cannot name it, in which case {@link
   * #next()} is the only way forward.
   */
  default Optional<String> nextCursor() {
    return Optional.empty();
  }
}
