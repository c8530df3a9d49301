package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One tweet in canonical form, ready for export. */
@Value
@Builder
public class TweetRecord {

  String id;

  /** Normalized to {@code yyyy-MM-dd HH:mm:ss}, or the raw upstream value when unparseable. */
  String timestamp;

  /** Parsed form of {@link #timestamp}; null when parsing failed. */
  LocalDateTime createdAt;

  String username;
  String displayName;
  String text;
  long retweets;
  long likes;
  long replies;
  long quotes;
  long views;
  String url;
  JsonNode raw;

  public boolean hasUsername() {
    return username != null && !username.isEmpty();
  }
}
