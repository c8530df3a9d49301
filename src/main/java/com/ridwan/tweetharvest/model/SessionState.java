package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything needed to resume an interrupted session. Persisted by the checkpoint store as JSON;
 * only the fields of the active {@link SessionMode} are populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionState {

  @JsonProperty("mode")
  private SessionMode mode;

  @JsonProperty("version")
  private int version;

  @JsonProperty("timestamp")
  private Instant timestamp;

  @JsonProperty("settings")
  private HarvestSettings settings;

  @JsonProperty("output_path")
  private String outputPath;

  /** Index into {@link #usernames} (batch) or {@link #links} (links). */
  @JsonProperty("current_index")
  private int currentIndex;

  /** Page token from which a timeline run resumes; null restarts the query. */
  @JsonProperty("next_cursor")
  private String nextCursor;

  /** End date of the refreshed search the cursor belongs to; null while on the original query. */
  @JsonProperty("refresh_until")
  private LocalDate refreshUntil;

  @JsonProperty("cursor_refreshes")
  private int cursorRefreshes;

  @JsonProperty("oldest_tweet_date")
  private LocalDate oldestTweetDate;

  @JsonProperty("newest_tweet_date")
  private LocalDate newestTweetDate;

  @JsonProperty("tweets_scraped")
  private int tweetsScraped;

  @JsonProperty("seen_tweet_ids")
  @Builder.Default
  private Set<String> seenTweetIds = new LinkedHashSet<>();

  @JsonProperty("has_more")
  @Builder.Default
  private boolean hasMore = true;

  @JsonProperty("current_username")
  private String currentUsername;

  @JsonProperty("usernames")
  @Builder.Default
  private List<String> usernames = new ArrayList<>();

  @JsonProperty("batch_results")
  @Builder.Default
  private List<AuthorOutcome> batchResults = new ArrayList<>();

  @JsonProperty("batch_total_tweets")
  private int batchTotalTweets;

  @JsonProperty("links")
  @Builder.Default
  private List<String> links = new ArrayList<>();

  @JsonProperty("total_links")
  private int totalLinks;

  @JsonProperty("processed_links")
  @Builder.Default
  private Set<String> processedLinks = new LinkedHashSet<>();

  @JsonProperty("failed_count")
  private int failedCount;

  @JsonProperty("skipped_count")
  private int skippedCount;

  @JsonProperty("stop_reason")
  private String stopReason;
}
