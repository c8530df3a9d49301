package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Result of one author inside a batch run. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorOutcome {

  public enum Status {
    SUCCESS,
    FAILED
  }

  @JsonProperty("username")
  String username;

  @JsonProperty("status")
  Status status;

  @JsonProperty("tweet_count")
  int tweetCount;

  @JsonProperty("output_path")
  String outputPath;

  @JsonProperty("error")
  String error;

  public static AuthorOutcome success(String username, int tweetCount, String outputPath) {
    return AuthorOutcome.builder()
        .username(username)
        .status(Status.SUCCESS)
        .tweetCount(tweetCount)
        .outputPath(outputPath)
        .build();
  }

  public static AuthorOutcome failure(String username, int tweetCount, String error) {
    return AuthorOutcome.builder()
        .username(username)
        .status(Status.FAILED)
        .tweetCount(tweetCount)
        .error(error)
        .build();
  }

  @JsonIgnore
  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }
}
