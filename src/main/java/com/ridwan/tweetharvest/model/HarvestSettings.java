package com.ridwan.tweetharvest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What to harvest. Stored verbatim in the session state so a resumed run uses the same query.
 * Dates are {@code yyyy-MM-dd}; a null max means unlimited.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HarvestSettings {

  @JsonProperty("username")
  private String username;

  @JsonProperty("keywords")
  @Builder.Default
  private List<String> keywords = new ArrayList<>();

  @JsonProperty("operator")
  @Builder.Default
  private KeywordOperator operator = KeywordOperator.OR;

  @JsonProperty("start_date")
  private String since;

  @JsonProperty("end_date")
  private String until;

  @JsonProperty("max_tweets")
  private Integer maxTweets;

  /** Null means the configured default export format. */
  @JsonProperty("export_format")
  private ExportFormat format;

  @JsonIgnore
  public boolean hasUsername() {
    return username != null && !username.isBlank();
  }

  @JsonIgnore
  public List<String> getCleanKeywords() {
    if (keywords == null) {
      return List.of();
    }
    return keywords.stream()
        .filter(k -> k != null && !k.isBlank())
        .map(String::trim)
        .collect(Collectors.toList());
  }

  /** Base name for the output file: the username, or up to three keywords. */
  @JsonIgnore
  public String getOutputLabel() {
    String label =
        hasUsername()
            ? username.trim()
            : getCleanKeywords().stream().limit(3).collect(Collectors.joining("_"));
    label = label.replaceAll("[^A-Za-z0-9_-]+", "_").replaceAll("^_+|_+$", "");
    return label.isEmpty() ? "tweets" : label;
  }
}
