package com.ridwan.tweetharvest.links;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Recognizes twitter.com / x.com status URLs and extracts their tweet ids. */
@Slf4j
@Component
public class TweetLinkParser {

  private static final Pattern STATUS_URL =
      Pattern.compile("^https?://(www\\.)?(twitter\\.com|x\\.com)/\\w+/status/(\\d+)");

  public Optional<String> extractTweetId(String link) {
    if (link == null) {
      return Optional.empty();
    }
    Matcher matcher = STATUS_URL.matcher(link.trim());
    return matcher.find() ? Optional.of(matcher.group(3)) : Optional.empty();
  }

  public boolean isValid(String link) {
    return extractTweetId(link).isPresent();
  }

  /** Valid links in input order, trimmed, with malformed entries and duplicates dropped. */
  public List<String> filterValid(List<String> links) {
    Set<String> valid = new LinkedHashSet<>();
    int malformed = 0;
    int duplicates = 0;
    for (String link : links) {
      if (link == null || link.isBlank()) {
        continue;
      }
      String trimmed = link.trim();
      if (!isValid(trimmed)) {
        log.warn("Skipping malformed tweet link: {}", trimmed);
        malformed++;
        continue;
      }
      if (!valid.add(trimmed)) {
        duplicates++;
      }
    }
    if (malformed > 0 || duplicates > 0) {
      log.info(
          "Link list: {} valid, {} malformed, {} duplicates skipped",
          valid.size(),
          malformed,
          duplicates);
    }
    return new ArrayList<>(valid);
  }
}
