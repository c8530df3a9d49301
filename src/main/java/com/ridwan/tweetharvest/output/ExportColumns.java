package com.ridwan.tweetharvest.output;

import com.ridwan.tweetharvest.model.TweetRecord;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/** Column layout shared by every export format. */
public final class ExportColumns {

  public static final List<String> HEADER =
      List.of(
          "Date",
          "Username",
          "Display Name",
          "Text",
          "Retweets",
          "Likes",
          "Replies",
          "Quotes",
          "Views",
          "Tweet ID",
          "Tweet URL",
          "Export Path");

  private ExportColumns() {}

  /** Cell values in header order; engagement counters stay numeric. */
  public static List<Object> values(TweetRecord record, Path outputPath) {
    return Arrays.asList(
        record.getTimestamp(),
        record.getUsername(),
        record.getDisplayName(),
        record.getText(),
        record.getRetweets(),
        record.getLikes(),
        record.getReplies(),
        record.getQuotes(),
        record.getViews(),
        record.getId(),
        record.getUrl(),
        outputPath.toAbsolutePath().toString());
  }
}
