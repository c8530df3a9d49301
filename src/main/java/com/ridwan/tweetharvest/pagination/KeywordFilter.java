package com.ridwan.tweetharvest.pagination;

import com.ridwan.tweetharvest.model.KeywordOperator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** Case-insensitive local check that a record's text honours the keyword operator. */
public class KeywordFilter {

  private final List<String> keywords;
  private final KeywordOperator operator;

  public KeywordFilter(List<String> keywords, KeywordOperator operator) {
    this.keywords =
        keywords == null
            ? List.of()
            : keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    this.operator = operator == null ? KeywordOperator.OR : operator;
  }

  public boolean matches(String text) {
    if (keywords.isEmpty()) {
      return true;
    }
    String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
    if (operator == KeywordOperator.AND) {
      return keywords.stream().allMatch(haystack::contains);
    }
    return keywords.stream().anyMatch(haystack::contains);
  }
}
