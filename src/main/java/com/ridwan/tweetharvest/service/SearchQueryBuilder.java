package com.ridwan.tweetharvest.service;

import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.KeywordOperator;
import com.ridwan.tweetharvest.validation.HarvestRequestValidator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the upstream search expression, e.g. {@code (from:alice) -filter:replies since:2024-01-01}
 * or {@code ("btc" OR "eth") -filter:replies}.
 */
@Component
public class SearchQueryBuilder {

  public String build(HarvestSettings settings) {
    StringBuilder query = new StringBuilder();

    if (settings.hasUsername()) {
      query.append("(from:").append(settings.getUsername().trim().replaceFirst("^@+", "")).append(')');
    } else {
      List<String> keywords = settings.getCleanKeywords();
      String joiner = settings.getOperator() == KeywordOperator.AND ? " AND " : " OR ";
      String terms =
          keywords.stream().map(k -> "\"" + k.replace("\"", "") + "\"").collect(Collectors.joining(joiner));
      query.append(keywords.size() > 1 ? "(" + terms + ")" : terms);
    }
    query.append(" -filter:replies");

    if (settings.getSince() != null && !settings.getSince().isBlank()) {
      query.append(" since:").append(HarvestRequestValidator.parseDate(settings.getSince()));
    }
    if (settings.getUntil() != null && !settings.getUntil().isBlank()) {
      query.append(" until:").append(HarvestRequestValidator.parseDate(settings.getUntil()));
    }
    return query.toString();
  }
}
