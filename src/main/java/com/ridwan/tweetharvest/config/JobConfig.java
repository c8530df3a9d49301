package com.ridwan.tweetharvest.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.ridwan.tweetharvest.model.ExportFormat;
import com.ridwan.tweetharvest.model.KeywordOperator;
import com.ridwan.tweetharvest.model.SessionMode;

import lombok.Data;

/** Harvest to run at startup when {@code harvest.job.enabled=true}. */
@Data
@Component
@ConfigurationProperties(prefix = "harvest.job")
public class JobConfig {
  private boolean enabled = false;
  private SessionMode mode = SessionMode.SINGLE;
  private String username;
  private List<String> usernames = new ArrayList<>();
  private List<String> keywords = new ArrayList<>();
  private KeywordOperator operator = KeywordOperator.OR;
  private String since;
  private String until;
  private Integer maxTweets;
  private ExportFormat format;
  private String linksFile;
  private boolean resume = true;
}
