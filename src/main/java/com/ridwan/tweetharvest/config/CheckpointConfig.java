package com.ridwan.tweetharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.checkpoint")
public class CheckpointConfig {
  private String filePath = "data/scraper_state.json";
}
