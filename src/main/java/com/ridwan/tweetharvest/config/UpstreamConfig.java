package com.ridwan.tweetharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.upstream")
public class UpstreamConfig {
  private String baseUrl = "http://localhost:8089";

  /** Raw Cookie header sent with every request. */
  private String cookie;

  private int connectTimeoutMs = 30_000;
  private int responseTimeoutSeconds = 30;
}
