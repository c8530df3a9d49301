package com.ridwan.tweetharvest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.cooldown")
public class CooldownConfig {
  private boolean enabled = false;
  private int tweetInterval = 100;
  private int minBreakMinutes = 5;
  private int maxBreakMinutes = 10;
}
