package com.ridwan.tweetharvest.config;

import com.ridwan.tweetharvest.model.ExportFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "harvest.export")
public class ExportConfig {
  private String directory = "data/exports";
  private ExportFormat format = ExportFormat.EXCEL;
  private int timelineSaveInterval = 50;
  private int linksSaveInterval = 20;
  private int linkDelaySeconds = 3;
}
