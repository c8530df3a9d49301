package com.ridwan.tweetharvest.model;

import com.ridwan.tweetharvest.pagination.EngineState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LinkHarvestResult {

  String outputPath;
  int scraped;
  int failed;
  int skipped;
  int processedLinks;
  int totalLinks;
  EngineState terminalState;
}
