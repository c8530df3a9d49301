package com.ridwan.tweetharvest.pagination;

import com.ridwan.tweetharvest.client.UpstreamClient;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.SessionState;
import com.ridwan.tweetharvest.output.ExportSink;
import com.ridwan.tweetharvest.progress.HarvestListener;
import com.ridwan.tweetharvest.retry.CancellationToken;
import java.time.LocalDate;
import java.util.function.Function;
import lombok.Builder;
import lombok.Value;

/**
 * Inputs of one paginated run. {@link #state} is updated in place and saved at every save point;
 * when resuming it carries the seen ids, count and cursor of the interrupted run.
 */
@Value
@Builder
public class TimelineRun {

  UpstreamClient client;
  String query;
  HarvestSettings settings;
  ExportSink sink;
  SessionState state;

  @Builder.Default int saveInterval = 50;

  @Builder.Default HarvestListener listener = HarvestListener.NONE;

  @Builder.Default CancellationToken cancellationToken = CancellationToken.none();

  @Builder.Default EmptyPagePromptHandler promptHandler = EmptyPagePromptHandler.UNRESOLVED;

  /**
   * Builds the same search bounded to end before the given date. Null disables cursor refresh.
   */
  Function<LocalDate, String> refreshQuery;
}
