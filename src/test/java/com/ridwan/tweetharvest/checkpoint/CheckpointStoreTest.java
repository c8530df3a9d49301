package com.ridwan.tweetharvest.checkpoint;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.tweetharvest.config.CheckpointConfig;
import com.ridwan.tweetharvest.model.AuthorOutcome;
import com.ridwan.tweetharvest.model.ExportFormat;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.SessionMode;
import com.ridwan.tweetharvest.model.SessionState;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CheckpointStoreTest {

  @TempDir Path tempDir;

  private CheckpointStore store;
  private Path outputFile;

  @BeforeEach
  void setUp() throws Exception {
    CheckpointConfig config = new CheckpointConfig();
    config.setFilePath(tempDir.resolve("state/scraper_state.json").toString());
    Clock clock = Clock.fixed(Instant.parse("2024-03-09T14:05:07Z"), ZoneOffset.UTC);
    store = new CheckpointStore(new ObjectMapper(), config, clock);
    outputFile = Files.createFile(tempDir.resolve("alice.csv"));
  }

  @Test
  void shouldReportNoSavedStateInitially() {
    CheckpointResult result = store.load();

    assertTrue(result.isSuccess());
    assertNull(result.getState());
    assertEquals("No saved state", result.getMessage());
    assertFalse(store.hasSavedState());
  }

  @Test
  void shouldRoundTripSingleState() {
    SessionState state = singleState();
    state.setSeenTweetIds(new LinkedHashSet<>(List.of("3", "1", "2")));
    state.setNextCursor("page-4");
    state.setTweetsScraped(3);

    assertTrue(store.save(state).isSuccess());
    SessionState loaded = store.load().getState();

    assertEquals(SessionMode.SINGLE, loaded.getMode());
    assertEquals(CheckpointStore.SCHEMA_VERSION, loaded.getVersion());
    assertEquals(List.of("3", "1", "2"), new ArrayList<>(loaded.getSeenTweetIds()));
    assertEquals("page-4", loaded.getNextCursor());
    assertEquals(3, loaded.getTweetsScraped());
    assertEquals("alice", loaded.getSettings().getUsername());
    assertEquals(ExportFormat.CSV, loaded.getSettings().getFormat());
    assertEquals(Instant.parse("2024-03-09T14:05:07Z"), loaded.getTimestamp());
  }

  @Test
  void shouldWriteSnakeCaseKeys() throws Exception {
    store.save(singleState());

    String json = Files.readString(store.getCheckpointPath());

    assertTrue(json.contains("\"output_path\""));
    assertTrue(json.contains("\"seen_tweet_ids\""));
    assertTrue(json.contains("\"mode\" : \"single\""));
    assertTrue(json.contains("\"start_date\" : \"2024-01-01\""));
  }

  @Test
  void shouldKeepTimestampsStrictlyIncreasing() {
    SessionState state = singleState();

    store.save(state);
    Instant first = state.getTimestamp();
    store.save(state);

    assertTrue(state.getTimestamp().isAfter(first), "Same clock reading must still advance");
  }

  @Test
  void shouldKeepPreviousSaveAsBackup() {
    SessionState state = singleState();
    store.save(state);
    state.setTweetsScraped(10);
    store.save(state);

    assertTrue(Files.exists(store.getBackupPath()));
    assertEquals(10, store.load().getState().getTweetsScraped());
  }

  @Test
  void shouldRecoverFromBackupWhenPrimaryIsCorrupt() throws Exception {
    SessionState state = singleState();
    state.setTweetsScraped(5);
    store.save(state);
    state.setTweetsScraped(8);
    store.save(state);

    Files.writeString(store.getCheckpointPath(), "{ not json");
    CheckpointResult result = store.load();

    assertTrue(result.isSuccess());
    assertEquals("Recovered state from backup", result.getMessage());
    assertEquals(5, result.getState().getTweetsScraped());
  }

  @Test
  void shouldFailWhenPrimaryAndBackupAreUnusable() throws Exception {
    Files.createDirectories(store.getCheckpointPath().getParent());
    Files.writeString(store.getCheckpointPath(), "{ not json");
    Files.writeString(store.getBackupPath(), "[]");

    CheckpointResult result = store.load();

    assertFalse(result.isSuccess());
    assertTrue(result.getMessage().contains("backup is unusable"));
  }

  @Test
  void shouldRejectStructurallyInvalidState() throws Exception {
    Files.createDirectories(store.getCheckpointPath().getParent());
    Files.writeString(store.getCheckpointPath(), "{\"mode\": \"batch\", \"usernames\": []}");

    CheckpointResult result = store.load();

    assertFalse(result.isSuccess());
    assertTrue(result.getMessage().contains("batch state without usernames"));
  }

  @Test
  void shouldRefuseToSaveWithoutMode() {
    assertFalse(store.save(new SessionState()).isSuccess());
    assertFalse(store.hasSavedState());
  }

  @Test
  void shouldClearPrimaryAndBackup() {
    SessionState state = singleState();
    store.save(state);
    store.save(state);

    CheckpointResult result = store.clear();

    assertTrue(result.isSuccess());
    assertFalse(store.hasSavedState());
    assertNull(store.load().getState());
  }

  @Test
  void shouldValidateIntegrity() throws Exception {
    assertTrue(store.validateIntegrity(singleState()).isSuccess());

    SessionState missingOutput = singleState();
    missingOutput.setOutputPath(tempDir.resolve("gone.csv").toString());
    assertFalse(store.validateIntegrity(missingOutput).isSuccess());

    SessionState finishedBatch = batchState();
    finishedBatch.setCurrentIndex(2);
    CheckpointResult done = store.validateIntegrity(finishedBatch);
    assertFalse(done.isSuccess());
    assertEquals("Batch already completed", done.getMessage());

    SessionState links =
        SessionState.builder()
            .mode(SessionMode.LINKS)
            .links(List.of("https://x.com/a/status/1"))
            .totalLinks(1)
            .currentIndex(1)
            .build();
    assertFalse(store.validateIntegrity(links).isSuccess());

    SessionState negative = batchState();
    negative.setCurrentIndex(-1);
    assertFalse(store.validateIntegrity(negative).isSuccess());
  }

  @Test
  void shouldSummarizeBatchProgress() {
    SessionState state = batchState();
    state.setCurrentIndex(1);
    state.setCurrentUsername("bob");
    state.setBatchTotalTweets(40);
    state.setTweetsScraped(2);
    state.getBatchResults().add(AuthorOutcome.success("alice", 40, outputFile.toString()));
    store.save(state);

    String summary = store.summarize().orElseThrow();

    assertTrue(summary.contains("Mode: Batch scraping"));
    assertTrue(summary.contains("Progress: User 2/2 (@bob)"));
    assertTrue(summary.contains("Tweets scraped: 42"));
    assertTrue(summary.contains("Last saved: "));
    assertEquals(1, store.load().getState().getBatchResults().size());
  }

  @Test
  void shouldHaveNoSummaryWithoutState() {
    assertTrue(store.summarize().isEmpty());
  }

  private SessionState singleState() {
    return SessionState.builder()
        .mode(SessionMode.SINGLE)
        .settings(
            HarvestSettings.builder()
                .username("alice")
                .since("2024-01-01")
                .format(ExportFormat.CSV)
                .build())
        .outputPath(outputFile.toString())
        .build();
  }

  private SessionState batchState() {
    return SessionState.builder()
        .mode(SessionMode.BATCH)
        .usernames(new ArrayList<>(List.of("alice", "bob")))
        .settings(new HarvestSettings())
        .build();
  }
}
