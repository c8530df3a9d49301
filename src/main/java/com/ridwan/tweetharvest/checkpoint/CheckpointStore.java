package com.ridwan.tweetharvest.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ridwan.tweetharvest.config.CheckpointConfig;
import com.ridwan.tweetharvest.model.SessionMode;
import com.ridwan.tweetharvest.model.SessionState;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Durable session state. Each save copies the previous file to {@code <name>.backup} and then
 * atomically replaces the primary, so a crash mid-write leaves a readable copy behind. Single
 * writer; every method reports failure through {@link CheckpointResult} instead of throwing.
 */
@Service
@Slf4j
public class CheckpointStore {

  public static final int SCHEMA_VERSION = 2;

  private static final DateTimeFormatter SUMMARY_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Path checkpointPath;
  private final Path backupPath;
  private Instant lastTimestamp;

  public CheckpointStore(ObjectMapper objectMapper, CheckpointConfig config, Clock clock) {
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    this.clock = clock;
    this.checkpointPath = Paths.get(config.getFilePath()).toAbsolutePath();
    this.backupPath = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".backup");
  }

  public CheckpointResult save(SessionState state) {
    if (state == null || state.getMode() == null) {
      return CheckpointResult.failure("Refusing to save state without a mode");
    }
    state.setTimestamp(nextTimestamp());
    state.setVersion(SCHEMA_VERSION);

    try {
      Files.createDirectories(checkpointPath.getParent());
      if (Files.exists(checkpointPath)) {
        Files.copy(checkpointPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
      }

      Path temp = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
      moveIntoPlace(temp);

      log.info(
          "Checkpoint saved: mode={}, tweets={}, index={}",
          state.getMode().getValue(),
          state.getTweetsScraped(),
          state.getCurrentIndex());
      return CheckpointResult.ok("State saved", state);
    } catch (IOException e) {
      log.error("Failed to save checkpoint to {}: {}", checkpointPath, e.getMessage());
      return CheckpointResult.failure("Failed to save state: " + e.getMessage());
    }
  }

  /** Loads the primary file, falling back to the backup when the primary is missing or corrupt. */
  public CheckpointResult load() {
    boolean primaryExists = Files.exists(checkpointPath);
    boolean backupExists = Files.exists(backupPath);

    if (!primaryExists && !backupExists) {
      log.info("No checkpoint found at: {}", checkpointPath);
      return CheckpointResult.ok("No saved state");
    }

    CheckpointResult primary = primaryExists ? read(checkpointPath) : null;
    if (primary != null && primary.isSuccess()) {
      return primary;
    }

    if (backupExists) {
      log.warn(
          "Primary checkpoint unusable ({}), trying backup {}",
          primary == null ? "missing" : primary.getMessage(),
          backupPath);
      CheckpointResult backup = read(backupPath);
      if (backup.isSuccess()) {
        return CheckpointResult.ok("Recovered state from backup", backup.getState());
      }
      return CheckpointResult.failure(
          "Saved state is corrupt and backup is unusable: " + backup.getMessage());
    }
    return primary;
  }

  public CheckpointResult clear() {
    try {
      boolean deleted = Files.deleteIfExists(checkpointPath);
      deleted |= Files.deleteIfExists(backupPath);
      lastTimestamp = null;
      log.info("Checkpoint cleared: {}", checkpointPath);
      return CheckpointResult.ok(deleted ? "State cleared" : "No saved state");
    } catch (IOException e) {
      log.error("Failed to clear checkpoint {}: {}", checkpointPath, e.getMessage());
      return CheckpointResult.failure("Failed to clear state: " + e.getMessage());
    }
  }

  public boolean hasSavedState() {
    return Files.exists(checkpointPath) || Files.exists(backupPath);
  }

  /**
   * Checks that a loaded state can still be resumed: its output file exists and its cursor is in
   * range. A cursor past the end means the run already completed.
   */
  public CheckpointResult validateIntegrity(SessionState state) {
    if (state == null) {
      return CheckpointResult.failure("No state to validate");
    }

    String outputPath = state.getOutputPath();
    if (outputPath != null && !Files.exists(Paths.get(outputPath))) {
      return CheckpointResult.failure("Output file no longer exists: " + outputPath);
    }
    if (state.getMode() == SessionMode.SINGLE && outputPath == null) {
      return CheckpointResult.failure("Single session has no output file");
    }

    if (state.getMode() == SessionMode.BATCH
        && state.getCurrentIndex() >= state.getUsernames().size()) {
      return CheckpointResult.failure("Batch already completed");
    }
    if (state.getMode() == SessionMode.LINKS && state.getCurrentIndex() >= state.getTotalLinks()) {
      return CheckpointResult.failure("Link session already completed");
    }
    if (state.getCurrentIndex() < 0) {
      return CheckpointResult.failure("Negative cursor: " + state.getCurrentIndex());
    }
    return CheckpointResult.ok("State is resumable", state);
  }

  /** Human-readable description of the saved session, if any. */
  public Optional<String> summarize() {
    CheckpointResult loaded = load();
    if (!loaded.isSuccess() || loaded.getState() == null) {
      return Optional.empty();
    }
    SessionState state = loaded.getState();

    StringBuilder summary = new StringBuilder();
    summary.append("Mode: ").append(state.getMode().getDescription()).append('\n');
    switch (state.getMode()) {
      case BATCH:
        summary
            .append("Progress: User ")
            .append(state.getCurrentIndex() + 1)
            .append('/')
            .append(state.getUsernames().size());
        if (state.getCurrentUsername() != null) {
          summary.append(" (@").append(state.getCurrentUsername()).append(')');
        }
        summary.append('\n');
        summary.append("Tweets scraped: ").append(state.getBatchTotalTweets() + state.getTweetsScraped());
        break;
      case LINKS:
        summary
            .append("Progress: Link ")
            .append(state.getProcessedLinks().size())
            .append('/')
            .append(state.getTotalLinks())
            .append('\n');
        summary.append("Tweets scraped: ").append(state.getTweetsScraped()).append('\n');
        summary.append("Failed: ").append(state.getFailedCount());
        break;
      default:
        if (state.getSettings() != null && state.getSettings().hasUsername()) {
          summary.append("Target: @").append(state.getSettings().getUsername()).append('\n');
        } else if (state.getSettings() != null) {
          summary
              .append("Keywords: ")
              .append(String.join(", ", state.getSettings().getCleanKeywords()))
              .append('\n');
        }
        summary.append("Tweets scraped: ").append(state.getTweetsScraped());
    }
    if (state.getTimestamp() != null) {
      summary
          .append('\n')
          .append("Last saved: ")
          .append(SUMMARY_TIME.format(state.getTimestamp().atZone(ZoneId.systemDefault())));
    }
    return Optional.of(summary.toString());
  }

  public Path getCheckpointPath() {
    return checkpointPath;
  }

  public Path getBackupPath() {
    return backupPath;
  }

  private CheckpointResult read(Path path) {
    try {
      SessionState state = objectMapper.readValue(path.toFile(), SessionState.class);
      String problem = structuralProblem(state);
      if (problem != null) {
        log.warn("Checkpoint {} failed validation: {}", path, problem);
        return CheckpointResult.failure("Invalid saved state: " + problem);
      }
      log.info(
          "Checkpoint loaded from {}: mode={}, tweets={}",
          path,
          state.getMode().getValue(),
          state.getTweetsScraped());
      return CheckpointResult.ok("State loaded", state);
    } catch (JsonProcessingException e) {
      log.warn("Checkpoint {} is corrupt: {}", path, e.getOriginalMessage());
      return CheckpointResult.failure("Corrupt state file: " + e.getOriginalMessage());
    } catch (IOException e) {
      log.error("Failed to read checkpoint {}: {}", path, e.getMessage());
      return CheckpointResult.failure("Failed to read state: " + e.getMessage());
    }
  }

  private String structuralProblem(SessionState state) {
    if (state == null || state.getMode() == null) {
      return "missing mode";
    }
    switch (state.getMode()) {
      case BATCH:
        return state.getUsernames() == null || state.getUsernames().isEmpty()
            ? "batch state without usernames"
            : null;
      case LINKS:
        return state.getLinks() == null || state.getLinks().isEmpty()
            ? "link state without links"
            : null;
      default:
        return state.getOutputPath() == null ? "single state without output path" : null;
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(
          temp, checkpointPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move unsupported for {}, replacing in place", checkpointPath);
      Files.move(temp, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private Instant nextTimestamp() {
    Instant now = clock.instant();
    if (lastTimestamp != null && !now.isAfter(lastTimestamp)) {
      now = lastTimestamp.plusMillis(1);
    }
    lastTimestamp = now;
    return now;
  }
}
