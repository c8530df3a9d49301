package com.ridwan.tweetharvest.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ridwan.tweetharvest.checkpoint.CheckpointResult;
import com.ridwan.tweetharvest.checkpoint.CheckpointStore;
import com.ridwan.tweetharvest.config.JobConfig;
import com.ridwan.tweetharvest.links.LinkFileReader;
import com.ridwan.tweetharvest.model.BatchResult;
import com.ridwan.tweetharvest.model.ExportFormat;
import com.ridwan.tweetharvest.model.HarvestResult;
import com.ridwan.tweetharvest.model.HarvestSettings;
import com.ridwan.tweetharvest.model.LinkHarvestResult;
import com.ridwan.tweetharvest.model.SessionMode;
import com.ridwan.tweetharvest.model.SessionState;
import com.ridwan.tweetharvest.pagination.EngineState;

@ExtendWith(MockitoExtension.class)
class HarvestJobRunnerTest {

    @Mock
    private SessionOrchestrator orchestrator;

    @Mock
    private CheckpointStore checkpointStore;

    @Mock
    private LinkFileReader linkFileReader;

    private JobConfig jobConfig;

    private HarvestJobRunner runner;

    @BeforeEach
    void setUp() {
        jobConfig = new JobConfig();
        jobConfig.setEnabled(true);
        jobConfig.setUsername("alice");
        jobConfig.setSince("2024-01-01");
        jobConfig.setMaxTweets(100);
        jobConfig.setFormat(ExportFormat.CSV);

        runner = new HarvestJobRunner(orchestrator, checkpointStore, linkFileReader, jobConfig);
    }

    @Test
    void shouldRunSingleHarvestFromJobSettings() {
        when(checkpointStore.hasSavedState()).thenReturn(false);
        when(orchestrator.runSingle(any(HarvestSettings.class), any(HarvestControls.class), isNull()))
            .thenReturn(HarvestResult.builder()
                .count(100)
                .terminalState(EngineState.DONE)
                .stopReason("Reached max tweets limit (100)")
                .outputPath("data/exports/alice.csv")
                .build());

        runner.run();

        ArgumentCaptor<HarvestSettings> settings = ArgumentCaptor.forClass(HarvestSettings.class);
        verify(orchestrator).runSingle(settings.capture(), any(HarvestControls.class), isNull());
        assertEquals("alice", settings.getValue().getUsername());
        assertEquals("2024-01-01", settings.getValue().getSince());
        assertEquals(100, settings.getValue().getMaxTweets());
        assertEquals(ExportFormat.CSV, settings.getValue().getFormat());
        verify(orchestrator, never()).runBatch(any(), any(), any(), any());
    }

    @Test
    void shouldRunBatchWithConfiguredUsernames() {
        jobConfig.setMode(SessionMode.BATCH);
        jobConfig.setUsernames(List.of("alice", "bob"));
        when(checkpointStore.hasSavedState()).thenReturn(false);
        when(orchestrator.runBatch(eq(List.of("alice", "bob")), any(HarvestSettings.class),
            any(HarvestControls.class), isNull()))
            .thenReturn(BatchResult.builder().outcomes(List.of()).completed(true).build());

        runner.run();

        verify(orchestrator).runBatch(eq(List.of("alice", "bob")), any(HarvestSettings.class),
            any(HarvestControls.class), isNull());
    }

    @Test
    void shouldReadLinksFileForFreshLinkSession() {
        jobConfig.setMode(SessionMode.LINKS);
        jobConfig.setLinksFile("links.txt");
        List<String> links = List.of("https://x.com/a/status/1");
        when(checkpointStore.hasSavedState()).thenReturn(false);
        when(linkFileReader.readLinks(Paths.get("links.txt"))).thenReturn(links);
        when(orchestrator.runLinks(eq(links), eq(ExportFormat.CSV), any(HarvestControls.class), isNull()))
            .thenReturn(LinkHarvestResult.builder().scraped(1).terminalState(EngineState.DONE).build());

        runner.run();

        verify(linkFileReader).readLinks(Paths.get("links.txt"));
    }

    @Test
    void shouldResumeMatchingSavedSession() {
        SessionState saved = SessionState.builder()
            .mode(SessionMode.SINGLE)
            .outputPath("data/exports/alice.csv")
            .build();
        when(checkpointStore.hasSavedState()).thenReturn(true);
        when(checkpointStore.load()).thenReturn(CheckpointResult.ok("State loaded", saved));
        when(checkpointStore.validateIntegrity(saved)).thenReturn(CheckpointResult.ok("State is resumable", saved));
        when(checkpointStore.summarize()).thenReturn(Optional.of("Mode: Single scraping"));

        assertSame(saved, runner.findResumableState(SessionMode.SINGLE));
    }

    @Test
    void shouldIgnoreSavedSessionOfAnotherMode() {
        SessionState saved = SessionState.builder()
            .mode(SessionMode.BATCH)
            .usernames(List.of("alice"))
            .build();
        when(checkpointStore.hasSavedState()).thenReturn(true);
        when(checkpointStore.load()).thenReturn(CheckpointResult.ok("State loaded", saved));

        assertNull(runner.findResumableState(SessionMode.SINGLE));
        verify(checkpointStore, never()).validateIntegrity(any());
    }

    @Test
    void shouldIgnoreCompletedSavedSession() {
        SessionState saved = SessionState.builder()
            .mode(SessionMode.BATCH)
            .usernames(List.of("alice"))
            .currentIndex(1)
            .build();
        when(checkpointStore.hasSavedState()).thenReturn(true);
        when(checkpointStore.load()).thenReturn(CheckpointResult.ok("State loaded", saved));
        when(checkpointStore.validateIntegrity(saved)).thenReturn(CheckpointResult.failure("Batch already completed"));

        assertNull(runner.findResumableState(SessionMode.BATCH));
    }

    @Test
    void shouldNotLookForSavedStateWhenResumeDisabled() {
        jobConfig.setResume(false);

        assertNull(runner.findResumableState(SessionMode.SINGLE));
        verifyNoInteractions(checkpointStore);
    }
}
