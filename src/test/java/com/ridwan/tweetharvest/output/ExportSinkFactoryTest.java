package com.ridwan.tweetharvest.output;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.config.ExportConfig;
import com.ridwan.tweetharvest.exception.MalformedInputException;
import com.ridwan.tweetharvest.model.ExportFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExportSinkFactoryTest {

  @TempDir Path tempDir;

  private ExportConfig exportConfig;
  private ExportSinkFactory factory;

  @BeforeEach
  void setUp() {
    exportConfig = new ExportConfig();
    exportConfig.setDirectory(tempDir.toString());
    Clock clock = Clock.fixed(Instant.parse("2024-03-09T14:05:07Z"), ZoneOffset.UTC);
    factory = new ExportSinkFactory(exportConfig, clock);
  }

  @Test
  void shouldBuildTimestampedAbsolutePath() {
    Path path = factory.newOutputPath("alice", ExportFormat.EXCEL);

    assertTrue(path.isAbsolute());
    assertEquals(tempDir.toAbsolutePath().resolve("alice_20240309_140507.xlsx"), path);
  }

  @Test
  void shouldCreateSinkMatchingFormat() {
    Path csv = factory.newOutputPath("alice", ExportFormat.CSV);
    Path xlsx = factory.newOutputPath("alice", ExportFormat.EXCEL);

    try (ExportSink csvSink = factory.create(csv, ExportFormat.CSV, "alice");
        ExportSink xlsxSink = factory.create(xlsx, ExportFormat.EXCEL, "alice")) {
      assertTrue(csvSink instanceof CsvExportSink);
      assertTrue(xlsxSink instanceof SpreadsheetExportSink);
    }
    assertTrue(Files.exists(csv));
    assertTrue(Files.exists(xlsx));
  }

  @Test
  void shouldRefuseToReopenMissingWorkbook() {
    assertThrows(
        MalformedInputException.class,
        () -> factory.reopen(tempDir.resolve("gone.xlsx"), ExportFormat.EXCEL));
  }

  @Test
  void shouldInferFormatFromExtension() {
    assertEquals(ExportFormat.EXCEL, factory.formatOf(Path.of("out.XLSX")));
    assertEquals(ExportFormat.CSV, factory.formatOf(Path.of("out.csv")));

    exportConfig.setFormat(ExportFormat.CSV);
    assertEquals(ExportFormat.CSV, factory.formatOf(Path.of("out.dat")));
  }
}
