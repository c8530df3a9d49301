package com.ridwan.tweetharvest.output;

import com.ridwan.tweetharvest.config.ExportConfig;
import com.ridwan.tweetharvest.exception.MalformedInputException;
import com.ridwan.tweetharvest.model.ExportFormat;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ExportSinkFactory {

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final ExportConfig exportConfig;
  private final Clock clock;

  public ExportSinkFactory(ExportConfig exportConfig, Clock clock) {
    this.exportConfig = exportConfig;
    this.clock = clock;
  }

  /** {@code <export dir>/<label>_<yyyyMMdd_HHmmss>.<ext>}, absolute. */
  public Path newOutputPath(String label, ExportFormat format) {
    String fileName =
        label + "_" + FILE_TIMESTAMP.format(LocalDateTime.now(clock)) + "." + format.getExtension();
    return Paths.get(exportConfig.getDirectory()).resolve(fileName).toAbsolutePath();
  }

  public ExportSink create(Path outputPath, ExportFormat format, String sheetTitle) {
    log.info("Opening new {} export at {}", format.getValue(), outputPath);
    if (format == ExportFormat.EXCEL) {
      return new SpreadsheetExportSink(
          outputPath, SheetNameSanitizer.sanitize(sheetTitle, LocalDateTime.now(clock)));
    }
    return new CsvExportSink(outputPath);
  }

  /** Reopens the output of an interrupted session for appending. */
  public ExportSink reopen(Path outputPath, ExportFormat format) {
    if (format == ExportFormat.EXCEL) {
      if (!Files.exists(outputPath)) {
        throw new MalformedInputException("Saved output file no longer exists: " + outputPath);
      }
      return new SpreadsheetExportSink(outputPath);
    }
    return new CsvExportSink(outputPath);
  }

  /** Format implied by the file extension, falling back to the configured default. */
  public ExportFormat formatOf(Path outputPath) {
    String name = outputPath.getFileName().toString().toLowerCase();
    if (name.endsWith(".xlsx")) {
      return ExportFormat.EXCEL;
    }
    if (name.endsWith(".csv")) {
      return ExportFormat.CSV;
    }
    return exportConfig.getFormat();
  }
}
