package com.ridwan.tweetharvest.output;

import com.ridwan.tweetharvest.model.TweetRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/** UTF-8 CSV writer. Opening an existing non-empty file appends without repeating the header. */
@Slf4j
public class CsvExportSink implements ExportSink {

  private final Path outputPath;
  private final BufferedWriter writer;
  private int rowsWritten = 0;

  public CsvExportSink(Path outputPath) {
    this.outputPath = outputPath;
    try {
      if (outputPath.getParent() != null) {
        Files.createDirectories(outputPath.getParent());
      }
      boolean needsHeader = !Files.exists(outputPath) || Files.size(outputPath) == 0;
      this.writer =
          Files.newBufferedWriter(
              outputPath,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.APPEND);
      if (needsHeader) {
        writeLine(ExportColumns.HEADER.stream().map(CsvExportSink::escapeCsv).collect(Collectors.toList()));
        writer.flush();
        log.info("Created CSV export: {}", outputPath);
      } else {
        log.info("Appending to existing CSV export: {}", outputPath);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open CSV export " + outputPath, e);
    }
  }

  @Override
  public void append(TweetRecord record) {
    List<String> cells =
        ExportColumns.values(record, outputPath).stream()
            .map(value -> escapeCsv(value == null ? null : String.valueOf(value)))
            .collect(Collectors.toList());
    try {
      writeLine(cells);
      rowsWritten++;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to append row to " + outputPath, e);
    }
  }

  @Override
  public void flush() {
    try {
      writer.flush();
      log.debug("Flushed {} rows to {}", rowsWritten, outputPath);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to flush " + outputPath, e);
    }
  }

  @Override
  public Path getOutputPath() {
    return outputPath;
  }

  @Override
  public int getRowsWritten() {
    return rowsWritten;
  }

  @Override
  public void close() {
    try {
      writer.close();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to close " + outputPath, e);
    }
  }

  private void writeLine(List<String> cells) throws IOException {
    writer.write(String.join(",", cells));
    writer.newLine();
  }

  static String escapeCsv(String value) {
    if (value == null) {
      return "";
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
