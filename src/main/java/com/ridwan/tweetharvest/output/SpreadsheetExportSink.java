package com.ridwan.tweetharvest.output;

import com.ridwan.tweetharvest.model.TweetRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * XLSX writer. The workbook lives in memory and {@link #flush()} rewrites the file through a
 * temporary sibling, so a crash mid-save leaves the previous copy intact.
 */
@Slf4j
public class SpreadsheetExportSink implements ExportSink {

  private final Path outputPath;
  private final XSSFWorkbook workbook;
  private final Sheet sheet;
  private int rowsWritten = 0;
  private boolean dirty = false;

  /** Creates a new workbook with a single sheet titled {@code sheetTitle}. */
  public SpreadsheetExportSink(Path outputPath, String sheetTitle) {
    this.outputPath = outputPath;
    this.workbook = new XSSFWorkbook();
    this.sheet = workbook.createSheet(sheetTitle);
    writeHeader();
    this.dirty = true;
    flush();
    log.info("Created spreadsheet export: {} (sheet '{}')", outputPath, sheetTitle);
  }

  /** Reopens an existing workbook and appends after its last row. */
  public SpreadsheetExportSink(Path outputPath) {
    this.outputPath = outputPath;
    try (InputStream in = Files.newInputStream(outputPath)) {
      this.workbook = new XSSFWorkbook(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to reopen spreadsheet " + outputPath, e);
    }
    this.sheet = workbook.getSheetAt(0);
    log.info(
        "Appending to existing spreadsheet export: {} ({} rows present)",
        outputPath,
        sheet.getLastRowNum());
  }

  @Override
  public void append(TweetRecord record) {
    Row row = sheet.createRow(sheet.getLastRowNum() + 1);
    List<Object> values = ExportColumns.values(record, outputPath);
    for (int i = 0; i < values.size(); i++) {
      Cell cell = row.createCell(i);
      Object value = values.get(i);
      if (value instanceof Number) {
        cell.setCellValue(((Number) value).doubleValue());
      } else {
        cell.setCellValue(value == null ? "" : value.toString());
      }
    }
    rowsWritten++;
    dirty = true;
  }

  @Override
  public void flush() {
    if (!dirty) {
      return;
    }
    try {
      if (outputPath.getParent() != null) {
        Files.createDirectories(outputPath.getParent());
      }
      Path temp = outputPath.resolveSibling(outputPath.getFileName() + ".tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        workbook.write(out);
      }
      Files.move(temp, outputPath, StandardCopyOption.REPLACE_EXISTING);
      dirty = false;
      log.debug("Saved spreadsheet with {} new rows: {}", rowsWritten, outputPath);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to save spreadsheet " + outputPath, e);
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
      flush();
    } finally {
      try {
        workbook.close();
      } catch (IOException e) {
        log.warn("Failed to release workbook {}: {}", outputPath, e.getMessage());
      }
    }
  }

  private void writeHeader() {
    Font bold = workbook.createFont();
    bold.setBold(true);
    CellStyle headerStyle = workbook.createCellStyle();
    headerStyle.setFont(bold);

    Row header = sheet.createRow(0);
    for (int i = 0; i < ExportColumns.HEADER.size(); i++) {
      Cell cell = header.createCell(i);
      cell.setCellValue(ExportColumns.HEADER.get(i));
      cell.setCellStyle(headerStyle);
    }
    sheet.createFreezePane(0, 1);
  }
}
