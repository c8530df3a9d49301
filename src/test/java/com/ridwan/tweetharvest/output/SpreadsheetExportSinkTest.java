package com.ridwan.tweetharvest.output;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.model.TweetRecord;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpreadsheetExportSinkTest {

  @TempDir Path tempDir;

  @Test
  void shouldCreateWorkbookWithBoldFrozenHeader() throws Exception {
    Path file = tempDir.resolve("alice.xlsx");

    try (SpreadsheetExportSink sink = new SpreadsheetExportSink(file, "alice")) {
      sink.append(record("1"));
    }

    try (InputStream in = Files.newInputStream(file);
        XSSFWorkbook workbook = new XSSFWorkbook(in)) {
      Sheet sheet = workbook.getSheetAt(0);
      assertEquals("alice", sheet.getSheetName());
      assertEquals(1, sheet.getLastRowNum());

      Row header = sheet.getRow(0);
      assertEquals("Date", header.getCell(0).getStringCellValue());
      assertEquals("Export Path", header.getCell(11).getStringCellValue());
      assertTrue(workbook.getFontAt(header.getCell(0).getCellStyle().getFontIndex()).getBold());
      assertNotNull(sheet.getPaneInformation(), "Header row should be frozen");

      Row row = sheet.getRow(1);
      assertEquals(CellType.NUMERIC, row.getCell(5).getCellType(), "Likes should stay numeric");
      assertEquals(7.0, row.getCell(5).getNumericCellValue());
      assertEquals("1", row.getCell(9).getStringCellValue());
    }
  }

  @Test
  void shouldAppendAfterLastRowWhenReopened() throws Exception {
    Path file = tempDir.resolve("resume.xlsx");
    try (SpreadsheetExportSink sink = new SpreadsheetExportSink(file, "resume")) {
      sink.append(record("1"));
      sink.append(record("2"));
    }

    try (SpreadsheetExportSink sink = new SpreadsheetExportSink(file)) {
      sink.append(record("3"));
    }

    try (InputStream in = Files.newInputStream(file);
        XSSFWorkbook workbook = new XSSFWorkbook(in)) {
      Sheet sheet = workbook.getSheetAt(0);
      assertEquals(3, sheet.getLastRowNum());
      assertEquals("3", sheet.getRow(3).getCell(9).getStringCellValue());
    }
  }

  @Test
  void shouldPersistRowsOnFlushBeforeClose() throws Exception {
    Path file = tempDir.resolve("flush.xlsx");
    SpreadsheetExportSink sink = new SpreadsheetExportSink(file, "flush");
    try {
      sink.append(record("1"));
      sink.flush();

      try (InputStream in = Files.newInputStream(file);
          XSSFWorkbook workbook = new XSSFWorkbook(in)) {
        assertEquals(1, workbook.getSheetAt(0).getLastRowNum());
      }
      assertFalse(Files.exists(tempDir.resolve("flush.xlsx.tmp")), "Temp file should be moved into place");
    } finally {
      sink.close();
    }
  }

  private static TweetRecord record(String id) {
    return TweetRecord.builder()
        .id(id)
        .timestamp("2024-01-15 10:30:00")
        .username("alice")
        .displayName("Alice")
        .text("tweet " + id)
        .likes(7)
        .url("https://twitter.com/alice/status/" + id)
        .build();
  }
}
