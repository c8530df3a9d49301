package com.ridwan.tweetharvest.links;

import static org.junit.jupiter.api.Assertions.*;

import com.ridwan.tweetharvest.exception.MalformedInputException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LinkFileReaderTest {

  @TempDir Path tempDir;

  private final LinkFileReader reader = new LinkFileReader();

  @Test
  void shouldReadTextFileSkippingBlanksAndComments() throws Exception {
    Path file = tempDir.resolve("links.txt");
    Files.writeString(
        file,
        "# exported 2024-01-01\n"
            + "https://x.com/a/status/1\n"
            + "\n"
            + "  https://twitter.com/b/status/2  \n");

    List<String> links = reader.readLinks(file);

    assertEquals(List.of("https://x.com/a/status/1", "https://twitter.com/b/status/2"), links);
  }

  @Test
  void shouldReadFirstColumnOfWorkbook() throws Exception {
    Path file = tempDir.resolve("links.xlsx");
    try (XSSFWorkbook workbook = new XSSFWorkbook();
        OutputStream out = Files.newOutputStream(file)) {
      Sheet sheet = workbook.createSheet("Links");
      sheet.createRow(0).createCell(0).setCellValue("Tweet URL");
      sheet.createRow(1).createCell(0).setCellValue("https://x.com/a/status/1");
      sheet.createRow(2).createCell(1).setCellValue("ignored second column");
      sheet.createRow(3).createCell(0).setCellValue("https://x.com/a/status/3");
      workbook.write(out);
    }

    List<String> links = reader.readLinks(file);

    assertEquals(List.of("https://x.com/a/status/1", "https://x.com/a/status/3"), links);
  }

  @Test
  void shouldFailOnMissingFile() {
    assertThrows(
        MalformedInputException.class, () -> reader.readLinks(tempDir.resolve("missing.txt")));
  }
}
