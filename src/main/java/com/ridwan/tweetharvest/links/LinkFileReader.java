package com.ridwan.tweetharvest.links;

import com.ridwan.tweetharvest.exception.MalformedInputException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

/**
 * Reads tweet links from a text file (one per line) or an {@code .xlsx} workbook (first column of
 * the first sheet). Returns raw entries; validation happens in {@link TweetLinkParser}.
 */
@Slf4j
@Service
public class LinkFileReader {

  public List<String> readLinks(Path file) {
    log.info("Reading tweet links from: {}", file);

    if (!Files.isReadable(file)) {
      throw new MalformedInputException("Link file not found or not readable: " + file);
    }

    String name = file.getFileName().toString().toLowerCase();
    List<String> links;
    try {
      links = name.endsWith(".xlsx") ? readWorkbook(file) : readText(file);
    } catch (IOException e) {
      throw new MalformedInputException("Failed to read link file " + file + ": " + e.getMessage(), e);
    }

    log.info("Read {} entries from {}", links.size(), file.getFileName());
    return links;
  }

  private List<String> readText(Path file) throws IOException {
    return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
        .map(String::trim)
        .filter(line -> !line.isEmpty() && !line.startsWith("#"))
        .collect(Collectors.toList());
  }

  private List<String> readWorkbook(Path file) throws IOException {
    List<String> links = new ArrayList<>();
    DataFormatter formatter = new DataFormatter();
    try (InputStream in = Files.newInputStream(file);
        XSSFWorkbook workbook = new XSSFWorkbook(in)) {
      Sheet sheet = workbook.getSheetAt(0);
      for (Row row : sheet) {
        Cell cell = row.getCell(0);
        if (cell == null) {
          continue;
        }
        String value = formatter.formatCellValue(cell).trim();
        if (value.startsWith("http")) {
          links.add(value);
        } else if (!value.isEmpty()) {
          log.debug("Skipping non-link cell at row {}: {}", row.getRowNum() + 1, value);
        }
      }
    }
    return links;
  }
}
