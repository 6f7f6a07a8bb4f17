package com.ospicorp.templog.series.reader;

import com.ospicorp.templog.series.exception.UnreadableFileException;
import com.ospicorp.templog.series.model.RawTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks a reader from the file name: delimited text for .csv/.txt, POI for .xls/.xlsx.
 * Unknown extensions are tried as a workbook first, then as delimited text.
 */
@Component
public class TabularFileReader {
  private static final Logger log = LoggerFactory.getLogger(TabularFileReader.class);

  private final CsvTableReader csvReader;
  private final SpreadsheetTableReader spreadsheetReader;

  public TabularFileReader(CsvTableReader csvReader, SpreadsheetTableReader spreadsheetReader) {
    this.csvReader = csvReader;
    this.spreadsheetReader = spreadsheetReader;
  }

  public RawTable read(byte[] content, String filename) {
    if (content == null || content.length == 0) {
      throw new UnreadableFileException("Uploaded file is empty.", List.of());
    }
    String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
    if (name.endsWith(".csv") || name.endsWith(".txt")) {
      return csvReader.read(content);
    }
    if (name.endsWith(".xlsx")) {
      return spreadsheetReader.read(content, "xlsx");
    }
    if (name.endsWith(".xls")) {
      return spreadsheetReader.read(content, "xls");
    }

    List<String> attempts = new ArrayList<>();
    try {
      return spreadsheetReader.read(content, "spreadsheet");
    } catch (UnreadableFileException ex) {
      log.debug("'{}' is not a workbook: {}", filename, ex.getMessage());
      attempts.addAll(ex.attempts());
    }
    try {
      return csvReader.read(content);
    } catch (UnreadableFileException ex) {
      attempts.addAll(ex.attempts());
      throw new UnreadableFileException("Unsupported file format: " + filename + ".", attempts, ex);
    }
  }
}
