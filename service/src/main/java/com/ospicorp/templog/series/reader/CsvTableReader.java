package com.ospicorp.templog.series.reader;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.templog.series.exception.UnreadableFileException;
import com.ospicorp.templog.series.model.RawTable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads delimited text of unknown dialect by walking a fixed delimiter x encoding matrix
 * and keeping the first combination whose header splits into at least two columns.
 */
@Component
public class CsvTableReader {
  private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

  static final List<Character> DELIMITERS = List.of(',', ';', '\t', '|');
  static final List<Charset> ENCODINGS = List.of(
      StandardCharsets.UTF_8,
      StandardCharsets.ISO_8859_1,
      Charset.forName("windows-1252"));
  private static final char BOM = '\uFEFF';

  private final CsvMapper mapper = new CsvMapper();

  public CsvTableReader() {
    mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
  }

  public RawTable read(byte[] content) {
    ParsedCsv parsed = parse(content);
    if (parsed.overflowingRows() > 0) {
      // typically unquoted decimal commas in a comma-delimited file
      log.warn("{} of {} rows have more cells than the {} header columns; extra cells ignored",
          parsed.overflowingRows(), parsed.table().rowCount(),
          parsed.table().columnNames().size());
    }
    return parsed.table();
  }

  ParsedCsv parse(byte[] content) {
    List<String> attempts = new ArrayList<>();
    for (char delimiter : DELIMITERS) {
      for (Charset encoding : ENCODINGS) {
        attempts.add(describe(delimiter, encoding));
        Optional<ParsedCsv> parsed = tryRead(content, delimiter, encoding);
        if (parsed.isPresent() && parsed.get().table().columnNames().size() >= 2) {
          RawTable table = parsed.get().table();
          log.debug("Read CSV with {} ({} columns, {} rows)", describe(delimiter, encoding),
              table.columnNames().size(), table.rowCount());
          return parsed.get();
        }
      }
    }
    throw new UnreadableFileException(
        "Could not read the CSV file. Check its delimiter and encoding.", attempts);
  }

  private Optional<ParsedCsv> tryRead(byte[] content, char delimiter, Charset encoding) {
    String text;
    try {
      text = encoding.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(content))
          .toString();
    } catch (CharacterCodingException ex) {
      log.debug("Content is not valid {}", encoding.name());
      return Optional.empty();
    }
    if (!text.isEmpty() && text.charAt(0) == BOM) {
      text = text.substring(1);
    }

    CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
    List<String[]> lines;
    try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
        .with(schema)
        .readValues(text)) {
      lines = it.readAll();
    } catch (IOException | RuntimeException ex) {
      log.debug("CSV parse failed for {}: {}", describe(delimiter, encoding), ex.getMessage());
      return Optional.empty();
    }
    if (lines.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toTable(lines));
  }

  private static ParsedCsv toTable(List<String[]> lines) {
    String[] header = lines.get(0);
    List<String> names = new ArrayList<>(header.length);
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null ? "" : header[i].strip();
      names.add(name.isEmpty() ? "unnamed_" + i : name);
    }
    List<List<Object>> rows = new ArrayList<>(lines.size() - 1);
    int overflowing = 0;
    for (String[] line : lines.subList(1, lines.size())) {
      if (line.length > names.size()) {
        overflowing++;
      }
      List<Object> row = new ArrayList<>(names.size());
      for (int i = 0; i < names.size(); i++) {
        String cell = i < line.length ? line[i] : null;
        row.add(cell == null || cell.isBlank() ? null : cell);
      }
      rows.add(row);
    }
    return new ParsedCsv(new RawTable(names, rows), overflowing);
  }

  private static String describe(char delimiter, Charset encoding) {
    String shown = delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    return "delimiter='" + shown + "' encoding=" + encoding.name();
  }

  /** A parsed table plus the number of data rows that were wider than the header. */
  record ParsedCsv(RawTable table, int overflowingRows) {}
}
