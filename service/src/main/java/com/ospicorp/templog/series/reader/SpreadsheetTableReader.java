package com.ospicorp.templog.series.reader;

import com.ospicorp.templog.series.exception.UnreadableFileException;
import com.ospicorp.templog.series.model.RawTable;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the first sheet of an .xls or .xlsx workbook. The first non-empty row is the header.
 */
@Component
public class SpreadsheetTableReader {
  private static final Logger log = LoggerFactory.getLogger(SpreadsheetTableReader.class);

  public RawTable read(byte[] content, String format) {
    try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new IOException("workbook has no sheets");
      }
      Sheet sheet = workbook.getSheetAt(0);
      RawTable table = readSheet(sheet);
      log.debug("Read sheet '{}' ({} columns, {} rows)", sheet.getSheetName(),
          table.columnNames().size(), table.rowCount());
      return table;
    } catch (IOException | RuntimeException ex) {
      throw new UnreadableFileException("Could not read " + format + " file: " + ex.getMessage(),
          List.of(format), ex);
    }
  }

  private static RawTable readSheet(Sheet sheet) throws IOException {
    DataFormatter formatter = new DataFormatter();
    int first = Math.max(sheet.getFirstRowNum(), 0);
    int last = sheet.getLastRowNum();

    Row header = null;
    int headerIndex = first;
    for (; headerIndex <= last; headerIndex++) {
      Row row = sheet.getRow(headerIndex);
      if (row != null && !isBlankRow(row)) {
        header = row;
        break;
      }
    }
    if (header == null) {
      throw new IOException("sheet '" + sheet.getSheetName() + "' is empty");
    }

    int width = Math.max(header.getLastCellNum(), 0);
    List<String> names = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      Cell cell = header.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      String name = cell == null ? "" : formatter.formatCellValue(cell).strip();
      names.add(name.isEmpty() ? "unnamed_" + c : name);
    }

    List<List<Object>> rows = new ArrayList<>();
    for (int r = headerIndex + 1; r <= last; r++) {
      Row row = sheet.getRow(r);
      List<Object> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(row == null ? null
            : cellValue(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL)));
      }
      rows.add(values);
    }
    return new RawTable(names, rows);
  }

  static Object cellValue(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType() == CellType.FORMULA
        ? cell.getCachedFormulaResultType()
        : cell.getCellType();
    switch (type) {
      case STRING -> {
        String text = cell.getStringCellValue();
        return text == null || text.isBlank() ? null : text;
      }
      case NUMERIC -> {
        if (!DateUtil.isCellDateFormatted(cell)) {
          return cell.getNumericCellValue();
        }
        double serial = cell.getNumericCellValue();
        // a serial below one day is a bare time of day
        if (serial >= 0 && serial < 1) {
          return cell.getLocalDateTimeCellValue().toLocalTime();
        }
        return cell.getLocalDateTimeCellValue();
      }
      case BOOLEAN -> {
        return String.valueOf(cell.getBooleanCellValue());
      }
      default -> {
        return null;
      }
    }
  }

  private static boolean isBlankRow(Row row) {
    for (Cell cell : row) {
      if (cellValue(cell) != null) {
        return false;
      }
    }
    return true;
  }
}
