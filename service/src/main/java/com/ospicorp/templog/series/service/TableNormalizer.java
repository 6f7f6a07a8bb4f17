package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.exception.InsufficientColumnsException;
import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.RawTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TableNormalizer {
  private static final Logger log = LoggerFactory.getLogger(TableNormalizer.class);

  private TableNormalizer() {
  }

  public static NormalizedTable normalize(RawTable raw) {
    int width = raw.columnNames().size();
    List<Integer> keptColumns = new ArrayList<>();
    for (int c = 0; c < width; c++) {
      for (int r = 0; r < raw.rowCount(); r++) {
        if (!isNull(raw.cell(r, c))) {
          keptColumns.add(c);
          break;
        }
      }
    }

    List<Integer> keptRows = new ArrayList<>();
    for (int r = 0; r < raw.rowCount(); r++) {
      for (int c : keptColumns) {
        if (!isNull(raw.cell(r, c))) {
          keptRows.add(r);
          break;
        }
      }
    }

    List<String> headers = new ArrayList<>(keptColumns.size());
    for (int c : keptColumns) {
      headers.add(raw.columnNames().get(c));
    }
    List<String> names = uniqueNames(headers);

    Map<String, List<Object>> columns = new LinkedHashMap<>();
    for (int i = 0; i < keptColumns.size(); i++) {
      int c = keptColumns.get(i);
      List<Object> values = new ArrayList<>(keptRows.size());
      for (int r : keptRows) {
        Object cell = raw.cell(r, c);
        values.add(isNull(cell) ? null : cell);
      }
      columns.put(names.get(i), values);
    }

    if (columns.size() < 2) {
      throw new InsufficientColumnsException(List.copyOf(columns.keySet()));
    }
    log.debug("Normalized table: {} columns {} x {} rows (dropped {} empty columns, {} empty rows)",
        columns.size(), columns.keySet(), keptRows.size(),
        width - keptColumns.size(), raw.rowCount() - keptRows.size());
    return new NormalizedTable(columns, keptRows.size());
  }

  static boolean isNull(Object cell) {
    return cell == null || (cell instanceof String s && s.isBlank());
  }

  // first occurrence keeps the name, later ones get _2, _3, ...
  private static List<String> uniqueNames(List<String> headers) {
    List<String> out = new ArrayList<>(headers.size());
    Set<String> taken = new HashSet<>();
    for (String header : headers) {
      String name = TextNormalizer.normalize(header);
      if (taken.add(name)) {
        out.add(name);
        continue;
      }
      int suffix = 2;
      while (!taken.add(name + "_" + suffix)) {
        suffix++;
      }
      log.warn("Header '{}' collides with an earlier column named '{}'; renamed to '{}_{}'",
          header, name, name, suffix);
      out.add(name + "_" + suffix);
    }
    return out;
  }
}
