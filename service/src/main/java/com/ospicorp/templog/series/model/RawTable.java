package com.ospicorp.templog.series.model;

import java.util.List;

/**
 * Table exactly as read from the uploaded file: header names untouched, cells holding
 * {@code String}, {@code Double}, {@code LocalDateTime}, {@code LocalTime} or
 * {@code null}.
 */
public record RawTable(List<String> columnNames, List<List<Object>> rows) {

  public RawTable {
    columnNames = List.copyOf(columnNames);
    rows = List.copyOf(rows);
  }

  public int rowCount() {
    return rows.size();
  }

  public Object cell(int row, int column) {
    List<Object> values = rows.get(row);
    return column < values.size() ? values.get(column) : null;
  }
}
