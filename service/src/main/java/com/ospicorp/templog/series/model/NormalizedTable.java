package com.ospicorp.templog.series.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Column-major view of an upload after header normalization and removal of empty
 * columns and rows. Column order follows the source file.
 */
public final class NormalizedTable {

  private final Map<String, List<Object>> columns;
  private final int rowCount;

  public NormalizedTable(Map<String, List<Object>> columns, int rowCount) {
    Map<String, List<Object>> copy = new LinkedHashMap<>();
    for (var e : columns.entrySet()) {
      if (e.getValue().size() != rowCount) {
        throw new IllegalArgumentException("Column " + e.getKey() + " has "
            + e.getValue().size() + " cells, expected " + rowCount);
      }
      copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(e.getValue())));
    }
    this.columns = Collections.unmodifiableMap(copy);
    this.rowCount = rowCount;
  }

  public List<String> columnNames() {
    return List.copyOf(columns.keySet());
  }

  public List<Object> column(String name) {
    List<Object> values = columns.get(name);
    if (values == null) {
      throw new NoSuchElementException("Unknown column: " + name);
    }
    return values;
  }

  public int rowCount() {
    return rowCount;
  }

  public int columnCount() {
    return columns.size();
  }
}
