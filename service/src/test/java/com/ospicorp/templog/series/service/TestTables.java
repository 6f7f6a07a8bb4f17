package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.RawTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class TestTables {
  private TestTables() {
  }

  static RawTable raw(List<String> headers, Object[]... rows) {
    List<List<Object>> data = new ArrayList<>();
    for (Object[] row : rows) {
      data.add(Arrays.asList(row));
    }
    return new RawTable(headers, data);
  }

  static NormalizedTable table(List<String> headers, Object[]... rows) {
    return TableNormalizer.normalize(raw(headers, rows));
  }

  static Object[] row(Object... cells) {
    return cells;
  }
}
