package com.ospicorp.templog.series.exception;

import java.util.List;
import java.util.Map;

public class InsufficientColumnsException extends UploadProcessingException {

  public InsufficientColumnsException(List<String> columns) {
    super("Spreadsheet has too few usable columns. Columns read: " + columns,
        Map.of("columns", List.copyOf(columns)));
  }

  @Override
  public String slug() {
    return "insufficient-columns";
  }
}
