package com.ospicorp.templog.series.exception;

import com.ospicorp.templog.series.model.TimeRange;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NoUsableSeriesException extends UploadProcessingException {

  private NoUsableSeriesException(String message, Map<String, Object> details) {
    super(message, details);
  }

  public static NoUsableSeriesException noRows(List<String> columns, String timeColumn,
      List<String> temperatureColumns) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("columns", List.copyOf(columns));
    details.put("time_col", timeColumn);
    details.put("temp_cols_tried", List.copyOf(temperatureColumns));
    return new NoUsableSeriesException(
        "Could not build a time/temperature series from the uploaded data. Columns read: "
            + columns + ". Time column: " + timeColumn + "; temperature columns tried: "
            + temperatureColumns + ".",
        details);
  }

  public static NoUsableSeriesException emptyRange(TimeRange range, String timeColumn,
      String temperatureColumn) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("time_col", timeColumn);
    details.put("temp_col", temperatureColumn);
    if (range.start() != null) {
      details.put("start", range.start().toString());
    }
    if (range.end() != null) {
      details.put("end", range.end().toString());
    }
    return new NoUsableSeriesException(
        "No readings fall inside the requested range.", details);
  }

  @Override
  public String slug() {
    return "no-usable-series";
  }
}
