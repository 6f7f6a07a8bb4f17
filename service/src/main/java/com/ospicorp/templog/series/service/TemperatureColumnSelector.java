package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.ColumnScore;
import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.TemperatureMetrics;
import com.ospicorp.templog.series.model.TemperatureSelection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks every column by how much it looks like a temperature reading:
 * {@code 2.0 * name_match + 1.5 * pct_numeric + 2.5 * plausible_range}.
 */
public final class TemperatureColumnSelector {
  private static final Logger log = LoggerFactory.getLogger(TemperatureColumnSelector.class);

  static final Pattern TEMPERATURE_NAME = Pattern.compile(
      "(temp|temperatura|°c|celsius|℃|\\bt\\b)",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  static final double NAME_WEIGHT = 2.0;
  static final double NUMERIC_WEIGHT = 1.5;
  static final double PLAUSIBLE_WEIGHT = 2.5;
  static final double PLAUSIBLE_MIN = -50.0;
  static final double PLAUSIBLE_MAX = 100.0;

  private TemperatureColumnSelector() {
  }

  public static TemperatureSelection select(NormalizedTable table) {
    List<ColumnScore<TemperatureMetrics>> ranking = CandidateRanker.rank(table.columnNames(),
        column -> score(column, table.column(column), table.rowCount()));
    log.debug("Temperature candidates: {}", ranking);
    return new TemperatureSelection(ranking);
  }

  static ColumnScore<TemperatureMetrics> score(String column, List<Object> cells, int rowCount) {
    boolean nameMatch = TEMPERATURE_NAME.matcher(column).find();
    List<Double> numeric = new ArrayList<>(cells.size());
    for (Double value : NumericCellCleaner.cleanColumn(cells)) {
      if (value != null) {
        numeric.add(value);
      }
    }
    double pctNumeric = rowCount == 0 ? 0d : (double) numeric.size() / rowCount;
    Double median = median(numeric);
    boolean plausible = median != null && median >= PLAUSIBLE_MIN && median <= PLAUSIBLE_MAX;

    double score = (nameMatch ? NAME_WEIGHT : 0d)
        + pctNumeric * NUMERIC_WEIGHT
        + (plausible ? PLAUSIBLE_WEIGHT : 0d);
    return new ColumnScore<>(column, score,
        new TemperatureMetrics(nameMatch, pctNumeric, median, plausible));
  }

  static Double median(List<Double> values) {
    if (values.isEmpty()) {
      return null;
    }
    List<Double> sorted = new ArrayList<>(values);
    Collections.sort(sorted);
    int mid = sorted.size() / 2;
    if (sorted.size() % 2 == 1) {
      return sorted.get(mid);
    }
    return (sorted.get(mid - 1) + sorted.get(mid)) / 2d;
  }
}
