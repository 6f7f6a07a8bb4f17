package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.exception.NoUsableSeriesException;
import com.ospicorp.templog.series.model.AssembledSeries;
import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.TemperatureSelection;
import com.ospicorp.templog.series.model.TimeDetection;
import com.ospicorp.templog.series.model.TimeRange;
import com.ospicorp.templog.series.model.TimeSeriesPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins the detected timestamps with a cleaned temperature column into a sorted series.
 * When the preferred temperature column yields nothing, the next two ranked columns are
 * tried in order.
 */
public final class SeriesAssembler {
  private static final Logger log = LoggerFactory.getLogger(SeriesAssembler.class);

  static final double SANITY_MAX = 1000.0;
  static final double SANITY_MIN = -100.0;

  private SeriesAssembler() {
  }

  public static AssembledSeries assemble(NormalizedTable table, TimeDetection time,
      TemperatureSelection selection, TimeRange range) {
    List<String> attempts = new ArrayList<>();
    attempts.add(selection.primary());
    attempts.addAll(selection.retryColumns());

    List<String> tried = new ArrayList<>();
    AssembledSeries series = null;
    for (String column : attempts) {
      tried.add(column);
      List<TimeSeriesPoint> points = join(time.timestamps(), table.column(column));
      if (!points.isEmpty()) {
        series = new AssembledSeries(points, time.label(), column);
        break;
      }
      if (tried.size() == 1 && attempts.size() > 1) {
        log.warn("Temperature column '{}' produced no usable rows with time '{}'; trying {}",
            column, time.label(), selection.retryColumns());
      }
    }
    if (series == null) {
      throw NoUsableSeriesException.noRows(table.columnNames(), time.label(), tried);
    }
    return filter(series, range);
  }

  public static AssembledSeries filter(AssembledSeries series, TimeRange range) {
    if (range == null || !range.isBounded()) {
      return series;
    }
    List<TimeSeriesPoint> kept = series.points().stream()
        .filter(p -> range.contains(p.timestamp()))
        .toList();
    if (kept.isEmpty()) {
      throw NoUsableSeriesException.emptyRange(range, series.timeColumn(),
          series.temperatureColumn());
    }
    return series.withPoints(kept);
  }

  static List<TimeSeriesPoint> join(List<LocalDateTime> timestamps, List<Object> cells) {
    Double[] temperatures = trim(NumericCellCleaner.cleanColumn(cells));
    List<TimeSeriesPoint> points = new ArrayList<>();
    for (int i = 0; i < temperatures.length; i++) {
      LocalDateTime timestamp = timestamps.get(i);
      Double temperature = temperatures[i];
      if (timestamp != null && temperature != null) {
        points.add(new TimeSeriesPoint(timestamp, temperature));
      }
    }
    // List.sort is stable: rows sharing a timestamp keep file order
    points.sort(Comparator.comparing(TimeSeriesPoint::timestamp));
    return points;
  }

  static Double[] trim(Double[] values) {
    Double[] out = values.clone();
    for (int i = 0; i < out.length; i++) {
      Double v = out[i];
      if (v != null && (v > SANITY_MAX || v < SANITY_MIN)) {
        out[i] = null;
      }
    }
    return out;
  }
}
