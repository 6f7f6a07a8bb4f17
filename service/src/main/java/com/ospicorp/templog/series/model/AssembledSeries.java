package com.ospicorp.templog.series.model;

import java.util.List;

/**
 * Sorted, gap-free series plus the columns it was actually built from.
 */
public record AssembledSeries(
    List<TimeSeriesPoint> points,
    String timeColumn,
    String temperatureColumn
) {

  public AssembledSeries {
    points = List.copyOf(points);
  }

  public AssembledSeries withPoints(List<TimeSeriesPoint> filtered) {
    return new AssembledSeries(filtered, timeColumn, temperatureColumn);
  }

  public boolean isEmpty() {
    return points.isEmpty();
  }
}
