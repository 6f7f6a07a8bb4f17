package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.AssembledSeries;
import com.ospicorp.templog.series.model.SummaryStats;
import com.ospicorp.templog.series.model.TimeSeriesPoint;
import java.util.List;

public final class StatisticsSummarizer {
  private StatisticsSummarizer() {
  }

  public static SummaryStats summarize(AssembledSeries series) {
    List<TimeSeriesPoint> points = series.points();
    if (points.isEmpty()) {
      throw new IllegalArgumentException("Cannot summarize an empty series");
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0d;
    for (TimeSeriesPoint p : points) {
      min = Math.min(min, p.temperature());
      max = Math.max(max, p.temperature());
      sum += p.temperature();
    }
    return new SummaryStats(
        min,
        max,
        sum / points.size(),
        points.size(),
        points.get(0).timestamp(),
        points.get(points.size() - 1).timestamp(),
        series.timeColumn(),
        series.temperatureColumn());
  }
}
