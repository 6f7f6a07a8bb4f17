package com.ospicorp.templog.series.model;

import java.util.List;

/**
 * Outcome of the temperature column ranking. {@code ranking} holds every column, best first.
 */
public record TemperatureSelection(List<ColumnScore<TemperatureMetrics>> ranking) {

  public TemperatureSelection {
    if (ranking.isEmpty()) {
      throw new IllegalArgumentException("ranking must not be empty");
    }
    ranking = List.copyOf(ranking);
  }

  public String primary() {
    return ranking.get(0).column();
  }

  public List<String> retryColumns() {
    return ranking.stream()
        .skip(1)
        .limit(2)
        .map(ColumnScore::column)
        .toList();
  }
}
