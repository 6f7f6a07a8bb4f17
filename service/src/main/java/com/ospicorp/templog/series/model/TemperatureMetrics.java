package com.ospicorp.templog.series.model;

public record TemperatureMetrics(
    boolean nameMatch,
    double pctNumeric,
    Double median,
    boolean plausibleRange
) {}
