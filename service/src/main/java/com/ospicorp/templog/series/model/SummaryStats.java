package com.ospicorp.templog.series.model;

import java.time.LocalDateTime;

public record SummaryStats(
    double min,
    double max,
    double mean,
    int count,
    LocalDateTime start,
    LocalDateTime end,
    String timeColumn,
    String temperatureColumn
) {}
