package com.ospicorp.templog.series.model;

import java.time.LocalDateTime;

// Timestamps carry no zone; uploads are read as local wall-clock time
public record TimeSeriesPoint(LocalDateTime timestamp, double temperature) {}
