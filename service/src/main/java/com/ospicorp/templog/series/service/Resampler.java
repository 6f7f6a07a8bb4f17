package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Averages a sorted series into fixed windows aligned to the epoch, not to the first point.
 * Empty windows are left out.
 */
public final class Resampler {
  public static final Duration HOURLY = Duration.ofHours(1);

  private Resampler() {
  }

  public static List<TimeSeriesPoint> resample(List<TimeSeriesPoint> in, Duration width) {
    if (width.getSeconds() < 1 || width.getNano() != 0) {
      throw new IllegalArgumentException("bucket width must be a whole number of seconds: "
          + width);
    }
    Map<LocalDateTime, double[]> buckets = new LinkedHashMap<>();
    for (TimeSeriesPoint p : in) {
      LocalDateTime bucket = bucketStart(p.timestamp(), width);
      double[] acc = buckets.computeIfAbsent(bucket, k -> new double[2]);
      acc[0] += p.temperature();
      acc[1]++;
    }
    List<TimeSeriesPoint> out = new ArrayList<>(buckets.size());
    for (var e : buckets.entrySet()) {
      double[] acc = e.getValue();
      out.add(new TimeSeriesPoint(e.getKey(), acc[0] / acc[1]));
    }
    return out;
  }

  static LocalDateTime bucketStart(LocalDateTime timestamp, Duration width) {
    // naive timestamps are laid on UTC purely to get an absolute, zone-free grid
    long seconds = timestamp.toEpochSecond(ZoneOffset.UTC);
    long start = Math.floorDiv(seconds, width.getSeconds()) * width.getSeconds();
    return LocalDateTime.ofEpochSecond(start, 0, ZoneOffset.UTC);
  }
}
