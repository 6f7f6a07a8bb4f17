package com.ospicorp.templog.series.model;

import java.time.LocalDateTime;

/**
 * Inclusive bounds; a {@code null} side is open.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

  public static final TimeRange UNBOUNDED = new TimeRange(null, null);

  public TimeRange {
    if (start != null && end != null && start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
  }

  public boolean isBounded() {
    return start != null || end != null;
  }

  public boolean contains(LocalDateTime timestamp) {
    if (start != null && timestamp.isBefore(start)) {
      return false;
    }
    return end == null || !timestamp.isAfter(end);
  }
}
