package com.ospicorp.templog.series.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Detected time source. {@code secondColumn} is set when the timestamps were rebuilt from
 * a date column plus a time-of-day column. {@code timestamps} is aligned with table rows and
 * holds {@code null} where a row could not be parsed.
 */
public record TimeDetection(
    String column,
    String secondColumn,
    List<LocalDateTime> timestamps,
    double score
) {

  public TimeDetection {
    timestamps = Collections.unmodifiableList(timestamps);
  }

  public boolean isPair() {
    return secondColumn != null;
  }

  public String label() {
    return isPair() ? column + "+" + secondColumn : column;
  }
}
