package com.ospicorp.templog.series.service;

import com.ospicorp.templog.series.model.ColumnScore;
import com.ospicorp.templog.series.model.NormalizedTable;
import com.ospicorp.templog.series.model.TimeDetection;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the column (or date + time-of-day column pair) holding the timestamps.
 *
 * <p>Columns whose name looks like a time field are scored first; with no such column every
 * column is a candidate. A candidate's score is the share of rows that parse as a date-time.
 * A weak winner (below {@value #PAIR_THRESHOLD}), or one that only carries dates, triggers a
 * search over date/time column pairs, and the pair wins when it scores at least as well.
 * Detection never fails: the best candidate is returned even with a zero score.
 */
public final class DatetimeColumnDetector {
  private static final Logger log = LoggerFactory.getLogger(DatetimeColumnDetector.class);

  static final double PAIR_THRESHOLD = 0.60;
  static final Pattern TIME_NAME = Pattern.compile(
      "(timestamp|datahora|date_time|datetime|tempo|time|\\bdata\\b|\\bhora\\b)",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  private static final List<String> TIME_OF_DAY_TOKENS = List.of("hora", "time", "tempo");

  private DatetimeColumnDetector() {
  }

  public static TimeDetection detect(NormalizedTable table) {
    List<String> columns = table.columnNames();
    List<String> named = columns.stream()
        .filter(c -> TIME_NAME.matcher(c).find())
        .toList();
    List<String> candidates = named.isEmpty() ? columns : named;

    List<ColumnScore<List<LocalDateTime>>> ranking = CandidateRanker.rank(candidates,
        column -> scoreSingle(table, column));
    ColumnScore<List<LocalDateTime>> best = ranking.get(0);
    log.debug("Time candidates: {}", ranking.stream()
        .map(s -> s.column() + "=" + s.score())
        .toList());

    if (best.score() < PAIR_THRESHOLD || isDateOnly(best.metrics())) {
      TimeDetection pair = bestPair(table, columns);
      if (pair != null && pair.score() >= best.score()) {
        log.debug("Using date/time pair {} (score {})", pair.label(), pair.score());
        return pair;
      }
    }
    return new TimeDetection(best.column(), null, best.metrics(), best.score());
  }

  private static ColumnScore<List<LocalDateTime>> scoreSingle(NormalizedTable table,
      String column) {
    List<Object> cells = table.column(column);
    List<LocalDateTime> parsed = new ArrayList<>(cells.size());
    int hits = 0;
    for (Object cell : cells) {
      LocalDateTime value = DateTimeParser.parseDateTime(cell);
      parsed.add(value);
      if (value != null) {
        hits++;
      }
    }
    return new ColumnScore<>(column, ratio(hits, table.rowCount()), parsed);
  }

  private static TimeDetection bestPair(NormalizedTable table, List<String> columns) {
    List<String> dateColumns = columns.stream()
        .filter(c -> c.contains("data"))
        .toList();
    List<String> timeColumns = columns.stream()
        .filter(c -> TIME_OF_DAY_TOKENS.stream().anyMatch(c::contains))
        .toList();

    TimeDetection best = null;
    for (String dateColumn : dateColumns) {
      for (String timeColumn : timeColumns) {
        if (dateColumn.equals(timeColumn)) {
          continue;
        }
        TimeDetection candidate = combine(table, dateColumn, timeColumn);
        if (best == null || candidate.score() > best.score()) {
          best = candidate;
        }
      }
    }
    return best;
  }

  private static TimeDetection combine(NormalizedTable table, String dateColumn,
      String timeColumn) {
    List<Object> dates = table.column(dateColumn);
    List<Object> times = table.column(timeColumn);
    List<LocalDateTime> combined = new ArrayList<>(dates.size());
    int hits = 0;
    for (int i = 0; i < dates.size(); i++) {
      LocalDate date = DateTimeParser.parseDate(dates.get(i));
      LocalTime time = DateTimeParser.parseTimeOfDay(times.get(i));
      if (date == null || time == null) {
        combined.add(null);
        continue;
      }
      combined.add(LocalDateTime.of(date, time));
      hits++;
    }
    return new TimeDetection(dateColumn, timeColumn, combined, ratio(hits, table.rowCount()));
  }

  // a column of bare dates would collapse every reading of a day onto midnight
  private static boolean isDateOnly(List<LocalDateTime> parsed) {
    boolean any = false;
    for (LocalDateTime value : parsed) {
      if (value == null) {
        continue;
      }
      if (!value.toLocalTime().equals(LocalTime.MIDNIGHT)) {
        return false;
      }
      any = true;
    }
    return any;
  }

  private static double ratio(int hits, int total) {
    return total == 0 ? 0d : (double) hits / total;
  }
}
