package com.ospicorp.templog.series.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

/**
 * Lenient reader for the date and time cells found in logger exports. Day-first readings win
 * over month-first ones; month-first is only tried once every day-first format has failed.
 * A trailing UTC offset or {@code Z} is accepted and dropped: the wall-clock reading is kept.
 * Returns {@code null} for anything it cannot read.
 */
public final class DateTimeParser {
  private static final String TIME_SUFFIX =
      "[['T'][' ']H:mm[:ss[.SSSSSSSSS][.SSSSSS][.SSS]][XXX]]";
  private static final String TWELVE_HOUR_SUFFIX = " h:mm[:ss] a";

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
      dateTime("uuuu-M-d" + TIME_SUFFIX),
      dateTime("uuuu/M/d" + TIME_SUFFIX),
      dateTime("d/M/uuuu" + TIME_SUFFIX),
      dateTime("d-M-uuuu" + TIME_SUFFIX),
      dateTime("d.M.uuuu" + TIME_SUFFIX),
      dateTime("d/M/uu" + TIME_SUFFIX),
      dateTime("d-M-uu" + TIME_SUFFIX),
      dateTime("d.M.uu" + TIME_SUFFIX),
      twelveHour("d/M/uuuu" + TWELVE_HOUR_SUFFIX),
      twelveHour("d/M/uu" + TWELVE_HOUR_SUFFIX),
      dateTime("M/d/uuuu" + TIME_SUFFIX),
      dateTime("M/d/uu" + TIME_SUFFIX),
      twelveHour("M/d/uuuu" + TWELVE_HOUR_SUFFIX),
      twelveHour("M/d/uu" + TWELVE_HOUR_SUFFIX));

  private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
      strict("H:mm[:ss[.SSSSSSSSS][.SSSSSS][.SSS]]"),
      strict("H'h'mm"),
      twelveHour("h:mm[:ss] a"));

  private DateTimeParser() {
  }

  public static LocalDateTime parseDateTime(Object cell) {
    if (cell instanceof LocalDateTime dateTime) {
      return dateTime;
    }
    if (cell instanceof LocalDate date) {
      return date.atStartOfDay();
    }
    if (!(cell instanceof CharSequence)) {
      return null;
    }
    String text = cell.toString().strip();
    if (text.isEmpty()) {
      return null;
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      try {
        return LocalDateTime.parse(text, format);
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    return null;
  }

  public static LocalDate parseDate(Object cell) {
    LocalDateTime dateTime = parseDateTime(cell);
    return dateTime == null ? null : dateTime.toLocalDate();
  }

  public static LocalTime parseTimeOfDay(Object cell) {
    if (cell instanceof LocalTime time) {
      return time;
    }
    if (cell instanceof LocalDateTime dateTime) {
      return dateTime.toLocalTime();
    }
    if (!(cell instanceof CharSequence)) {
      return null;
    }
    String text = cell.toString().strip();
    if (text.isEmpty()) {
      return null;
    }
    for (DateTimeFormatter format : TIME_FORMATS) {
      try {
        return LocalTime.parse(text, format);
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    LocalDateTime dateTime = parseDateTime(text);
    return dateTime == null ? null : dateTime.toLocalTime();
  }

  private static DateTimeFormatter dateTime(String pattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
  }

  // AM/PM markers in any case, read with root-locale symbols
  private static DateTimeFormatter twelveHour(String pattern) {
    return new DateTimeFormatterBuilder()
        .parseCaseInsensitive()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter(Locale.ROOT)
        .withResolverStyle(ResolverStyle.STRICT);
  }

  private static DateTimeFormatter strict(String pattern) {
    return new DateTimeFormatterBuilder()
        .appendPattern(pattern)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
