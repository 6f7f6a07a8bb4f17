package com.ospicorp.templog.series.service;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Turns a raw cell of unknown locale into a number. Never throws: anything that cannot be
 * read becomes {@link OptionalDouble#empty()}.
 */
public final class NumericCellCleaner {
  // longest patterns first so " celsius" is not cut down to "elsius" by " c"
  private static final List<String> UNIT_NOISE =
      List.of(" celsius", " c ", "°c", "℃", " c", "c ", "°");
  private static final Set<String> DEGENERATE = Set.of("", ".", "-", "-.", ".-");
  private static final Pattern NOT_NUMERIC = Pattern.compile("[^0-9.\\-]+");

  /**
   * Roles of ',' and '.' in a cell, keyed on which of them occur and, when both do,
   * which one occurs last.
   */
  enum SeparatorLayout {
    NONE(s -> s),
    DOT_ONLY(s -> s),
    COMMA_ONLY(s -> s.replace(',', '.')),
    COMMA_DECIMAL(s -> s.replace(".", "").replace(',', '.')),
    DOT_DECIMAL(s -> s.replace(",", ""));

    private final UnaryOperator<String> rewrite;

    SeparatorLayout(UnaryOperator<String> rewrite) {
      this.rewrite = rewrite;
    }

    static SeparatorLayout of(String text) {
      int lastComma = text.lastIndexOf(',');
      int lastDot = text.lastIndexOf('.');
      boolean hasComma = lastComma >= 0;
      boolean hasDot = lastDot >= 0;
      if (hasComma && hasDot) {
        return lastComma > lastDot ? COMMA_DECIMAL : DOT_DECIMAL;
      }
      if (hasComma) {
        return COMMA_ONLY;
      }
      return hasDot ? DOT_ONLY : NONE;
    }

    String apply(String text) {
      return rewrite.apply(text);
    }
  }

  private NumericCellCleaner() {
  }

  public static OptionalDouble clean(Object cell) {
    if (cell == null) {
      return OptionalDouble.empty();
    }
    if (cell instanceof Number number) {
      double value = number.doubleValue();
      return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
    String text = String.valueOf(cell).strip().toLowerCase(Locale.ROOT);
    for (String noise : UNIT_NOISE) {
      text = text.replace(noise, "");
    }
    text = text.replace(" ", "");
    text = SeparatorLayout.of(text).apply(text);
    text = NOT_NUMERIC.matcher(text).replaceAll("");
    if (DEGENERATE.contains(text)) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(text));
    } catch (NumberFormatException ex) {
      return OptionalDouble.empty();
    }
  }

  /** Cleans a whole column; unreadable cells are {@code null}. */
  public static Double[] cleanColumn(List<Object> cells) {
    Double[] out = new Double[cells.size()];
    for (int i = 0; i < out.length; i++) {
      OptionalDouble value = clean(cells.get(i));
      out[i] = value.isPresent() ? value.getAsDouble() : null;
    }
    return out;
  }
}
