package com.ospicorp.templog.series.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form for header names: lower case, no accents, no whitespace, and the
 * Celsius marks folded into a plain {@code c}.
 */
public final class TextNormalizer {
  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

  private TextNormalizer() {
  }

  public static String normalize(Object text) {
    String value = String.valueOf(text).strip().toLowerCase(Locale.ROOT);
    value = Normalizer.normalize(value, Normalizer.Form.NFKD);
    value = COMBINING_MARKS.matcher(value).replaceAll("");
    // NFKD turns ℃ into °C, so fold case again before unifying the unit
    value = value.toLowerCase(Locale.ROOT)
        .replace("℃", "c")
        .replace("°c", "c");
    return value.replace(" ", "")
        .replace("\n", "")
        .replace("\r", "")
        .replace("\t", "");
  }
}
