package com.civicbiz.catalog.ingest.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");

  private TextNormalizer() {}

  /** Trims and collapses inner whitespace; blank input becomes null. */
  public static String clean(String value) {
    if (value == null) {
      return null;
    }
    String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ");
    return collapsed.isEmpty() ? null : collapsed;
  }

  /** Comparison form: lowercase, punctuation removed, whitespace collapsed. */
  public static String forComparison(String value) {
    if (value == null) {
      return "";
    }
    String lower = value.toLowerCase(Locale.ROOT);
    String stripped = PUNCTUATION.matcher(lower).replaceAll("");
    return WHITESPACE.matcher(stripped.trim()).replaceAll(" ");
  }
}
