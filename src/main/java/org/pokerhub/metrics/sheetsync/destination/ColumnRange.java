/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Column span of a destination tab in spreadsheet notation, e.g.
 * {@code A:X}. Columns are numbered from 1.
 */
public final class ColumnRange {

  private static final Pattern RANGE_PATTERN =
      Pattern.compile("^([A-Za-z]+):([A-Za-z]+)$");

  private final String first;

  private final String last;

  private ColumnRange(String first, String last) {
    this.first = first;
    this.last = last;
  }

  /**
   * Parses a range like {@code A:R}.
   *
   * @throws IllegalArgumentException if the text is not a column range or
   *     the last column precedes the first one.
   */
  public static ColumnRange parse(String text) {
    if (null == text) {
      throw new IllegalArgumentException("Column range is missing.");
    }
    Matcher matcher = RANGE_PATTERN.matcher(text.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Column range must be in format "
          + "'A:Z', but was '" + text + "'.");
    }
    ColumnRange range = new ColumnRange(
        matcher.group(1).toUpperCase(Locale.ROOT),
        matcher.group(2).toUpperCase(Locale.ROOT));
    if (range.lastIndex() < range.firstIndex()) {
      throw new IllegalArgumentException("Column range '" + text
          + "' ends before it starts.");
    }
    return range;
  }

  /** Converts a column letter name into its 1-based number. */
  public static int columnIndex(String letters) {
    int index = 0;
    for (char c : letters.toUpperCase(Locale.ROOT).toCharArray()) {
      index = index * 26 + (c - 'A' + 1);
    }
    return index;
  }

  public String first() {
    return first;
  }

  public String last() {
    return last;
  }

  public int firstIndex() {
    return columnIndex(first);
  }

  public int lastIndex() {
    return columnIndex(last);
  }

  /** Number of columns covered, i.e. the width of every written row. */
  public int width() {
    return lastIndex() - firstIndex() + 1;
  }

  /** A1 notation for the rectangle between the two given rows. */
  public String toA1(int fromRow, int toRow) {
    return first + fromRow + ":" + last + toRow;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ColumnRange)) {
      return false;
    }
    ColumnRange that = (ColumnRange) other;
    return first.equals(that.first) && last.equals(that.last);
  }

  @Override
  public int hashCode() {
    return 31 * first.hashCode() + last.hashCode();
  }

  @Override
  public String toString() {
    return first + ":" + last;
  }
}
