/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import org.pokerhub.metrics.sheetsync.source.RowSet;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders values as the strings the destination interprets on entry.
 */
public final class CellFormatter {

  static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private CellFormatter() {}

  /**
   * Formats one value: {@code null} as the empty string, booleans as
   * {@code TRUE}/{@code FALSE}, date-times as
   * {@code yyyy-MM-dd HH:mm:ss}, and everything else via
   * {@code toString()}.
   */
  public static String format(Object value) {
    if (null == value) {
      return "";
    } else if (value instanceof Boolean) {
      return (Boolean) value ? "TRUE" : "FALSE";
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).format(DATE_TIME);
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).format(DATE_TIME);
    } else if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).format(DATE_TIME);
    }
    return value.toString();
  }

  /**
   * Formats header and rows into a grid, header first, padding every line
   * with empty cells or cutting it to the given width.
   */
  public static List<List<String>> toGrid(RowSet rows, int width) {
    List<List<String>> grid = new ArrayList<>(rows.size() + 1);
    grid.add(fit(new ArrayList<>(rows.getHeader()), width));
    for (List<Object> row : rows.getRows()) {
      List<String> cells = new ArrayList<>(row.size());
      for (Object value : row) {
        cells.add(format(value));
      }
      grid.add(fit(cells, width));
    }
    return grid;
  }

  private static List<String> fit(List<String> cells, int width) {
    if (cells.size() > width) {
      return new ArrayList<>(cells.subList(0, width));
    }
    while (cells.size() < width) {
      cells.add("");
    }
    return cells;
  }
}
