/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.history;

import org.pokerhub.metrics.sheetsync.classify.TextLimits;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a subject's history into one destination cell.
 */
public final class HistoryFormatter {

  /** Largest history text written to a cell. */
  public static final int MAX_HISTORY_CHARS = 40_000;

  static final int WINDOW_THRESHOLD = 200;

  static final int WINDOW_SIZE = 100;

  private static final String ENTRIES_SKIPPED = "[...%d entries...]";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private HistoryFormatter() {}

  /** Formats with the default ceiling. */
  public static String format(SubjectState state) {
    return format(state, MAX_HISTORY_CHARS);
  }

  /**
   * Renders one {@code [<timestamp> - <label>]} line per event. Long
   * histories keep their first and last 100 events; the result never
   * exceeds {@code maxChars}.
   */
  public static String format(SubjectState state, int maxChars) {
    List<String> lines = new ArrayList<>(state.getHistory().size());
    for (HistoryEvent event : state.getHistory()) {
      lines.add("[" + TIMESTAMP_FORMAT.format(event.getTimestamp()) + " - "
          + event.getLabel() + "]");
    }
    return TextLimits.fit(lines, maxChars, WINDOW_THRESHOLD, WINDOW_SIZE,
        WINDOW_SIZE, ENTRIES_SKIPPED);
  }
}
