/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

import java.util.List;

/**
 * Fits newline-joined entries into a destination cell of bounded size.
 * The result never exceeds the given ceiling.
 */
public final class TextLimits {

  public static final String TRUNCATED_MARKER = "\n[TRUNCATED]";

  private TextLimits() {}

  /**
   * Joins the entries with newlines. If the result is longer than
   * {@code maxChars} and there are more than {@code windowThreshold}
   * entries, the first {@code head} and last {@code tail} entries are kept
   * around a marker line produced from the number of dropped entries.
   * Anything still too long is cut off and marked as truncated.
   *
   * @param entries Entries in output order.
   * @param maxChars Ceiling for the returned text.
   * @param windowThreshold Minimum entry count for head/tail windowing.
   * @param head Number of leading entries kept when windowing.
   * @param tail Number of trailing entries kept when windowing.
   * @param skippedFormat Format string with one {@code %d} for the number of
   *     dropped entries.
   */
  public static String fit(List<String> entries, int maxChars,
      int windowThreshold, int head, int tail, String skippedFormat) {
    String joined = String.join("\n", entries);
    if (joined.length() <= maxChars) {
      return joined;
    }
    if (entries.size() > windowThreshold && entries.size() > head + tail) {
      int skipped = entries.size() - head - tail;
      String windowed = String.join("\n", entries.subList(0, head))
          + "\n" + String.format(skippedFormat, skipped) + "\n"
          + String.join("\n", entries.subList(entries.size() - tail,
          entries.size()));
      return truncate(windowed, maxChars);
    }
    return truncate(joined, maxChars);
  }

  /**
   * Cuts the text so that it, including the truncation marker, fits into
   * {@code maxChars}. Shorter texts are returned unchanged.
   */
  public static String truncate(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    if (maxChars <= TRUNCATED_MARKER.length()) {
      return text.substring(0, cutIndex(text, maxChars));
    }
    int cut = cutIndex(text, maxChars - TRUNCATED_MARKER.length());
    return text.substring(0, cut) + TRUNCATED_MARKER;
  }

  /* Never split a surrogate pair. */
  private static int cutIndex(String text, int cut) {
    if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
      return cut - 1;
    }
    return cut;
  }
}
