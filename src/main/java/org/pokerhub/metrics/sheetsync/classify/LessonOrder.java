/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders lesson titles by course family, then module number, then lesson
 * number. Titles without a family go last, missing numbers sort after all
 * present ones.
 */
public final class LessonOrder implements Comparator<String> {

  private static final Logger logger =
      LoggerFactory.getLogger(LessonOrder.class);

  /** Family name given to titles without any family marker. */
  static final String NO_FAMILY = "ZZZ";

  static final long MISSING_NUMBER = Long.MAX_VALUE;

  private static final Pattern MODULE_NUMBER = Pattern.compile(
      "(?:модуль|module)\\s*(\\d+)",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private static final Pattern LESSON_NUMBER = Pattern.compile(
      "(?:урок|lesson)\\s*(\\d+)",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  /**
   * Returns a sorted copy of the given lessons, or a copy in the original
   * order if sorting fails for any reason.
   */
  public static List<String> sort(List<String> lessons) {
    List<String> sorted = new ArrayList<>(lessons);
    try {
      sorted.sort(new LessonOrder());
      return sorted;
    } catch (RuntimeException e) {
      logger.warn("Failed to sort lessons: {}", e.getMessage());
      return new ArrayList<>(lessons);
    }
  }

  @Override
  public int compare(String first, String second) {
    int cmp = family(first).compareTo(family(second));
    if (cmp != 0) {
      return cmp;
    }
    cmp = Long.compare(number(MODULE_NUMBER, first),
        number(MODULE_NUMBER, second));
    if (cmp != 0) {
      return cmp;
    }
    return Long.compare(number(LESSON_NUMBER, first),
        number(LESSON_NUMBER, second));
  }

  static String family(String lesson) {
    String upper = lesson.toUpperCase(Locale.ROOT);
    for (String marker : CourseClassifier.FAMILY_MARKERS.keySet()) {
      if (upper.contains(marker)) {
        return CourseClassifier.FAMILY_MARKERS.get(marker);
      }
    }
    return NO_FAMILY;
  }

  static long number(Pattern pattern, String lesson) {
    Matcher matcher = pattern.matcher(lesson);
    if (!matcher.find()) {
      return MISSING_NUMBER;
    }
    try {
      return Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      return MISSING_NUMBER;
    }
  }
}
