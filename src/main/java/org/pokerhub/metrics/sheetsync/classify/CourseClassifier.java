/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps free-text course and lesson titles to tags like {@code MTT2}, i.e.
 * a course family followed by a module number.
 *
 * <p>A family matches if one of its markers occurs anywhere in the
 * upper-cased text. The module number is taken from an explicit
 * "module N" phrase, else from the first number in the text, else from an
 * ordinal word, and defaults to 1.</p>
 *
 * <p>Classification is pure, so results are memoized; callers classify the
 * same small vocabulary for every row of every job. Instances are safe for
 * concurrent use.</p>
 */
public class CourseClassifier {

  /** Family markers in matching order, mapped to their family. */
  static final Map<String, String> FAMILY_MARKERS;

  /** Ordinal words and stems in matching order, mapped to digits. */
  static final Map<String, String> ORDINALS;

  static {
    Map<String, String> families = new LinkedHashMap<>();
    families.put("MTT", "MTT");
    families.put("МТТ", "MTT");
    families.put("SPIN", "SPIN");
    families.put("СПИН", "SPIN");
    families.put("CASH", "CASH");
    families.put("КЭШ", "CASH");
    families.put("КЕШ", "CASH");
    FAMILY_MARKERS = Collections.unmodifiableMap(families);

    Map<String, String> ordinals = new LinkedHashMap<>();
    ordinals.put("ПЕРВЫЙ", "1");
    ordinals.put("FIRST", "1");
    ordinals.put("BEGINNER", "1");
    ordinals.put("НАЧИНАЮЩ", "1");
    ordinals.put("ОСНОВ", "1");
    ordinals.put("ВТОРОЙ", "2");
    ordinals.put("SECOND", "2");
    ordinals.put("MIDDLE", "2");
    ordinals.put("INTERMEDIATE", "2");
    ordinals.put("СРЕДН", "2");
    ordinals.put("ТРЕТИЙ", "3");
    ordinals.put("THIRD", "3");
    ordinals.put("ADVANCED", "3");
    ordinals.put("ПРОДВИНУТ", "3");
    ordinals.put("ЧЕТВЕРТЫЙ", "4");
    ordinals.put("FOURTH", "4");
    ordinals.put("PRO", "4");
    ordinals.put("ПРОФЕСС", "4");
    ORDINALS = Collections.unmodifiableMap(ordinals);
  }

  static final int MAX_LESSONS_CHARS = 45_000;

  static final int LESSON_WINDOW_THRESHOLD = 60;

  static final int LESSON_WINDOW_SIZE = 30;

  private static final String LESSONS_SKIPPED = "... [%d lessons skipped] ...";

  private static final int CACHE_SIZE = 256;

  /* Cached value for texts without any family. */
  private static final String NO_TAG = "";

  private static final Pattern MODULE_PHRASE =
      Pattern.compile("(?:МОДУЛЬ|MODULE)\\s*(\\d+)");

  private static final Pattern NUMBER = Pattern.compile("(\\d+)");

  private static final String[] MODULE_MARKERS = {"МОДУЛЬ", "MODULE"};

  private static final String[] LESSON_MARKERS = {"УРОК", "LESSON"};

  private final Cache<String, String> tags = Caffeine.newBuilder()
      .maximumSize(CACHE_SIZE)
      .recordStats()
      .build();

  /**
   * Returns the tag for the given text, or {@code null} if the text names
   * no known course family.
   */
  public String classify(String text) {
    if (null == text || text.isEmpty()) {
      return null;
    }
    String tag = tags.get(text, CourseClassifier::computeTag);
    return NO_TAG.equals(tag) ? null : tag;
  }

  private static String computeTag(String text) {
    String upper = text.toUpperCase(Locale.ROOT);
    for (Map.Entry<String, String> family : FAMILY_MARKERS.entrySet()) {
      if (!upper.contains(family.getKey())) {
        continue;
      }
      Matcher module = MODULE_PHRASE.matcher(upper);
      if (module.find()) {
        return family.getValue() + module.group(1);
      }
      Matcher number = NUMBER.matcher(text);
      if (number.find()) {
        return family.getValue() + number.group(1);
      }
      for (Map.Entry<String, String> ordinal : ORDINALS.entrySet()) {
        if (upper.contains(ordinal.getKey())) {
          return family.getValue() + ordinal.getValue();
        }
      }
      return family.getValue() + "1";
    }
    return NO_TAG;
  }

  /**
   * Summarizes a mixed list of course maps (course title to lesson titles)
   * and bare titles.
   *
   * <p>Course titles and lesson titles inside maps contribute tags, and the
   * lesson titles are listed. Bare titles contribute a tag and are listed
   * only if they mention a module or a lesson. Other elements, including
   * {@code null}, are ignored.</p>
   */
  public CourseSummary parse(List<?> items) {
    if (null == items || items.isEmpty()) {
      return CourseSummary.EMPTY;
    }
    SortedSet<String> tagSet = new TreeSet<>();
    List<String> lessons = new ArrayList<>();
    for (Object item : items) {
      if (item instanceof Map) {
        for (Map.Entry<?, ?> course : ((Map<?, ?>) item).entrySet()) {
          addTag(tagSet, null == course.getKey() ? null
              : String.valueOf(course.getKey()));
          if (!(course.getValue() instanceof List)) {
            continue;
          }
          for (Object lesson : (List<?>) course.getValue()) {
            if (null == lesson) {
              continue;
            }
            String title = String.valueOf(lesson);
            if (title.isEmpty()) {
              continue;
            }
            lessons.add(title);
            addTag(tagSet, title);
          }
        }
      } else if (item instanceof String) {
        String title = (String) item;
        addTag(tagSet, title);
        if (mentionsModuleOrLesson(title)) {
          lessons.add(title);
        }
      }
    }
    String lessonsText = TextLimits.fit(LessonOrder.sort(lessons),
        MAX_LESSONS_CHARS, LESSON_WINDOW_THRESHOLD, LESSON_WINDOW_SIZE,
        LESSON_WINDOW_SIZE, LESSONS_SKIPPED);
    return new CourseSummary(String.join("\n", tagSet), lessonsText);
  }

  private void addTag(SortedSet<String> tagSet, String text) {
    String tag = classify(text);
    if (null != tag) {
      tagSet.add(tag);
    }
  }

  /** Returns whether the text mentions a module or a lesson. */
  public static boolean mentionsModuleOrLesson(String text) {
    String upper = text.toUpperCase(Locale.ROOT);
    return containsAny(upper, MODULE_MARKERS)
        || containsAny(upper, LESSON_MARKERS);
  }

  /**
   * Returns whether the text is a lesson entry, i.e. mentions both a
   * module and a lesson.
   */
  public static boolean isLessonEntry(String text) {
    String upper = text.toUpperCase(Locale.ROOT);
    return containsAny(upper, MODULE_MARKERS)
        && containsAny(upper, LESSON_MARKERS);
  }

  private static boolean containsAny(String upper, String[] markers) {
    for (String marker : markers) {
      if (upper.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  /** Memo statistics, for logging and tests. */
  public CacheStats cacheStats() {
    return tags.stats();
  }
}
