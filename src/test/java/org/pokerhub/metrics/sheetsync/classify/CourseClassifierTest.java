/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CourseClassifierTest {

  private final CourseClassifier classifier = new CourseClassifier();

  @Test()
  public void testExplicitModule() {
    assertEquals("MTT2", classifier.classify("MTT Модуль 2"));
    assertEquals("SPIN7", classifier.classify("spin module 7, lesson 3"));
    assertEquals("CASH12", classifier.classify("Кэш МОДУЛЬ12"));
  }

  @Test()
  public void testEveryFamilyMarkerWithModule() {
    for (Map.Entry<String, String> family
        : CourseClassifier.FAMILY_MARKERS.entrySet()) {
      for (int module = 1; module <= 5; module++) {
        String text = "Курс " + family.getKey().toLowerCase() + " модуль "
            + module;
        assertEquals(text, family.getValue() + module,
            classifier.classify(text));
      }
    }
  }

  @Test()
  public void testFirstNumberWithoutModuleMarker() {
    assertEquals("MTT3", classifier.classify("MTT 3 поток 2024"));
  }

  @Test()
  public void testOrdinalWords() {
    assertEquals("CASH3", classifier.classify("Cash advanced"));
    assertEquals("SPIN2", classifier.classify("Спин средний уровень"));
    assertEquals("MTT1", classifier.classify("MTT for beginners"));
    assertEquals("MTT4", classifier.classify("МТТ профессионал"));
  }

  @Test()
  public void testDefaultModule() {
    assertEquals("SPIN1", classifier.classify("Спин курс"));
  }

  @Test()
  public void testFamilyMarkerOrder() {
    assertEquals("MTT1", classifier.classify("SPIN and MTT"));
  }

  @Test()
  public void testNoFamily() {
    assertNull(classifier.classify("Poker basics, module 2"));
    assertNull(classifier.classify(""));
    assertNull(classifier.classify(null));
  }

  @Test()
  public void testRepeatedClassificationIsMemoized() {
    classifier.classify("MTT Модуль 2");
    classifier.classify("MTT Модуль 2");
    classifier.classify("no family");
    classifier.classify("no family");
    assertEquals(2L, classifier.cacheStats().hitCount());
    assertNull(classifier.classify("no family"));
  }

  @Test()
  public void testParseCourseMap() {
    Map<String, List<String>> course = new LinkedHashMap<>();
    course.put("MTT Course 1", Arrays.asList("Модуль 1 Урок 2",
        "Модуль 1 Урок 1"));
    CourseSummary summary = classifier.parse(
        Collections.singletonList(course));
    assertEquals("MTT1", summary.getTags());
    assertEquals("Модуль 1 Урок 1\nМодуль 1 Урок 2", summary.getLessons());
  }

  @Test()
  public void testParseBareStrings() {
    List<Object> items = new ArrayList<>();
    items.add("SPIN Module 2 Lesson 3");
    items.add("MTT Premium");
    items.add(42);
    items.add(null);
    CourseSummary summary = classifier.parse(items);
    assertEquals("MTT1\nSPIN2", summary.getTags());
    assertEquals("SPIN Module 2 Lesson 3", summary.getLessons());
  }

  @Test()
  public void testParseEmpty() {
    assertEquals(CourseSummary.EMPTY, classifier.parse(null));
    CourseSummary summary = classifier.parse(Collections.emptyList());
    assertEquals("", summary.getTags());
    assertEquals("", summary.getLessons());
  }

  @Test()
  public void testParseWindowsManyLongLessons() {
    List<String> lessons = new ArrayList<>();
    StringBuilder padding = new StringBuilder();
    for (int i = 0; i < 500; i++) {
      padding.append('x');
    }
    for (int i = 1; i <= 100; i++) {
      lessons.add("Module 1 Lesson " + i + " " + padding);
    }
    Map<String, List<String>> course = new LinkedHashMap<>();
    course.put("MTT", lessons);
    String text = classifier.parse(Collections.singletonList(course))
        .getLessons();
    assertTrue(text.length() <= CourseClassifier.MAX_LESSONS_CHARS);
    assertTrue(text.contains("... [40 lessons skipped] ..."));
    assertTrue(text.startsWith("Module 1 Lesson 1 "));
    assertTrue(text.endsWith("Module 1 Lesson 100 " + padding));
  }

  @Test()
  public void testLessonEntries() {
    assertTrue(CourseClassifier.isLessonEntry("Модуль 1 Урок 2"));
    assertTrue(CourseClassifier.isLessonEntry("module 3 lesson 1"));
    assertFalse(CourseClassifier.isLessonEntry("Модуль 1"));
    assertTrue(CourseClassifier.mentionsModuleOrLesson("Модуль 1"));
    assertFalse(CourseClassifier.mentionsModuleOrLesson("VIP чат"));
  }
}
