/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public class LessonOrderTest {

  @Test()
  public void testFamilyModuleLessonOrder() {
    List<String> lessons = Arrays.asList("Module 2 Lesson 1",
        "MTT Module 1 Lesson 2", "Module 1 Lesson 10", "модуль 1 урок 2",
        "Intro");
    assertEquals(Arrays.asList("MTT Module 1 Lesson 2", "модуль 1 урок 2",
        "Module 1 Lesson 10", "Module 2 Lesson 1", "Intro"),
        LessonOrder.sort(lessons));
  }

  @Test()
  public void testSortKeepsInputUntouched() {
    List<String> lessons = Arrays.asList("Module 2", "Module 1");
    LessonOrder.sort(lessons);
    assertEquals(Arrays.asList("Module 2", "Module 1"), lessons);
  }

  @Test()
  public void testMissingNumbers() {
    assertEquals(LessonOrder.MISSING_NUMBER, LessonOrder.number(
        Pattern.compile("(?:lesson)\\s*(\\d+)"), "Lesson"));
    assertEquals(LessonOrder.NO_FAMILY, LessonOrder.family("Intro"));
    assertEquals("CASH", LessonOrder.family("кеш модуль 1"));
  }

  @Test()
  public void testOverlongNumberSortsLast() {
    List<String> lessons = Arrays.asList("Module 99999999999999999999",
        "Module 3");
    assertEquals(Arrays.asList("Module 3", "Module 99999999999999999999"),
        LessonOrder.sort(lessons));
  }
}
