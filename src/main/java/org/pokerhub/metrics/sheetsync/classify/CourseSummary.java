/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.classify;

/**
 * Cell texts produced by {@link CourseClassifier#parse(java.util.List)}.
 */
public final class CourseSummary {

  public static final CourseSummary EMPTY = new CourseSummary("", "");

  private final String tags;

  private final String lessons;

  public CourseSummary(String tags, String lessons) {
    this.tags = tags;
    this.lessons = lessons;
  }

  /** Sorted, newline-joined classification tags like {@code MTT2}. */
  public String getTags() {
    return tags;
  }

  /** Sorted, newline-joined and size-limited lesson titles. */
  public String getLessons() {
    return lessons;
  }

  @Override
  public String toString() {
    return "CourseSummary[tags=" + tags.replace('\n', ',') + ", lessons="
        + lessons.length() + " chars]";
  }
}
