/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.conf;

/**
 * Per-job property suffixes. A job named {@code alpha} is configured with
 * properties like {@code alpha.SheetTab = Alpha}.
 */
public enum JobKey {

  Database(String.class, null),
  SheetTab(String.class, null),
  ColumnRange(String.class, "A:R"),
  StartRow(Integer.class, "1"),
  ClearTail(Boolean.class, "true"),
  Enrich(Boolean.class, "false"),
  UseTunnel(Boolean.class, "false"),
  Query(String.class, null);

  /** Column range every enriched job is forced to. */
  public static final String ENRICHED_COLUMN_RANGE = "A:X";

  private final Class<?> clazz;
  private final String defaultValue;

  JobKey(Class<?> clazz, String defaultValue) {
    this.clazz = clazz;
    this.defaultValue = defaultValue;
  }

  public Class<?> keyClass() {
    return clazz;
  }

  public String defaultValue() {
    return defaultValue;
  }

  /** Returns the full property name for the given job. */
  public String propertyName(String job) {
    return job + "." + name();
  }

}
