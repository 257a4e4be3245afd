/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Header plus rows of heterogeneous values, subject id first. Every row has
 * exactly as many values as the header has names.
 */
public final class RowSet {

  private static final Logger logger = LoggerFactory.getLogger(RowSet.class);

  private final List<String> header;

  private final List<List<Object>> rows;

  /**
   * Creates a row set.
   *
   * @throws IllegalArgumentException if a row width differs from the header.
   */
  public RowSet(List<String> header, List<List<Object>> rows) {
    List<List<Object>> copies = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<Object> row = rows.get(i);
      if (row.size() != header.size()) {
        throw new IllegalArgumentException("Row " + i + " has " + row.size()
            + " values, but the header has " + header.size() + " names.");
      }
      copies.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.header = Collections.unmodifiableList(new ArrayList<>(header));
    this.rows = Collections.unmodifiableList(copies);
  }

  public List<String> getHeader() {
    return header;
  }

  public List<List<Object>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /**
   * Returns the distinct subject ids of all rows, in row order. Rows whose
   * first value is missing or not an integer are skipped.
   */
  public List<Long> subjectIds() {
    Set<Long> ids = new LinkedHashSet<>();
    for (List<Object> row : rows) {
      Long id = row.isEmpty() ? null : subjectId(row.get(0));
      if (null != id) {
        ids.add(id);
      }
    }
    return new ArrayList<>(ids);
  }

  /**
   * Converts a subject id value into a {@code Long}, or returns
   * {@code null} if that is not possible.
   */
  public static Long subjectId(Object value) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.parseLong(((String) value).trim());
      } catch (NumberFormatException e) {
        logger.debug("Skipping non-numeric subject id '{}'.", value);
      }
    }
    return null;
  }
}
