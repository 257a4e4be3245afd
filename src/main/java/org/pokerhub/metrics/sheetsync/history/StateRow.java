/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.history;

import java.time.LocalDateTime;

/**
 * A candidate current label of a subject. When a subject has several, the
 * one with the latest timestamp wins; rows without timestamp only win over
 * earlier rows without timestamp.
 */
public final class StateRow {

  private final long subjectId;

  private final String label;

  private final LocalDateTime timestamp;

  public StateRow(long subjectId, String label) {
    this(subjectId, label, null);
  }

  /** Creates a state row; the timestamp may be {@code null}. */
  public StateRow(long subjectId, String label, LocalDateTime timestamp) {
    this.subjectId = subjectId;
    this.label = null == label ? "" : label;
    this.timestamp = timestamp;
  }

  public long getSubjectId() {
    return subjectId;
  }

  public String getLabel() {
    return label;
  }

  public LocalDateTime getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return subjectId + ":" + label + "@" + timestamp;
  }
}
