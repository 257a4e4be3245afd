/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.history;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single timestamped label in a subject's event timeline.
 */
public final class HistoryEvent {

  private final long subjectId;

  private final String label;

  private final LocalDateTime timestamp;

  /** Creates an event; the timestamp must not be {@code null}. */
  public HistoryEvent(long subjectId, String label, LocalDateTime timestamp) {
    this.subjectId = subjectId;
    this.label = null == label ? "" : label;
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
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
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof HistoryEvent)) {
      return false;
    }
    HistoryEvent that = (HistoryEvent) other;
    return subjectId == that.subjectId && label.equals(that.label)
        && timestamp.equals(that.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(subjectId, label, timestamp);
  }

  @Override
  public String toString() {
    return label + "@" + timestamp;
  }
}
