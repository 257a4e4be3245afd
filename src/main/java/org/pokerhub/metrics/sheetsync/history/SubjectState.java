/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.history;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Merged event history and current label of one subject.
 */
public final class SubjectState {

  private final long subjectId;

  private final List<HistoryEvent> history;

  private final String currentLabel;

  SubjectState(long subjectId, List<HistoryEvent> history,
      String currentLabel) {
    this.subjectId = subjectId;
    this.history = Collections.unmodifiableList(history);
    this.currentLabel = currentLabel;
  }

  /** Returns a state without history and without label. */
  public static SubjectState empty(long subjectId) {
    return new SubjectState(subjectId, Collections.<HistoryEvent>emptyList(),
        "");
  }

  public long getSubjectId() {
    return subjectId;
  }

  /** Events in ascending timestamp order. */
  public List<HistoryEvent> getHistory() {
    return history;
  }

  /** Timestamp of the latest event, or {@code null} without history. */
  public LocalDateTime getLastEventTime() {
    return history.isEmpty() ? null
        : history.get(history.size() - 1).getTimestamp();
  }

  /** Current label, or the empty string if none is known. */
  public String getCurrentLabel() {
    return currentLabel;
  }

  @Override
  public String toString() {
    return "SubjectState[" + subjectId + ", " + history.size()
        + " events, label='" + currentLabel + "']";
  }
}
