/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.history;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins event history rows and current-state rows into one
 * {@link SubjectState} per subject, in a single pass over each input.
 */
public class EventHistoryMerger {

  private static final Comparator<HistoryEvent> BY_TIMESTAMP =
      Comparator.comparing(HistoryEvent::getTimestamp);

  /**
   * Merges the given rows.
   *
   * <p>The result contains every requested subject, plus every subject
   * that occurs in one of the two row lists, in that order. Subjects
   * without events get an empty history, subjects without state row an
   * empty label.</p>
   *
   * @param subjectIds Subjects of the primary row set.
   * @param historyRows Events in any order.
   * @param stateRows Candidate current labels in any order.
   */
  public Map<Long, SubjectState> merge(Collection<Long> subjectIds,
      Collection<HistoryEvent> historyRows, Collection<StateRow> stateRows) {
    Map<Long, List<HistoryEvent>> histories = new LinkedHashMap<>();
    for (Long subjectId : subjectIds) {
      histories.put(subjectId, new ArrayList<HistoryEvent>());
    }
    for (HistoryEvent event : historyRows) {
      histories.computeIfAbsent(event.getSubjectId(),
          id -> new ArrayList<HistoryEvent>()).add(event);
    }
    Map<Long, StateRow> latest = new HashMap<>();
    for (StateRow row : stateRows) {
      histories.computeIfAbsent(row.getSubjectId(),
          id -> new ArrayList<HistoryEvent>());
      StateRow current = latest.get(row.getSubjectId());
      if (null == current || isNotOlder(row, current)) {
        latest.put(row.getSubjectId(), row);
      }
    }
    Map<Long, SubjectState> states = new LinkedHashMap<>();
    for (Map.Entry<Long, List<HistoryEvent>> entry : histories.entrySet()) {
      List<HistoryEvent> events = entry.getValue();
      events.sort(BY_TIMESTAMP);
      StateRow state = latest.get(entry.getKey());
      states.put(entry.getKey(), new SubjectState(entry.getKey(), events,
          null == state ? "" : state.getLabel()));
    }
    return states;
  }

  private static boolean isNotOlder(StateRow candidate, StateRow current) {
    if (null == candidate.getTimestamp()) {
      return null == current.getTimestamp();
    }
    return null == current.getTimestamp()
        || !candidate.getTimestamp().isBefore(current.getTimestamp());
  }
}
