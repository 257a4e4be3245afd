/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.pokerhub.metrics.sheetsync.history.HistoryEvent;
import org.pokerhub.metrics.sheetsync.history.StateRow;

import java.io.IOException;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;

/**
 * A relational source owned by exactly one job for the duration of one
 * tick.
 */
public interface Source {

  /**
   * Acquires the connection, setting up a tunnel first if required. Calling
   * this again after a failure, or after success, is safe.
   */
  void connect() throws SQLException, IOException;

  /** Runs the primary query. */
  RowSet fetch(String query) throws SQLException;

  /** Returns the event history of the given subjects. */
  List<HistoryEvent> fetchHistory(Collection<Long> subjectIds)
      throws SQLException;

  /** Returns current-state candidates of the given subjects. */
  List<StateRow> fetchStates(Collection<Long> subjectIds)
      throws SQLException;

  /** Releases the connection and tunnel; never throws. */
  void disconnect();

}
