/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import java.io.IOException;
import java.util.List;

/**
 * Spreadsheet-like destination shared by all jobs. Implementations must be
 * safe for concurrent use.
 */
public interface Destination {

  /** Establishes and verifies access once at startup. */
  void connect() throws IOException;

  /**
   * Writes the grid, header first, to the given tab starting at the given
   * row, and applies presentation metadata to the written rows. An empty
   * grid, or one holding only a header, writes nothing.
   *
   * @param clearTail Whether to clear all rows of the column range below
   *     the written ones.
   */
  void write(String tab, List<List<String>> grid, int startRow,
      ColumnRange range, boolean clearTail) throws IOException;

  /** Writes the status line to cell {@code A1} of the given tab. */
  void writeStatus(String tab, String status) throws IOException;

}
