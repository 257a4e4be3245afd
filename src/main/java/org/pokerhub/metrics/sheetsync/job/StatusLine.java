/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Renders the marker written to cell {@code A1} after every sync, e.g.
 * {@code 2026-03-01 12:00:00 | Leads | records: 42}.
 */
public class StatusLine {

  private static final Logger logger =
      LoggerFactory.getLogger(StatusLine.class);

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final Clock clock;

  /**
   * Creates status lines in the given zone, or in the system zone if the
   * given one is unknown.
   */
  public StatusLine(String zoneId) {
    this(Clock.system(zoneOrDefault(zoneId)));
  }

  StatusLine(Clock clock) {
    this.clock = clock;
  }

  private static ZoneId zoneOrDefault(String zoneId) {
    try {
      return ZoneId.of(zoneId);
    } catch (DateTimeException | NullPointerException e) {
      logger.warn("Time zone '{}' not available. Using local time.", zoneId);
      return ZoneId.systemDefault();
    }
  }

  /** Returns the status line for the given tab and record count. */
  public String format(String tab, int records) {
    return ZonedDateTime.now(clock).format(DATE_TIME) + " | " + tab
        + " | records: " + records;
  }
}
