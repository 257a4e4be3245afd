/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.job;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

public class StatusLineTest {

  private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Test()
  public void testFormat() {
    StatusLine statusLine = new StatusLine(Clock.fixed(NOW,
        ZoneId.of("Europe/Moscow")));
    assertEquals("2026-03-01 12:00:00 | Leads | records: 42",
        statusLine.format("Leads", 42));
  }

  @Test()
  public void testEmptyTab() {
    StatusLine statusLine = new StatusLine(Clock.fixed(NOW,
        ZoneId.of("UTC")));
    assertEquals("2026-03-01 09:00:00 | Robot | records: 0",
        statusLine.format("Robot", 0));
  }

  @Test()
  public void testUnknownZoneFallsBack() {
    String line = new StatusLine("Mars/Olympus_Mons").format("Leads", 1);
    assertTrue(line, line.matches(
        "\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} \\| Leads \\| records: 1"));
  }
}
