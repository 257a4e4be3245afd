/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import java.io.IOException;

public class OperationsTest {

  @Test()
  public void testTimedPassesResult() throws Exception {
    assertEquals("rows", Operations.timed("fetch", 1L, () -> {
      Thread.sleep(5L);
      return "rows";
    }).call());
  }

  @Test(expected = IOException.class)
  public void testTimedPropagatesErrors() throws Exception {
    Operations.timed("fetch", 10_000L, () -> {
      throw new IOException("down");
    }).call();
  }

  @Test(expected = IOException.class)
  public void testLoggedPropagatesErrors() throws Exception {
    Operations.logged("write", () -> {
      throw new IOException("down");
    }).call();
  }

  @Test()
  public void testLoggedPassesResult() throws Exception {
    assertEquals(Integer.valueOf(3), Operations.logged("count", () -> 3)
        .call());
  }
}
