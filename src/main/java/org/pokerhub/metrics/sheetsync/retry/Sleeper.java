/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

/**
 * Blocks the calling thread; replaced in tests to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;

}
