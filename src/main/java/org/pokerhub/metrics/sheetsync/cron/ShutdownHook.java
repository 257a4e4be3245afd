/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops the scheduler when the JVM receives a termination signal.
 */
public final class ShutdownHook extends Thread {

  private static final Logger log = LoggerFactory.getLogger(ShutdownHook.class);

  private final Scheduler scheduler;

  /** Names the shutdown thread for debugging purposes. */
  public ShutdownHook(Scheduler scheduler) {
    super("SheetSync-ShutdownThread");
    this.scheduler = scheduler;
  }

  @Override
  public void run() {
    log.info("Shutdown in progress ... ");
    scheduler.shutdownScheduler();
    log.info("Shutdown finished. Exiting.");
  }
}
