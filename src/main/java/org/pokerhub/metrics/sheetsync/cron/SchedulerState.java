/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

/** Lifecycle of the {@link Scheduler}. */
public enum SchedulerState {
  INITIALIZING,
  RUNNING,
  SHUTTING_DOWN,
  STOPPED
}
