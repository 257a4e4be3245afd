/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;

/**
 * Creates a fresh job for every tick, so that no per-tick state survives
 * into the next one.
 */
@FunctionalInterface
public interface SyncJobFactory {

  SyncJob create(JobSpec spec);

}
