/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;

/**
 * Creates a fresh, unconnected source for one job run.
 */
@FunctionalInterface
public interface SourceFactory {

  Source create(JobSpec spec);

}
