/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * One synchronization of one job. Subclasses implement the pipeline and
 * announce each stage via {@link #enter(JobStage)}; this class turns every
 * error into a failed {@link SyncOutcome} so that sibling jobs keep
 * running.
 */
public abstract class SyncJob implements Callable<SyncOutcome> {

  private static final Logger logger = LoggerFactory.getLogger(SyncJob.class);

  static final long SLOW_JOB_MILLIS = 30_000L;

  protected final JobSpec spec;

  private volatile JobStage stage = JobStage.IDLE;

  protected SyncJob(JobSpec spec) {
    this.spec = spec;
  }

  /**
   * Runs the pipeline and reports how it went. Never throws.
   */
  @Override
  public final SyncOutcome call() {
    long started = System.nanoTime();
    try {
      logger.info("Updating '{}' from {}.", spec.getSheetTab(), name());
      int rows = startProcessing();
      enter(JobStage.DONE);
      long elapsed = elapsedMillis(started);
      if (elapsed > SLOW_JOB_MILLIS) {
        logger.warn("Job {} took {} ms (threshold: {} ms).", name(), elapsed,
            SLOW_JOB_MILLIS);
      }
      logger.info("Updated: {} -> '{}', rows: {}, duration: {} ms.", name(),
          spec.getSheetTab(), rows, elapsed);
      return SyncOutcome.succeeded(name(), rows, elapsed);
    } catch (Throwable th) { // Catching all, so one job never stops others.
      if (th instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      JobStage failedStage = stage;
      stage = JobStage.FAILED;
      long elapsed = elapsedMillis(started);
      logger.error("Error updating {} -> '{}' while {} after {} ms: {}",
          name(), spec.getSheetTab(), failedStage, elapsed, th.getMessage(),
          th);
      return SyncOutcome.failed(name(), failedStage, th, elapsed);
    }
  }

  /**
   * Job specific pipeline goes here.
   *
   * @return Number of data rows written.
   */
  protected abstract int startProcessing() throws Exception;

  /** Records that the pipeline moved on to the given stage. */
  protected final void enter(JobStage next) {
    logger.debug("Job {} is {}.", name(), next);
    this.stage = next;
  }

  public JobStage getStage() {
    return stage;
  }

  /** Returns the job name for logging purposes. */
  public String name() {
    return spec.getName();
  }

  private static long elapsedMillis(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }
}
