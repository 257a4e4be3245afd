/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

/**
 * Result of one job in one tick.
 */
public final class SyncOutcome {

  private final String jobName;

  private final int rowCount;

  private final Throwable error;

  private final JobStage failedStage;

  private final long durationMillis;

  private SyncOutcome(String jobName, int rowCount, Throwable error,
      JobStage failedStage, long durationMillis) {
    this.jobName = jobName;
    this.rowCount = rowCount;
    this.error = error;
    this.failedStage = failedStage;
    this.durationMillis = durationMillis;
  }

  /** Outcome of a job that wrote the given number of rows. */
  public static SyncOutcome succeeded(String jobName, int rowCount,
      long durationMillis) {
    return new SyncOutcome(jobName, rowCount, null, null, durationMillis);
  }

  /** Outcome of a job that failed in the given stage. */
  public static SyncOutcome failed(String jobName, JobStage failedStage,
      Throwable error, long durationMillis) {
    return new SyncOutcome(jobName, 0, error, failedStage, durationMillis);
  }

  public String getJobName() {
    return jobName;
  }

  public int getRowCount() {
    return rowCount;
  }

  /** Error that ended the job, or {@code null} on success. */
  public Throwable getError() {
    return error;
  }

  /** Stage the job failed in, or {@code null} on success. */
  public JobStage getFailedStage() {
    return failedStage;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public boolean isSuccess() {
    return null == error;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? jobName + ": " + rowCount + " rows in " + durationMillis + " ms"
        : jobName + ": failed while " + failedStage + " after "
            + durationMillis + " ms: " + error;
  }
}
