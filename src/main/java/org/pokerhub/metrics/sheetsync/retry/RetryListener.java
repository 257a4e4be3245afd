/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

/**
 * Observer notified before every retry.
 */
@FunctionalInterface
public interface RetryListener {

  /**
   * Called after a failed attempt, before sleeping.
   *
   * @param attempt Number of the attempt that just failed, starting at 1.
   * @param delayMillis Delay before the next attempt.
   * @param error Error of the failed attempt.
   */
  void onRetry(int attempt, long delayMillis, Exception error);

}
