/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timing and logging wrappers around {@link Operation}s.
 */
public final class Operations {

  private static final Logger logger =
      LoggerFactory.getLogger(Operations.class);

  private Operations() {}

  /**
   * Measures the given operation and logs a warning if it takes longer than
   * the threshold. Never fails because of slowness.
   */
  public static <T> Operation<T> timed(String name, long warnMillis,
      Operation<T> operation) {
    return () -> {
      long started = System.nanoTime();
      try {
        return operation.call();
      } finally {
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;
        if (warnMillis > 0L && elapsedMillis > warnMillis) {
          logger.warn("'{}' took {} ms (threshold: {} ms)", name,
              elapsedMillis, warnMillis);
        } else {
          logger.debug("'{}' took {} ms", name, elapsedMillis);
        }
      }
    };
  }

  /**
   * Logs start, completion and failure of the given operation at debug
   * level; failures are rethrown.
   */
  public static <T> Operation<T> logged(String name, Operation<T> operation) {
    return () -> {
      logger.debug("Executing '{}'...", name);
      try {
        T result = operation.call();
        logger.debug("'{}' completed successfully", name);
        return result;
      } catch (Exception e) {
        logger.debug("'{}' failed with error: {}", name, e.getMessage());
        throw e;
      }
    };
  }
}
