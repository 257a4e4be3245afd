/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retries with exponential backoff and uniform random jitter.
 *
 * <p>Only errors that are instances of one of the configured retryable
 * classes trigger another attempt; all other errors propagate at once.
 * After the last attempt the error propagates as well, unless the policy
 * was built with {@link Builder#nonRaising()}, in which case the error is
 * logged and {@code null} is returned.</p>
 *
 * <p>The delay before attempt {@code n + 1} is
 * {@code baseDelay * multiplier^(n - 1) + uniform(0, maxJitter)}.</p>
 */
public final class RetryPolicy {

  private static final Logger logger =
      LoggerFactory.getLogger(RetryPolicy.class);

  private final String name;

  private final int maxAttempts;

  private final long baseDelayMillis;

  private final double multiplier;

  private final long maxJitterMillis;

  private final List<Class<? extends Exception>> retryOn;

  private final RetryListener listener;

  private final boolean raising;

  private final Sleeper sleeper;

  private RetryPolicy(Builder builder) {
    this.name = builder.name;
    this.maxAttempts = builder.maxAttempts;
    this.baseDelayMillis = builder.baseDelayMillis;
    this.multiplier = builder.multiplier;
    this.maxJitterMillis = builder.maxJitterMillis;
    this.retryOn = Collections.unmodifiableList(
        new ArrayList<>(builder.retryOn));
    this.listener = builder.listener;
    this.raising = builder.raising;
    this.sleeper = builder.sleeper;
  }

  /**
   * Starts a policy for the operation with the given name. Defaults: three
   * attempts, 1 s base delay, multiplier 2, up to 500 ms jitter, retry on
   * any {@link Exception}.
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Backoff before the attempt following the given failed attempt, without
   * jitter.
   *
   * @param attempt Failed attempt, starting at 1.
   */
  public long backoffMillis(int attempt) {
    return (long) (baseDelayMillis * Math.pow(multiplier, attempt - 1));
  }

  /** Backoff plus a fresh jitter sample. */
  public long delayMillis(int attempt) {
    long jitter = maxJitterMillis > 0L
        ? ThreadLocalRandom.current().nextLong(maxJitterMillis + 1L) : 0L;
    return backoffMillis(attempt) + jitter;
  }

  /**
   * Runs the operation until it succeeds, raises a non-retryable error, or
   * runs out of attempts.
   *
   * @return Result of the first successful attempt, or {@code null} if all
   *     attempts failed and this policy does not raise.
   * @throws Exception Error of a non-retryable failure, or the last error
   *     once all attempts are used up.
   */
  public <T> T call(Operation<T> operation) throws Exception {
    int attempt = 0;
    while (true) {
      try {
        return operation.call();
      } catch (Exception e) {
        if (!isRetryable(e)) {
          throw e;
        }
        attempt++;
        if (attempt >= maxAttempts) {
          logger.error("'{}' failed after {} attempts: {}", name, maxAttempts,
              e.getMessage());
          if (raising) {
            throw e;
          }
          return null;
        }
        long delay = delayMillis(attempt);
        logger.warn("'{}' failed (attempt {}/{}). Retrying in {} ms... "
            + "Error: {}", name, attempt, maxAttempts, delay, e.getMessage());
        if (null != listener) {
          listener.onRetry(attempt, delay, e);
        }
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw ie;
        }
      }
    }
  }

  /** Returns an operation that runs the given one under this policy. */
  public <T> Operation<T> wrap(Operation<T> operation) {
    return () -> call(operation);
  }

  private boolean isRetryable(Exception error) {
    if (error instanceof InterruptedException) {
      return false;
    }
    for (Class<? extends Exception> clazz : retryOn) {
      if (clazz.isInstance(error)) {
        return true;
      }
    }
    return false;
  }

  /** Builder for {@link RetryPolicy}. */
  public static final class Builder {

    private final String name;
    private int maxAttempts = 3;
    private long baseDelayMillis = 1000L;
    private double multiplier = 2.0;
    private long maxJitterMillis = 500L;
    private List<Class<? extends Exception>> retryOn =
        Collections.<Class<? extends Exception>>singletonList(Exception.class);
    private RetryListener listener;
    private boolean raising = true;
    private Sleeper sleeper = Sleeper.THREAD;

    private Builder(String name) {
      this.name = name;
    }

    /** Total number of attempts, including the first one. */
    public Builder maxAttempts(int maxAttempts) {
      if (maxAttempts < 1) {
        throw new IllegalArgumentException("At least one attempt required.");
      }
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder baseDelayMillis(long baseDelayMillis) {
      this.baseDelayMillis = baseDelayMillis;
      return this;
    }

    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    public Builder maxJitterMillis(long maxJitterMillis) {
      this.maxJitterMillis = maxJitterMillis;
      return this;
    }

    /** Error classes that trigger a retry; replaces the default. */
    @SafeVarargs
    public final Builder retryOn(Class<? extends Exception>... classes) {
      this.retryOn = Arrays.asList(classes);
      return this;
    }

    public Builder listener(RetryListener listener) {
      this.listener = listener;
      return this;
    }

    /** Return {@code null} instead of raising once attempts run out. */
    public Builder nonRaising() {
      this.raising = false;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryPolicy build() {
      return new RetryPolicy(this);
    }
  }
}
