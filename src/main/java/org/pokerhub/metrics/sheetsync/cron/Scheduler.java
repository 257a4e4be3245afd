/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;
import org.pokerhub.metrics.sheetsync.retry.Operation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler that runs all configured jobs concurrently, once right away
 * and then after every interval, until shutdown is requested.
 *
 * <p>A failed job is logged with its identity and error but neither stops
 * its siblings nor the loop. Shutdown interrupts the wait between ticks at
 * once, lets the running tick finish, and starts no further tick.</p>
 */
public final class Scheduler implements ThreadFactory {

  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  static final long SLOW_ITERATION_MILLIS = 60_000L;

  private final ThreadFactory threads = Executors.defaultThreadFactory();

  private final AtomicInteger currentThreadNo = new AtomicInteger();

  private final List<JobSpec> specs;

  private final SyncJobFactory jobFactory;

  private final long intervalMillis;

  private final boolean runOnce;

  private final long gracePeriodMinutes;

  private final ExecutorService workers = Executors.newCachedThreadPool(this);

  private final CountDownLatch shutdownRequested = new CountDownLatch(1);

  private final CountDownLatch stopped = new CountDownLatch(1);

  private final AtomicInteger iterations = new AtomicInteger();

  private volatile SchedulerState state = SchedulerState.INITIALIZING;

  private volatile boolean loopStarted;

  /**
   * Creates a scheduler.
   *
   * @param intervalMillis Wait between the end of one tick and the start
   *     of the next one.
   * @param runOnce Whether to stop after the first tick.
   * @param gracePeriodMinutes How long shutdown waits for a running tick.
   */
  public Scheduler(List<JobSpec> specs, SyncJobFactory jobFactory,
      long intervalMillis, boolean runOnce, long gracePeriodMinutes) {
    this.specs = Collections.unmodifiableList(new ArrayList<>(specs));
    this.jobFactory = jobFactory;
    this.intervalMillis = intervalMillis;
    this.runOnce = runOnce;
    this.gracePeriodMinutes = gracePeriodMinutes;
  }

  /**
   * Runs the initializer, for example connecting the shared destination,
   * and then starts the loop on its own thread.
   *
   * @throws Exception Error of the initializer; the scheduler is stopped
   *     then.
   */
  public void start(Operation<?> initializer) throws Exception {
    if (SchedulerState.INITIALIZING != state) {
      throw new IllegalStateException("Scheduler is " + state + ".");
    }
    logger.info("Scheduler initializing with {} jobs.", specs.size());
    try {
      initializer.call();
    } catch (Exception e) {
      stop();
      throw e;
    }
    synchronized (this) {
      if (SchedulerState.INITIALIZING != state) {
        stop();
        return;
      }
      state = SchedulerState.RUNNING;
    }
    Thread loop = new Thread(this::loop, "SheetSync-Scheduler");
    loopStarted = true;
    loop.start();
  }

  private void loop() {
    try {
      logger.info("Entering update loop. Interval: {} minutes{}.",
          intervalMillis / 60_000L, runOnce ? " (single run)" : "");
      while (!isShutdownRequested()) {
        runIteration();
        if (runOnce || shutdownRequested.await(intervalMillis,
            TimeUnit.MILLISECONDS)) {
          break;
        }
      }
    } catch (InterruptedException e) {
      logger.warn("Scheduler loop interrupted.");
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      logger.error("Scheduler loop failed: {}", e.getMessage(), e);
    } finally {
      stop();
    }
  }

  /**
   * Runs all jobs concurrently and waits for all of them.
   *
   * @return One outcome per job, in configuration order.
   */
  public List<SyncOutcome> runIteration() throws InterruptedException {
    int iteration = iterations.incrementAndGet();
    long started = System.nanoTime();
    logger.info("Starting iteration {} with {} concurrent jobs.", iteration,
        specs.size());
    List<Callable<SyncOutcome>> jobs = new ArrayList<>();
    for (JobSpec spec : specs) {
      jobs.add(createJob(spec));
    }
    List<Future<SyncOutcome>> futures = workers.invokeAll(jobs);
    List<SyncOutcome> outcomes = new ArrayList<>();
    int failed = 0;
    for (int i = 0; i < futures.size(); i++) {
      SyncOutcome outcome = outcomeOf(specs.get(i), futures.get(i));
      if (!outcome.isSuccess()) {
        failed++;
        logger.error("Error updating {} -> '{}': {}", outcome.getJobName(),
            specs.get(i).getSheetTab(), outcome.getError().getMessage());
      }
      outcomes.add(outcome);
    }
    long elapsed = (System.nanoTime() - started) / 1_000_000L;
    if (elapsed > SLOW_ITERATION_MILLIS) {
      logger.warn("Iteration {} took {} ms (threshold: {} ms).", iteration,
          elapsed, SLOW_ITERATION_MILLIS);
    }
    logger.info("Iteration {} finished in {} ms: {} succeeded, {} failed.",
        iteration, elapsed, outcomes.size() - failed, failed);
    return outcomes;
  }

  private Callable<SyncOutcome> createJob(JobSpec spec) {
    try {
      return jobFactory.create(spec);
    } catch (RuntimeException e) {
      return () -> SyncOutcome.failed(spec.getName(), JobStage.IDLE, e, 0L);
    }
  }

  private static SyncOutcome outcomeOf(JobSpec spec,
      Future<SyncOutcome> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      return SyncOutcome.failed(spec.getName(), JobStage.FAILED,
          e.getCause(), 0L);
    } catch (CancellationException e) {
      return SyncOutcome.failed(spec.getName(), JobStage.FAILED, e, 0L);
    }
  }

  /**
   * Stops scheduling new ticks and wakes up the loop if it is waiting.
   */
  public synchronized void requestShutdown() {
    if (SchedulerState.STOPPED != state) {
      state = SchedulerState.SHUTTING_DOWN;
    }
    shutdownRequested.countDown();
  }

  public boolean isShutdownRequested() {
    return shutdownRequested.getCount() == 0;
  }

  /** Waits until the scheduler has stopped. */
  public void awaitStopped() throws InterruptedException {
    stopped.await();
  }

  /**
   * Waits at most the given time until the scheduler has stopped.
   *
   * @return Whether the scheduler stopped in time.
   */
  public boolean awaitStopped(long timeout, TimeUnit unit)
      throws InterruptedException {
    return stopped.await(timeout, unit);
  }

  /**
   * Try to shutdown smoothly, i.e., wait for running jobs to terminate.
   */
  public void shutdownScheduler() {
    requestShutdown();
    if (!loopStarted) {
      stop();
      return;
    }
    try {
      logger.info("Waiting at most {} minutes for termination "
          + "of running jobs ... ", gracePeriodMinutes);
      if (awaitStopped(gracePeriodMinutes, TimeUnit.MINUTES)) {
        logger.info("Shutdown of all jobs completed successfully.");
      } else {
        List<Runnable> notTerminated = workers.shutdownNow();
        logger.error("Regular shutdown failed; interrupted running jobs, "
            + "{} never started.", notTerminated.size());
      }
    } catch (InterruptedException ie) {
      workers.shutdownNow();
      logger.error("Interrupted while waiting for running jobs.");
      Thread.currentThread().interrupt();
    }
  }

  private synchronized void stop() {
    if (0 == stopped.getCount()) {
      return;
    }
    workers.shutdown();
    state = SchedulerState.STOPPED;
    stopped.countDown();
    logger.info("Scheduler stopped after {} iterations.", iterations.get());
  }

  public SchedulerState getState() {
    return state;
  }

  public int getIterations() {
    return iterations.get();
  }

  /**
   * Provide a nice name for debugging and log thread creation.
   */
  @Override
  public Thread newThread(Runnable runner) {
    Thread newThread = threads.newThread(runner);
    newThread.setDaemon(true);
    newThread.setName("SheetSync-Worker-Thread-"
        + currentThreadNo.incrementAndGet());
    logger.debug("New Thread created: {}", newThread.getName());
    return newThread;
  }
}
