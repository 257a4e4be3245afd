/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import org.pokerhub.metrics.sheetsync.retry.RetryPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shards subject ids into fixed-size batches and fetches them concurrently,
 * with a bounded number of requests in flight across all jobs.
 *
 * <p>Each batch is retried on transport errors. A batch that still fails
 * is logged and skipped, so the affected subjects are written without
 * partner data.</p>
 */
public class EnrichmentFetcher implements AutoCloseable {

  private static final Logger logger =
      LoggerFactory.getLogger(EnrichmentFetcher.class);

  private final EnrichmentService service;

  private final int batchSize;

  private final RetryPolicy batchRetry;

  private final ExecutorService executor;

  /**
   * Creates a fetcher.
   *
   * @param maxConnections Upper bound of concurrent requests.
   */
  public EnrichmentFetcher(EnrichmentService service, int batchSize,
      int maxConnections, RetryPolicy batchRetry) {
    if (batchSize < 1 || maxConnections < 1) {
      throw new IllegalArgumentException("Batch size and connection count "
          + "must be positive.");
    }
    this.service = service;
    this.batchSize = batchSize;
    this.batchRetry = batchRetry;
    AtomicInteger threadNumber = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(maxConnections, runnable -> {
      Thread thread = new Thread(runnable,
          "SheetSync-Partner-Thread-" + threadNumber.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /** Default per-batch retry: three attempts, 2 s base delay. */
  public static RetryPolicy defaultBatchRetry() {
    return RetryPolicy.builder("partner batch")
        .maxAttempts(3)
        .baseDelayMillis(2000L)
        .retryOn(IOException.class)
        .build();
  }

  /**
   * Fetches the records of all given subject ids. Records of failed
   * batches are missing from the result.
   */
  public List<EnrichmentRecord> fetch(List<Long> subjectIds)
      throws InterruptedException {
    List<List<Long>> batches = new ArrayList<>();
    for (int i = 0; i < subjectIds.size(); i += batchSize) {
      batches.add(new ArrayList<>(subjectIds.subList(i,
          Math.min(i + batchSize, subjectIds.size()))));
    }
    List<Future<List<EnrichmentRecord>>> futures = new ArrayList<>();
    for (List<Long> batch : batches) {
      futures.add(executor.submit(
          () -> batchRetry.call(() -> service.fetchRecords(batch))));
    }
    List<EnrichmentRecord> records = new ArrayList<>();
    int failed = 0;
    try {
      for (int i = 0; i < futures.size(); i++) {
        try {
          List<EnrichmentRecord> batchRecords = futures.get(i).get();
          if (null != batchRecords) {
            records.addAll(batchRecords);
          }
        } catch (ExecutionException e) {
          failed++;
          logger.error("Partner batch {}/{} ({} ids) failed, skipping it: "
              + "{}", i + 1, batches.size(), batches.get(i).size(),
              e.getCause().getMessage(), e.getCause());
        }
      }
    } catch (InterruptedException e) {
      for (Future<?> future : futures) {
        future.cancel(true);
      }
      throw e;
    }
    logger.info("Fetched {} partner records in {} batches ({} failed).",
        records.size(), batches.size(), failed);
    return records;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
