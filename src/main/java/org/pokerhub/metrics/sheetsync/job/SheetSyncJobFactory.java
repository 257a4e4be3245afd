/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.job;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;
import org.pokerhub.metrics.sheetsync.cron.SyncJob;
import org.pokerhub.metrics.sheetsync.cron.SyncJobFactory;
import org.pokerhub.metrics.sheetsync.destination.Destination;
import org.pokerhub.metrics.sheetsync.enrichment.EnrichmentFetcher;
import org.pokerhub.metrics.sheetsync.enrichment.EnrichmentMerger;
import org.pokerhub.metrics.sheetsync.history.EventHistoryMerger;
import org.pokerhub.metrics.sheetsync.retry.RetryPolicy;
import org.pokerhub.metrics.sheetsync.retry.Sleeper;
import org.pokerhub.metrics.sheetsync.source.SourceFactory;

import java.io.IOException;
import java.sql.SQLException;

/**
 * Holds the collaborators shared by all {@link SheetSyncJob}s and creates
 * a fresh job per spec and tick. All shared collaborators are safe for
 * concurrent use.
 */
public final class SheetSyncJobFactory implements SyncJobFactory {

  private final SourceFactory sources;

  private final Destination destination;

  private final EnrichmentFetcher enrichmentFetcher;

  private final EnrichmentMerger enrichmentMerger;

  private final EventHistoryMerger historyMerger;

  private final StatusLine statusLine;

  private final long fetchWarnMillis;

  private final long pacingDelayMillis;

  private final long pacingJitterMillis;

  private final Sleeper sleeper;

  private final RetryPolicy connectRetry;

  private final RetryPolicy writeRetry;

  private final RetryPolicy statusRetry;

  private SheetSyncJobFactory(Builder builder) {
    this.sources = builder.sources;
    this.destination = builder.destination;
    this.enrichmentFetcher = builder.enrichmentFetcher;
    this.enrichmentMerger = builder.enrichmentMerger;
    this.historyMerger = builder.historyMerger;
    this.statusLine = builder.statusLine;
    this.fetchWarnMillis = builder.fetchWarnMillis;
    this.pacingDelayMillis = builder.pacingDelayMillis;
    this.pacingJitterMillis = builder.pacingJitterMillis;
    this.sleeper = builder.sleeper;
    this.connectRetry = RetryPolicy.builder("source connect")
        .maxAttempts(3)
        .retryOn(SQLException.class, IOException.class)
        .sleeper(sleeper)
        .build();
    this.writeRetry = RetryPolicy.builder("destination write")
        .maxAttempts(5)
        .retryOn(IOException.class)
        .sleeper(sleeper)
        .build();
    this.statusRetry = RetryPolicy.builder("status write")
        .maxAttempts(3)
        .retryOn(IOException.class)
        .sleeper(sleeper)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public SyncJob create(JobSpec spec) {
    if (spec.isEnrich() && null == enrichmentFetcher) {
      throw new IllegalStateException("Job " + spec.getName()
          + " requests enrichment, but no partner service is configured.");
    }
    return new SheetSyncJob(spec, this);
  }

  SourceFactory sources() {
    return sources;
  }

  Destination destination() {
    return destination;
  }

  EnrichmentFetcher enrichmentFetcher() {
    return enrichmentFetcher;
  }

  EnrichmentMerger enrichmentMerger() {
    return enrichmentMerger;
  }

  EventHistoryMerger historyMerger() {
    return historyMerger;
  }

  StatusLine statusLine() {
    return statusLine;
  }

  long fetchWarnMillis() {
    return fetchWarnMillis;
  }

  long pacingDelayMillis() {
    return pacingDelayMillis;
  }

  long pacingJitterMillis() {
    return pacingJitterMillis;
  }

  Sleeper sleeper() {
    return sleeper;
  }

  RetryPolicy connectRetry() {
    return connectRetry;
  }

  RetryPolicy writeRetry() {
    return writeRetry;
  }

  RetryPolicy statusRetry() {
    return statusRetry;
  }

  /** Builder for {@link SheetSyncJobFactory}. */
  public static final class Builder {

    private SourceFactory sources;
    private Destination destination;
    private EnrichmentFetcher enrichmentFetcher;
    private EnrichmentMerger enrichmentMerger;
    private EventHistoryMerger historyMerger = new EventHistoryMerger();
    private StatusLine statusLine = new StatusLine("Europe/Moscow");
    private long fetchWarnMillis = 10_000L;
    private long pacingDelayMillis = 100L;
    private long pacingJitterMillis = 200L;
    private Sleeper sleeper = Sleeper.THREAD;

    private Builder() {
    }

    public Builder sources(SourceFactory sources) {
      this.sources = sources;
      return this;
    }

    public Builder destination(Destination destination) {
      this.destination = destination;
      return this;
    }

    /** Partner access; may stay unset if no job enriches. */
    public Builder enrichment(EnrichmentFetcher fetcher,
        EnrichmentMerger merger) {
      this.enrichmentFetcher = fetcher;
      this.enrichmentMerger = merger;
      return this;
    }

    public Builder historyMerger(EventHistoryMerger historyMerger) {
      this.historyMerger = historyMerger;
      return this;
    }

    public Builder statusLine(StatusLine statusLine) {
      this.statusLine = statusLine;
      return this;
    }

    public Builder fetchWarnMillis(long fetchWarnMillis) {
      this.fetchWarnMillis = fetchWarnMillis;
      return this;
    }

    /** Pause after each job: the delay plus up to the jitter. */
    public Builder pacing(long delayMillis, long jitterMillis) {
      this.pacingDelayMillis = delayMillis;
      this.pacingJitterMillis = jitterMillis;
      return this;
    }

    /** Sleeper for retry backoff and pacing. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Creates the factory.
     *
     * @throws IllegalStateException if the source factory or the
     *     destination is missing.
     */
    public SheetSyncJobFactory build() {
      if (null == sources || null == destination) {
        throw new IllegalStateException("Sources and destination required.");
      }
      return new SheetSyncJobFactory(this);
    }
  }
}
