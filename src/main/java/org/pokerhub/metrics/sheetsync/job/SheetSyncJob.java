/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.job;

import org.pokerhub.metrics.sheetsync.conf.JobSpec;
import org.pokerhub.metrics.sheetsync.cron.JobStage;
import org.pokerhub.metrics.sheetsync.cron.SyncJob;
import org.pokerhub.metrics.sheetsync.destination.CellFormatter;
import org.pokerhub.metrics.sheetsync.enrichment.EnrichmentRecord;
import org.pokerhub.metrics.sheetsync.history.HistoryEvent;
import org.pokerhub.metrics.sheetsync.history.HistoryFormatter;
import org.pokerhub.metrics.sheetsync.history.StateRow;
import org.pokerhub.metrics.sheetsync.history.SubjectState;
import org.pokerhub.metrics.sheetsync.retry.Operations;
import org.pokerhub.metrics.sheetsync.source.RowSet;
import org.pokerhub.metrics.sheetsync.source.Source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Synchronizes one relational source into one spreadsheet tab: connect,
 * fetch, merge the event history, enrich if requested, write, and report
 * the status.
 */
public class SheetSyncJob extends SyncJob {

  private static final Logger logger =
      LoggerFactory.getLogger(SheetSyncJob.class);

  /** Derived columns appended to every fetched row. */
  public static final List<String> HISTORY_COLUMNS = Collections
      .unmodifiableList(Arrays.asList("funnel_history", "last_action_date",
          "max_funnel_action"));

  private final SheetSyncJobFactory context;

  SheetSyncJob(JobSpec spec, SheetSyncJobFactory context) {
    super(spec);
    this.context = context;
  }

  @Override
  protected int startProcessing() throws Exception {
    RowSet rows = fetchAndMerge();
    if (spec.isEnrich()) {
      rows = enrich(rows);
    }
    enter(JobStage.WRITING);
    List<List<String>> grid = CellFormatter.toGrid(rows,
        spec.getColumnRange().width());
    context.writeRetry().call(Operations.logged("write " + name(), () -> {
      context.destination().write(spec.getSheetTab(), grid,
          spec.getStartRow(), spec.getColumnRange(), spec.isClearTail());
      return null;
    }));
    enter(JobStage.REPORTING_STATUS);
    String status = context.statusLine().format(spec.getSheetTab(),
        rows.size());
    context.statusRetry().call(() -> {
      context.destination().writeStatus(spec.getSheetTab(), status);
      return null;
    });
    pace();
    return rows.size();
  }

  /** Lead rows with the raw history of their subjects. */
  private static final class Fetched {

    private final RowSet primary;

    private final List<Long> subjectIds;

    private final List<HistoryEvent> events;

    private final List<StateRow> states;

    private Fetched(RowSet primary, List<Long> subjectIds,
        List<HistoryEvent> events, List<StateRow> states) {
      this.primary = primary;
      this.subjectIds = subjectIds;
      this.events = events;
      this.states = states;
    }
  }

  private RowSet fetchAndMerge() throws Exception {
    Source source = context.sources().create(spec);
    Fetched fetched;
    try {
      enter(JobStage.CONNECTING);
      context.connectRetry().call(() -> {
        source.connect();
        return null;
      });
      enter(JobStage.FETCHING);
      fetched = Operations.timed("fetch " + name(),
          context.fetchWarnMillis(), () -> fetch(source)).call();
    } finally {
      source.disconnect();
    }
    enter(JobStage.MERGING);
    Map<Long, SubjectState> merged = context.historyMerger().merge(
        fetched.subjectIds, fetched.events, fetched.states);
    return appendHistory(fetched.primary, merged);
  }

  private Fetched fetch(Source source) throws SQLException {
    RowSet primary = source.fetch(spec.getSource().getQuery());
    List<Long> subjectIds = primary.subjectIds();
    List<HistoryEvent> events = source.fetchHistory(subjectIds);
    List<StateRow> states = source.fetchStates(subjectIds);
    logger.debug("Fetched {} rows, {} history events and {} states for {}.",
        primary.size(), events.size(), states.size(), name());
    return new Fetched(primary, subjectIds, events, states);
  }

  static RowSet appendHistory(RowSet primary,
      Map<Long, SubjectState> states) {
    List<String> header = new ArrayList<>(primary.getHeader());
    header.addAll(HISTORY_COLUMNS);
    List<List<Object>> rows = new ArrayList<>(primary.size());
    for (List<Object> row : primary.getRows()) {
      Long subjectId = row.isEmpty() ? null : RowSet.subjectId(row.get(0));
      SubjectState state = null == subjectId ? null : states.get(subjectId);
      if (null == state) {
        state = SubjectState.empty(null == subjectId ? 0L : subjectId);
      }
      List<Object> extended = new ArrayList<>(row);
      extended.add(HistoryFormatter.format(state));
      extended.add(state.getLastEventTime());
      extended.add(state.getCurrentLabel());
      rows.add(extended);
    }
    return new RowSet(header, rows);
  }

  private RowSet enrich(RowSet rows) throws InterruptedException {
    List<Long> subjectIds = rows.subjectIds();
    if (subjectIds.isEmpty()) {
      logger.warn("No subject ids to enrich for {}.", name());
      return rows;
    }
    enter(JobStage.ENRICHING);
    List<EnrichmentRecord> records = context.enrichmentFetcher()
        .fetch(subjectIds);
    if (records.isEmpty()) {
      logger.warn("No partner data for {}.", name());
    }
    return context.enrichmentMerger().enrich(rows, records,
        spec.getColumnRange().width());
  }

  private void pace() throws InterruptedException {
    long jitter = context.pacingJitterMillis() > 0
        ? ThreadLocalRandom.current().nextLong(
            context.pacingJitterMillis() + 1L) : 0L;
    context.sleeper().sleep(context.pacingDelayMillis() + jitter);
  }
}
