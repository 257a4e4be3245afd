/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.conf;

import org.pokerhub.metrics.sheetsync.destination.ColumnRange;
import org.pokerhub.metrics.sheetsync.source.SourceSettings;
import org.pokerhub.metrics.sheetsync.source.TunnelSettings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the list of {@link JobSpec}s from the {@code Jobs} property and the
 * per-job properties. All validation happens here, so that a malformed
 * configuration stops the process before anything is synchronized.
 */
public class JobSpecLoader {

  private static final Logger logger =
      LoggerFactory.getLogger(JobSpecLoader.class);

  /** Query used for jobs that do not configure their own. */
  public static final String STANDARD_QUERY =
      "SELECT id, username, first_name, last_name, "
      + "DATE(timestamp_registration) AS date_registration, "
      + "CASE WHEN user_block THEN 'Да' ELSE 'Нет' END AS user_block, "
      + "source, campaign, content, medium, term, raw_link "
      + "FROM users "
      + "LEFT JOIN lead_resources ON users.id = lead_resources.user_id";

  private final Configuration config;

  public JobSpecLoader(Configuration config) {
    this.config = config;
  }

  /**
   * Returns one spec per configured job, in configuration order.
   *
   * @throws ConfigurationException if any job is incomplete or malformed.
   */
  public List<JobSpec> loadAll() throws ConfigurationException {
    if (!config.isSet(Key.Jobs)) {
      throw new ConfigurationException("No jobs configured in '"
          + Key.Jobs + "'.");
    }
    Set<String> names = new LinkedHashSet<>();
    for (String name : config.getStringArray(Key.Jobs)) {
      if (name.isEmpty()) {
        continue;
      }
      if (!names.add(name)) {
        throw new ConfigurationException("Job '" + name
            + "' is listed twice.");
      }
    }
    if (names.isEmpty()) {
      throw new ConfigurationException("No jobs configured in '"
          + Key.Jobs + "'.");
    }
    List<JobSpec> specs = new ArrayList<>();
    for (String name : names) {
      specs.add(load(name));
    }
    logger.info("Loaded {} job definitions.", specs.size());
    return Collections.unmodifiableList(specs);
  }

  JobSpec load(String name) throws ConfigurationException {
    String database = required(name, JobKey.Database);
    String sheetTab = required(name, JobKey.SheetTab);
    boolean enrich = config.getJobBool(name, JobKey.Enrich);
    String rangeText = enrich ? JobKey.ENRICHED_COLUMN_RANGE
        : config.getJobString(name, JobKey.ColumnRange);
    ColumnRange columnRange;
    try {
      columnRange = ColumnRange.parse(rangeText);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Corrupt property: "
          + JobKey.ColumnRange.propertyName(name) + " reason: "
          + e.getMessage(), e);
    }
    int startRow = config.getJobInt(name, JobKey.StartRow);
    if (startRow < 1) {
      throw new ConfigurationException("Corrupt property: "
          + JobKey.StartRow.propertyName(name)
          + " reason: must be at least 1.");
    }
    if (enrich && !config.isSet(Key.PartnerApiUrl)) {
      throw new ConfigurationException("Job '" + name + "' requests "
          + "enrichment, but '" + Key.PartnerApiUrl + "' is not set.");
    }
    String query = config.getJobString(name, JobKey.Query);
    if (null == query || query.isEmpty()) {
      query = config.isSet(Key.DatabaseQuery)
          ? config.getString(Key.DatabaseQuery) : STANDARD_QUERY;
    }
    SourceSettings source = new SourceSettings(
        config.getString(Key.DatabaseHost), config.getInt(Key.DatabasePort),
        database, config.getString(Key.DatabaseUser),
        config.getString(Key.DatabasePassword), query,
        config.getInt(Key.DatabaseConnectTimeoutSeconds));
    TunnelSettings tunnel = null;
    if (config.getJobBool(name, JobKey.UseTunnel)) {
      if (!config.isSet(Key.SshHost) || !config.isSet(Key.SshUser)) {
        throw new ConfigurationException("Job '" + name + "' requires an "
            + "SSH tunnel, but '" + Key.SshHost + "' or '" + Key.SshUser
            + "' is not set.");
      }
      tunnel = new TunnelSettings(config.getString(Key.SshHost),
          config.getInt(Key.SshPort), config.getString(Key.SshUser),
          config.getString(Key.SshPassword));
    }
    return JobSpec.builder(name)
        .source(source)
        .tunnel(tunnel)
        .sheetTab(sheetTab)
        .columnRange(columnRange)
        .startRow(startRow)
        .clearTail(config.getJobBool(name, JobKey.ClearTail))
        .enrich(enrich)
        .build();
  }

  private String required(String name, JobKey key)
      throws ConfigurationException {
    String value = config.getJobString(name, key);
    if (null == value || value.isEmpty()) {
      throw new ConfigurationException("Missing property: "
          + key.propertyName(name));
    }
    return value;
  }
}
