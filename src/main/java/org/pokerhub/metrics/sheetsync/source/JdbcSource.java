/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.pokerhub.metrics.sheetsync.history.HistoryEvent;
import org.pokerhub.metrics.sheetsync.history.StateRow;

import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * PostgreSQL source, optionally reached through a {@link Tunnel}.
 *
 * <p>History events are read from {@code funnel_history}, current-state
 * candidates from {@code user_funnel}. Temporal values are converted to
 * {@code java.time} types.</p>
 */
public class JdbcSource implements Source {

  private static final Logger logger =
      LoggerFactory.getLogger(JdbcSource.class);

  static final String HISTORY_QUERY = "SELECT user_id, label, datetime "
      + "FROM funnel_history WHERE user_id = ANY(?) ORDER BY datetime";

  static final String STATE_QUERY = "SELECT DISTINCT ON (user_id) "
      + "user_id, label, datetime FROM user_funnel WHERE user_id = ANY(?) "
      + "ORDER BY user_id, datetime DESC NULLS LAST";

  private static final String LOOPBACK = "127.0.0.1";

  private final SourceSettings settings;

  private final TunnelSettings tunnelSettings;

  private final TunnelFactory tunnelFactory;

  private Tunnel tunnel;

  private int tunnelPort;

  private Connection connection;

  /**
   * Creates an unconnected source.
   *
   * @param tunnelSettings Hop to use, or {@code null} for a direct
   *     connection.
   */
  public JdbcSource(SourceSettings settings, TunnelSettings tunnelSettings,
      TunnelFactory tunnelFactory) {
    this.settings = settings;
    this.tunnelSettings = tunnelSettings;
    this.tunnelFactory = tunnelFactory;
  }

  @Override
  public synchronized void connect() throws SQLException, IOException {
    if (null != connection && !connection.isClosed()) {
      return;
    }
    String host = settings.getHost();
    int port = settings.getPort();
    if (null != tunnelSettings) {
      if (null == tunnel) {
        Tunnel opening = tunnelFactory.create(tunnelSettings);
        tunnelPort = opening.open(host, port);
        tunnel = opening;
        logger.info("Tunnel via {} forwards local port {} to {}:{}.",
            tunnelSettings.getHost(), tunnelPort, host, port);
      }
      host = LOOPBACK;
      port = tunnelPort;
    }
    PGSimpleDataSource dataSource = new PGSimpleDataSource();
    dataSource.setServerNames(new String[] {host});
    dataSource.setPortNumbers(new int[] {port});
    dataSource.setDatabaseName(settings.getDatabase());
    dataSource.setUser(settings.getUser());
    dataSource.setPassword(settings.getPassword());
    dataSource.setConnectTimeout(settings.getConnectTimeoutSeconds());
    dataSource.setApplicationName("sheetsync");
    connection = dataSource.getConnection();
    connection.setReadOnly(true);
    logger.debug("Connected to database '{}' at {}:{}.",
        settings.getDatabase(), host, port);
  }

  @Override
  public RowSet fetch(String query) throws SQLException {
    try (Statement statement = connection().createStatement();
        ResultSet rs = statement.executeQuery(query)) {
      ResultSetMetaData meta = rs.getMetaData();
      int columns = meta.getColumnCount();
      List<String> header = new ArrayList<>(columns);
      for (int i = 1; i <= columns; i++) {
        header.add(meta.getColumnLabel(i));
      }
      List<List<Object>> rows = new ArrayList<>();
      while (rs.next()) {
        List<Object> row = new ArrayList<>(columns);
        for (int i = 1; i <= columns; i++) {
          row.add(toJava(rs.getObject(i)));
        }
        rows.add(row);
      }
      return new RowSet(header, rows);
    }
  }

  @Override
  public List<HistoryEvent> fetchHistory(Collection<Long> subjectIds)
      throws SQLException {
    if (subjectIds.isEmpty()) {
      return Collections.emptyList();
    }
    List<HistoryEvent> events = new ArrayList<>();
    try (PreparedStatement ps = prepareForIds(HISTORY_QUERY, subjectIds);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        LocalDateTime timestamp = localDateTime(rs.getTimestamp(3));
        if (null == timestamp) {
          logger.debug("Skipping undated history event of subject {}.",
              rs.getLong(1));
          continue;
        }
        events.add(new HistoryEvent(rs.getLong(1), rs.getString(2),
            timestamp));
      }
    }
    return events;
  }

  @Override
  public List<StateRow> fetchStates(Collection<Long> subjectIds)
      throws SQLException {
    if (subjectIds.isEmpty()) {
      return Collections.emptyList();
    }
    List<StateRow> states = new ArrayList<>();
    try (PreparedStatement ps = prepareForIds(STATE_QUERY, subjectIds);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        states.add(new StateRow(rs.getLong(1), rs.getString(2),
            localDateTime(rs.getTimestamp(3))));
      }
    }
    return states;
  }

  private PreparedStatement prepareForIds(String sql,
      Collection<Long> subjectIds) throws SQLException {
    Connection conn = connection();
    Array ids = conn.createArrayOf("bigint", subjectIds.toArray());
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      ps.setArray(1, ids);
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
    return ps;
  }

  private synchronized Connection connection() throws SQLException {
    if (null == connection) {
      throw new SQLException("Source is not connected.");
    }
    return connection;
  }

  @Override
  public synchronized void disconnect() {
    if (null != connection) {
      try {
        connection.close();
      } catch (SQLException e) {
        logger.warn("Cannot close connection to database '{}'.",
            settings.getDatabase(), e);
      }
      connection = null;
    }
    if (null != tunnel) {
      tunnel.close();
      tunnel = null;
    }
  }

  /** Converts JDBC temporal values to {@code java.time} values. */
  static Object toJava(Object value) {
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime();
    } else if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate();
    } else if (value instanceof java.sql.Time) {
      return ((java.sql.Time) value).toLocalTime();
    }
    return value;
  }

  private static LocalDateTime localDateTime(Timestamp timestamp) {
    return null == timestamp ? null : timestamp.toLocalDateTime();
  }
}
