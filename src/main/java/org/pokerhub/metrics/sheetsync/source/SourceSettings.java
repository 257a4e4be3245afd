/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

/**
 * Connection parameters and primary query of one relational source.
 */
public final class SourceSettings {

  private final String host;

  private final int port;

  private final String database;

  private final String user;

  private final String password;

  private final String query;

  private final int connectTimeoutSeconds;

  /** Creates immutable source settings. */
  public SourceSettings(String host, int port, String database, String user,
      String password, String query, int connectTimeoutSeconds) {
    this.host = host;
    this.port = port;
    this.database = database;
    this.user = user;
    this.password = password;
    this.query = query;
    this.connectTimeoutSeconds = connectTimeoutSeconds;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getDatabase() {
    return database;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public String getQuery() {
    return query;
  }

  public int getConnectTimeoutSeconds() {
    return connectTimeoutSeconds;
  }

  @Override
  public String toString() {
    return database + "@" + host + ":" + port;
  }
}
