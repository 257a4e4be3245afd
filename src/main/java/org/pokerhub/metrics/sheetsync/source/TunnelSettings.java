/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

/**
 * Credentials of the SSH hop in front of a source that is not directly
 * reachable.
 */
public final class TunnelSettings {

  private final String host;

  private final int port;

  private final String user;

  private final String password;

  /** Creates immutable tunnel settings. */
  public TunnelSettings(String host, int port, String user, String password) {
    this.host = host;
    this.port = port;
    this.user = user;
    this.password = password;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public String getUser() {
    return user;
  }

  /** Password, or the empty string for key-based authentication. */
  public String getPassword() {
    return password;
  }

  public boolean hasPassword() {
    return null != password && !password.isEmpty();
  }

  @Override
  public String toString() {
    return user + "@" + host + ":" + port;
  }
}
