/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Tunnel through the embedded SSH client.
 */
public class JschTunnel implements Tunnel {

  private static final Logger logger =
      LoggerFactory.getLogger(JschTunnel.class);

  private static final int CONNECT_TIMEOUT_MILLIS = 15_000;

  private static final int KEEPALIVE_MILLIS = 30_000;

  private final TunnelSettings settings;

  private Session session;

  public JschTunnel(TunnelSettings settings) {
    this.settings = settings;
  }

  @Override
  public int open(String remoteHost, int remotePort) throws IOException {
    Session opening = null;
    try {
      JSch jsch = new JSch();
      opening = jsch.getSession(settings.getUser(),
          settings.getHost(), settings.getPort());
      if (settings.hasPassword()) {
        opening.setPassword(settings.getPassword());
      }
      opening.setConfig("StrictHostKeyChecking", "no");
      opening.setServerAliveInterval(KEEPALIVE_MILLIS);
      opening.connect(CONNECT_TIMEOUT_MILLIS);
      int localPort = opening.setPortForwardingL("127.0.0.1", 0, remoteHost,
          remotePort);
      this.session = opening;
      return localPort;
    } catch (JSchException e) {
      if (null != opening) {
        opening.disconnect();
      }
      throw new IOException("Cannot open SSH tunnel via "
          + settings.getHost() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    if (null != session) {
      session.disconnect();
      session = null;
      logger.debug("Closed SSH tunnel via {}.", settings.getHost());
    }
  }
}
