/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import java.io.IOException;

/**
 * Encrypted hop that forwards a local loopback port to a remote endpoint.
 */
public interface Tunnel {

  /**
   * Opens the tunnel.
   *
   * @return Local port on {@code 127.0.0.1} forwarding to the remote
   *     endpoint.
   */
  int open(String remoteHost, int remotePort) throws IOException;

  /** Closes the tunnel; never throws. */
  void close();

}
