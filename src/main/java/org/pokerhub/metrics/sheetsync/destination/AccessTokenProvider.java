/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import java.io.IOException;

/**
 * Source of bearer tokens for the destination API.
 */
@FunctionalInterface
public interface AccessTokenProvider {

  /** Returns a currently valid access token. */
  String getAccessToken() throws IOException;

}
