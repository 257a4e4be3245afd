/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Chooses the tunnel implementation from platform capabilities.
 *
 * <p>The external OpenSSH client is used where it exists, and, for
 * password authentication, where {@code sshpass} exists as well. Everywhere
 * else, including on Windows, the embedded client is used.</p>
 */
public class TunnelFactory {

  private static final Logger logger =
      LoggerFactory.getLogger(TunnelFactory.class);

  private final boolean windows;

  private final String searchPath;

  /** Creates a factory for the running platform. */
  public static TunnelFactory forPlatform() {
    return new TunnelFactory(System.getProperty("os.name", ""),
        System.getenv("PATH"));
  }

  TunnelFactory(String osName, String searchPath) {
    this.windows = osName.toLowerCase(Locale.ROOT).startsWith("windows");
    this.searchPath = null == searchPath ? "" : searchPath;
  }

  /** Returns a new, unopened tunnel for the given hop. */
  public Tunnel create(TunnelSettings settings) {
    if (usesOpenSsh(settings)) {
      logger.debug("Using OpenSSH client for tunnel via {}.",
          settings.getHost());
      return new OpenSshTunnel(settings);
    }
    logger.debug("Using embedded SSH client for tunnel via {}.",
        settings.getHost());
    return new JschTunnel(settings);
  }

  boolean usesOpenSsh(TunnelSettings settings) {
    if (windows || !isExecutableOnPath("ssh")) {
      return false;
    }
    return !settings.hasPassword() || isExecutableOnPath("sshpass");
  }

  boolean isExecutableOnPath(String name) {
    for (String dir : searchPath.split(File.pathSeparator)) {
      if (dir.isEmpty()) {
        continue;
      }
      Path candidate = Paths.get(dir, name);
      if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
        return true;
      }
    }
    return false;
  }
}
