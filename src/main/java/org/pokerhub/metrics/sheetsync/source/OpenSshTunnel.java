/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Tunnel through an external {@code ssh -N -L} process. Password
 * authentication goes through {@code sshpass -e}, which reads the password
 * from the environment rather than the command line.
 */
public class OpenSshTunnel implements Tunnel {

  private static final Logger logger =
      LoggerFactory.getLogger(OpenSshTunnel.class);

  private static final long READY_TIMEOUT_MILLIS = 15_000L;

  private static final long POLL_MILLIS = 100L;

  private final TunnelSettings settings;

  private Process process;

  public OpenSshTunnel(TunnelSettings settings) {
    this.settings = settings;
  }

  @Override
  public int open(String remoteHost, int remotePort) throws IOException {
    int localPort = freeLocalPort();
    ProcessBuilder pb = new ProcessBuilder(
        command(localPort, remoteHost, remotePort));
    if (settings.hasPassword()) {
      pb.environment().put("SSHPASS", settings.getPassword());
    }
    pb.redirectErrorStream(true);
    pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    Process started = pb.start();
    long deadline = System.currentTimeMillis() + READY_TIMEOUT_MILLIS;
    try {
      while (!isListening(localPort)) {
        if (!started.isAlive()) {
          throw new IOException("ssh exited with code "
              + started.exitValue() + " before the tunnel via "
              + settings.getHost() + " was ready.");
        }
        if (System.currentTimeMillis() > deadline) {
          throw new IOException("Tunnel via " + settings.getHost()
              + " not ready after " + READY_TIMEOUT_MILLIS + " ms.");
        }
        Thread.sleep(POLL_MILLIS);
      }
    } catch (InterruptedException e) {
      started.destroy();
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while opening tunnel.", e);
    } catch (IOException e) {
      started.destroy();
      throw e;
    }
    this.process = started;
    return localPort;
  }

  List<String> command(int localPort, String remoteHost, int remotePort) {
    List<String> cmd = new ArrayList<>();
    if (settings.hasPassword()) {
      cmd.add("sshpass");
      cmd.add("-e");
    }
    cmd.add("ssh");
    cmd.add("-N");
    cmd.add("-o");
    cmd.add("ExitOnForwardFailure=yes");
    cmd.add("-o");
    cmd.add("StrictHostKeyChecking=no");
    cmd.add("-o");
    cmd.add("ServerAliveInterval=30");
    if (!settings.hasPassword()) {
      cmd.add("-o");
      cmd.add("BatchMode=yes");
    }
    cmd.add("-p");
    cmd.add(String.valueOf(settings.getPort()));
    cmd.add("-L");
    cmd.add("127.0.0.1:" + localPort + ":" + remoteHost + ":" + remotePort);
    cmd.add(settings.getUser() + "@" + settings.getHost());
    return cmd;
  }

  private static int freeLocalPort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0, 1,
        InetAddress.getLoopbackAddress())) {
      return socket.getLocalPort();
    }
  }

  private static boolean isListening(int port) {
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(InetAddress.getLoopbackAddress(),
          port), (int) POLL_MILLIS);
      return true;
    } catch (IOException e) {
      return false;
    }
  }

  @Override
  public void close() {
    if (null == process) {
      return;
    }
    process.destroy();
    try {
      if (!process.waitFor(5, TimeUnit.SECONDS)) {
        process.destroyForcibly();
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
    }
    process = null;
    logger.debug("Closed SSH tunnel via {}.", settings.getHost());
  }
}
