/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import com.google.auth.oauth2.GoogleCredentials;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Access tokens of a service account, refreshed shortly before they
 * expire.
 */
public class ServiceAccountTokenProvider implements AccessTokenProvider {

  static final List<String> SCOPES = Arrays.asList(
      "https://www.googleapis.com/auth/spreadsheets",
      "https://www.googleapis.com/auth/drive.file");

  private final GoogleCredentials credentials;

  ServiceAccountTokenProvider(GoogleCredentials credentials) {
    this.credentials = credentials;
  }

  /** Reads the service account key file at the given path. */
  public static ServiceAccountTokenProvider fromKeyFile(Path keyFile)
      throws IOException {
    try (InputStream in = Files.newInputStream(keyFile)) {
      return new ServiceAccountTokenProvider(
          GoogleCredentials.fromStream(in).createScoped(SCOPES));
    }
  }

  @Override
  public synchronized String getAccessToken() throws IOException {
    credentials.refreshIfExpired();
    if (null == credentials.getAccessToken()) {
      throw new IOException("Service account did not yield a token.");
    }
    return credentials.getAccessToken().getTokenValue();
  }
}
