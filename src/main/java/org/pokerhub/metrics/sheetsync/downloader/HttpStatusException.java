/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.downloader;

import java.io.IOException;
import java.net.URL;

/**
 * Thrown when a server answers with a status code outside of 2xx.
 */
public class HttpStatusException extends IOException {

  private static final long serialVersionUID = 6183902741183405617L;

  private final int statusCode;

  private final String responseBody;

  /** Creates an exception for the given exchange. */
  public HttpStatusException(String method, URL url, int statusCode,
      String responseBody) {
    super(method + " " + url + " returned status " + statusCode
        + (responseBody.isEmpty() ? "" : ": " + responseBody));
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
