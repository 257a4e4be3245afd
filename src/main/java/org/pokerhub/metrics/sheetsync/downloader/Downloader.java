/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.downloader;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * Exchanges request and response bodies with HTTP servers.
 */
public class Downloader {

  static final String JSON = "application/json; charset=utf-8";

  private static final int MAX_ERROR_EXCERPT = 500;

  private final int timeoutMillis;

  /**
   * Creates a downloader.
   *
   * @param timeoutMillis Connect and read timeout of each request.
   */
  public Downloader(int timeoutMillis) {
    this.timeoutMillis = timeoutMillis;
  }

  /**
   * Download the given URL and return downloaded bytes.
   *
   * @throws HttpStatusException Thrown if the server does not answer with a
   *     2xx status code.
   * @throws IOException Thrown if anything else goes wrong while
   *     downloading.
   */
  public byte[] get(URL url, Map<String, String> headers) throws IOException {
    return exchange("GET", url, headers, null);
  }

  /** Send the given JSON body via POST and return the response bytes. */
  public byte[] postJson(URL url, Map<String, String> headers, byte[] body)
      throws IOException {
    return exchange("POST", url, headers, body);
  }

  /** Send the given JSON body via PUT and return the response bytes. */
  public byte[] putJson(URL url, Map<String, String> headers, byte[] body)
      throws IOException {
    return exchange("PUT", url, headers, body);
  }

  /** Download the given URL without extra request headers. */
  public byte[] get(URL url) throws IOException {
    return get(url, Collections.<String, String>emptyMap());
  }

  private byte[] exchange(String method, URL url, Map<String, String> headers,
      byte[] body) throws IOException {
    HttpURLConnection huc = (HttpURLConnection) url.openConnection();
    try {
      huc.setRequestMethod(method);
      huc.setConnectTimeout(timeoutMillis);
      huc.setReadTimeout(timeoutMillis);
      huc.setRequestProperty("Accept", "application/json");
      for (Map.Entry<String, String> header : headers.entrySet()) {
        huc.setRequestProperty(header.getKey(), header.getValue());
      }
      if (null != body) {
        huc.setDoOutput(true);
        huc.setRequestProperty("Content-Type", JSON);
        try (OutputStream out = huc.getOutputStream()) {
          out.write(body);
        }
      }
      huc.connect();
      int response = huc.getResponseCode();
      if (response < 200 || response >= 300) {
        throw new HttpStatusException(method, url, response,
            excerpt(huc.getErrorStream()));
      }
      return readFully(huc.getInputStream());
    } finally {
      huc.disconnect();
    }
  }

  private static byte[] readFully(InputStream stream) throws IOException {
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    if (null == stream) {
      return downloadedBytes.toByteArray();
    }
    try (BufferedInputStream in = new BufferedInputStream(stream)) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }

  private static String excerpt(InputStream errorStream) {
    try {
      String text = new String(readFully(errorStream),
          StandardCharsets.UTF_8);
      return text.length() > MAX_ERROR_EXCERPT
          ? text.substring(0, MAX_ERROR_EXCERPT) : text;
    } catch (IOException e) {
      return "(error body unreadable: " + e.getMessage() + ")";
    }
  }
}
